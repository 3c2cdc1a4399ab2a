package com.holdingsledger.config;

import com.holdingsledger.costbasis.config.CostBasisConfig;
import com.holdingsledger.costbasis.query.PortfolioSummaryService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(classes = {
        CaffeineConfig.class,
        CostBasisConfig.class
})
class CaffeineConfigTest {

    @Autowired
    CacheManager cacheManager;

    @Test
    @DisplayName("portfolio summary cache is created and usable")
    void summaryCacheCreatedAndUsed() {
        Cache cache = cacheManager.getCache(PortfolioSummaryService.PORTFOLIO_SUMMARY_CACHE);
        assertThat(cache).isNotNull();

        cache.put("alice|v1", "value1");
        assertThat(cache.get("alice|v1").get()).isEqualTo("value1");
    }
}
