package com.holdingsledger.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.holdingsledger.costbasis.config.CostBasisProperties;
import com.holdingsledger.costbasis.query.PortfolioSummaryService;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Caffeine in-process caches. Sizes and TTLs come from holdingsledger.costbasis.summary-cache.
 */
@Configuration
@EnableCaching
public class CaffeineConfig {

    @Bean
    public CacheManager caffeineCacheManager(CostBasisProperties costBasisProperties) {
        CostBasisProperties.SummaryCacheProperties summaryCache = costBasisProperties.getSummaryCache();
        CaffeineCacheManager manager = new CaffeineCacheManager();
        manager.registerCustomCache(PortfolioSummaryService.PORTFOLIO_SUMMARY_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(summaryCache.getTtlMinutes(), TimeUnit.MINUTES)
                .maximumSize(summaryCache.getMaximumSize())
                .build());
        return manager;
    }
}
