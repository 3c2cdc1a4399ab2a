package com.holdingsledger.costbasis.config;

import com.holdingsledger.costbasis.washsale.WashSaleMatchPolicy;
import com.holdingsledger.domain.CostBasisMethod;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;

/**
 * Cost-basis engine configuration. Documented in application.yml under holdingsledger.costbasis.
 */
@ConfigurationProperties(prefix = "holdingsledger.costbasis")
@Getter
@Setter
public class CostBasisProperties {

    /**
     * Lot selection method when the caller does not pick one.
     */
    private CostBasisMethod defaultMethod = CostBasisMethod.FIFO;

    /**
     * Quantity at or below which a position or lot counts as closed. Absorbs rounding in imported fractional shares.
     */
    private BigDecimal closeEpsilon = new BigDecimal("0.0001");

    /**
     * Long-term iff holding days are strictly greater than this.
     */
    private long longTermThresholdDays = 365;

    private WashSaleProperties washSale = new WashSaleProperties();

    private SummaryCacheProperties summaryCache = new SummaryCacheProperties();

    @Getter
    @Setter
    public static class WashSaleProperties {
        /** Calendar days on either side of a loss sale in which a replacement buy counts. */
        private long windowDays = 30;
        /** Which in-window replacement buys are charged against a loss sale. */
        private WashSaleMatchPolicy matchPolicy = WashSaleMatchPolicy.NEAREST_SINGLE;
    }

    @Getter
    @Setter
    public static class SummaryCacheProperties {
        private long ttlMinutes = 5;
        private long maximumSize = 1_000;
    }
}
