package com.holdingsledger.costbasis.report;

import java.math.BigDecimal;

/**
 * One open holding marked to market. When no quote exists the average cost stands in for the price
 * ({@code priceAvailable=false}), which shows as zero unrealized gain.
 */
public record HoldingValuation(
        String symbol,
        BigDecimal shares,
        BigDecimal currentPrice,
        boolean priceAvailable,
        BigDecimal currentValue,
        BigDecimal costBasis,
        BigDecimal unrealizedGain,
        BigDecimal unrealizedGainPercent
) {
}
