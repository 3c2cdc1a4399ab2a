package com.holdingsledger.costbasis.report;

import java.math.BigDecimal;
import java.util.List;

/**
 * Open holdings marked to market, largest current value first.
 */
public record PortfolioValuation(
        List<HoldingValuation> holdings,
        BigDecimal totalValue,
        BigDecimal totalCostBasis,
        BigDecimal unrealizedGain,
        BigDecimal unrealizedGainPercent,
        List<String> symbolsWithoutPrice
) {

    public PortfolioValuation {
        holdings = List.copyOf(holdings);
        symbolsWithoutPrice = List.copyOf(symbolsWithoutPrice);
    }
}
