package com.holdingsledger.costbasis.engine;

import com.holdingsledger.domain.ClosedPosition;
import com.holdingsledger.domain.Holding;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Output of the average-cost aggregation: open holdings keyed by symbol plus every closed cycle.
 * Realized totals cover closed positions only.
 */
public record PortfolioSummary(
        Map<String, Holding> openHoldings,
        List<ClosedPosition> closedPositions,
        BigDecimal totalRealizedGain,
        BigDecimal totalRealizedGainLongTerm,
        BigDecimal totalRealizedGainShortTerm
) {

    public PortfolioSummary {
        openHoldings = openHoldings != null ? openHoldings : Map.of();
        closedPositions = closedPositions != null ? List.copyOf(closedPositions) : List.of();
    }
}
