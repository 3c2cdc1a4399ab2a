package com.holdingsledger.costbasis.engine;

import java.math.BigDecimal;
import java.util.List;

/**
 * Per-lot allocation of one sale with its totals. {@code quantityAllocated} may be less than the
 * requested sell quantity when the lots run out.
 */
public record SellResult(
        List<SellAllocation> allocations,
        BigDecimal quantityAllocated,
        BigDecimal totalCostBasis,
        BigDecimal totalProceeds,
        BigDecimal totalGainLoss,
        BigDecimal longTermGain,
        BigDecimal shortTermGain
) {

    public SellResult {
        allocations = List.copyOf(allocations);
    }
}
