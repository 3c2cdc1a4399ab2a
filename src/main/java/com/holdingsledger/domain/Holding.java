package com.holdingsledger.domain;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Open position derived from the running average-cost aggregation. Identity is the symbol only;
 * recomputed on every run. {@code costBasis} is aggregate, {@code avgCost} is per share.
 */
public record Holding(
        String symbol,
        BigDecimal quantity,
        BigDecimal costBasis,
        BigDecimal avgCost
) {

    public Holding {
        Objects.requireNonNull(symbol, "symbol");
        if (quantity == null || quantity.signum() < 0) {
            throw new IllegalArgumentException("Holding quantity must be non-negative, got: " + quantity);
        }
        costBasis = costBasis != null ? costBasis : BigDecimal.ZERO;
        avgCost = avgCost != null ? avgCost : BigDecimal.ZERO;
    }
}
