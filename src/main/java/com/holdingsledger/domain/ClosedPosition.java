package com.holdingsledger.domain;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * One open-to-flat cycle of a symbol. A symbol that is bought again after closing
 * produces a separate ClosedPosition for the next cycle.
 *
 * <p>Proceeds are sell amounts net of their fees; cost basis is buy amounts plus their fees.
 * {@code holdingPeriodDays} runs from the first acquisition to the last disposal of the cycle.
 */
public record ClosedPosition(
        String symbol,
        BigDecimal totalSharesBought,
        BigDecimal totalSharesSold,
        BigDecimal totalCostBasis,
        BigDecimal totalProceeds,
        BigDecimal totalFees,
        BigDecimal realizedGain,
        BigDecimal realizedGainPercent,
        LocalDate firstBuyDate,
        LocalDate lastSellDate,
        long holdingPeriodDays,
        boolean isLongTerm,
        List<Transaction> transactions
) {

    public ClosedPosition {
        transactions = transactions != null ? List.copyOf(transactions) : List.of();
    }
}
