package com.holdingsledger.costbasis.report;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Realized gain of one sale against one lot.
 */
public record RealizedGainDetail(
        String symbol,
        String saleTransactionId,
        String lotId,
        LocalDate saleDate,
        LocalDate acquisitionDate,
        long holdingDays,
        boolean isLongTerm,
        BigDecimal sharesSold,
        BigDecimal proceeds,
        BigDecimal costBasis,
        BigDecimal gain,
        BigDecimal gainPercent
) {
}
