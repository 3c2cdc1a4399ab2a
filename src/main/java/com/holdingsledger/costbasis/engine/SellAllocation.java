package com.holdingsledger.costbasis.engine;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * The part of a sale charged against one lot.
 */
public record SellAllocation(
        String lotId,
        BigDecimal quantitySold,
        BigDecimal costBasisAllocated,
        LocalDate acquiredDate,
        BigDecimal proceeds,
        BigDecimal gainLoss,
        boolean isLongTerm,
        long holdingDays
) {
}
