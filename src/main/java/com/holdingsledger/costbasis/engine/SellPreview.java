package com.holdingsledger.costbasis.engine;

import java.math.BigDecimal;

/**
 * Dry-run allocation shown before a sale is confirmed. A sale larger than the available lots is
 * reported through {@code insufficientShares}/{@code shortfall}, not an exception.
 */
public record SellPreview(
        SellResult result,
        boolean insufficientShares,
        BigDecimal shortfall
) {
}
