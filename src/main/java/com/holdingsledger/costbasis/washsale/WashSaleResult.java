package com.holdingsledger.costbasis.washsale;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.List;

/**
 * Outcome of a wash-sale check for one loss sale. The matching-buy fields describe the preferred
 * replacement buy and are null when {@code isWashSale} is false. {@code daysFromSell} is negative
 * when that buy preceded the sale.
 */
public record WashSaleResult(
        boolean isWashSale,
        BigDecimal disallowedLoss,
        String matchingBuyId,
        LocalDate matchingBuyDate,
        BigDecimal matchingBuyQty,
        Long daysFromSell,
        List<String> replacementBuyIds
) {

    private static final WashSaleResult NONE =
            new WashSaleResult(false, BigDecimal.ZERO, null, null, null, null, List.of());

    public WashSaleResult {
        replacementBuyIds = replacementBuyIds != null ? List.copyOf(replacementBuyIds) : List.of();
    }

    public static WashSaleResult none() {
        return NONE;
    }

    /** One-line warning for display; empty when this is not a wash sale. */
    public String warningMessage() {
        if (!isWashSale) {
            return "";
        }
        long days = daysFromSell != null ? daysFromSell : 0;
        String direction = days > 0 ? "after" : "before";
        return "Wash Sale: $" + disallowedLoss.setScale(2, RoundingMode.HALF_UP).toPlainString()
                + " loss disallowed due to purchase of " + matchingBuyQty.stripTrailingZeros().toPlainString()
                + " shares " + Math.abs(days) + " days " + direction + " this sale.";
    }
}
