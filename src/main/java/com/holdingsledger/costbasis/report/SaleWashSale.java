package com.holdingsledger.costbasis.report;

import com.holdingsledger.costbasis.washsale.WashSaleResult;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Wash-sale finding attached to one in-range loss sale.
 */
public record SaleWashSale(
        String saleTransactionId,
        String symbol,
        LocalDate saleDate,
        BigDecimal saleLoss,
        WashSaleResult washSale
) {
}
