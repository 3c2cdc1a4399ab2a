package com.holdingsledger.costbasis.report;

import java.time.LocalDate;
import java.util.List;

/**
 * Realized gains for sales dated within [from, to], with wash-sale findings for the loss sales among them.
 */
public record RealizedGainReport(
        LocalDate from,
        LocalDate to,
        List<RealizedGainDetail> details,
        List<SaleWashSale> washSales,
        RealizedGainSummary summary
) {

    public RealizedGainReport {
        details = List.copyOf(details);
        washSales = List.copyOf(washSales);
    }
}
