package com.holdingsledger.costbasis.report;

import com.holdingsledger.common.Decimals;

import java.math.BigDecimal;
import java.util.List;

/**
 * Totals over realized-gain details, split by holding term.
 */
public record RealizedGainSummary(
        BigDecimal totalGain,
        BigDecimal totalProceeds,
        BigDecimal totalCostBasis,
        BigDecimal longTermGain,
        BigDecimal longTermProceeds,
        BigDecimal longTermCostBasis,
        BigDecimal shortTermGain,
        BigDecimal shortTermProceeds,
        BigDecimal shortTermCostBasis,
        int totalTransactions,
        int longTermCount,
        int shortTermCount,
        BigDecimal totalDisallowedLoss
) {

    static RealizedGainSummary of(List<RealizedGainDetail> details, List<SaleWashSale> washSales) {
        List<RealizedGainDetail> longTerm = details.stream().filter(RealizedGainDetail::isLongTerm).toList();
        List<RealizedGainDetail> shortTerm = details.stream().filter(d -> !d.isLongTerm()).toList();
        return new RealizedGainSummary(
                Decimals.sum(details, RealizedGainDetail::gain),
                Decimals.sum(details, RealizedGainDetail::proceeds),
                Decimals.sum(details, RealizedGainDetail::costBasis),
                Decimals.sum(longTerm, RealizedGainDetail::gain),
                Decimals.sum(longTerm, RealizedGainDetail::proceeds),
                Decimals.sum(longTerm, RealizedGainDetail::costBasis),
                Decimals.sum(shortTerm, RealizedGainDetail::gain),
                Decimals.sum(shortTerm, RealizedGainDetail::proceeds),
                Decimals.sum(shortTerm, RealizedGainDetail::costBasis),
                details.size(),
                longTerm.size(),
                shortTerm.size(),
                Decimals.sum(washSales, w -> w.washSale().disallowedLoss()));
    }
}
