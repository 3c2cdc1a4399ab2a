package com.holdingsledger.costbasis.export;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Flat, spreadsheet-friendly row for one closed position.
 */
@JsonPropertyOrder({"symbol", "status", "sharesBought", "sharesSold", "costBasis", "proceeds", "fees",
        "realizedGain", "realizedGainPercent", "firstBuyDate", "lastSellDate", "holdingPeriodDays", "taxTreatment"})
public record ClosedPositionExport(
        String symbol,
        String status,
        BigDecimal sharesBought,
        BigDecimal sharesSold,
        BigDecimal costBasis,
        BigDecimal proceeds,
        BigDecimal fees,
        BigDecimal realizedGain,
        BigDecimal realizedGainPercent,
        @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd") LocalDate firstBuyDate,
        @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd") LocalDate lastSellDate,
        long holdingPeriodDays,
        String taxTreatment
) {
}
