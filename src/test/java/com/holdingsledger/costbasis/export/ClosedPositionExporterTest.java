package com.holdingsledger.costbasis.export;

import com.holdingsledger.domain.ClosedPosition;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ClosedPositionExporterTest {

    private final ClosedPositionExporter exporter = new ClosedPositionExporter();

    @Test
    void toRows_mapsTaxTreatment() {
        List<ClosedPositionExport> rows = exporter.toRows(List.of(
                closed("AAPL", 396, true), closed("MSFT", 30, false)));

        assertThat(rows).extracting(ClosedPositionExport::taxTreatment)
                .containsExactly("Long-term Capital Gain", "Short-term Capital Gain");
        assertThat(rows).extracting(ClosedPositionExport::status).containsOnly("CLOSED");
        assertThat(rows.get(0).realizedGain()).isEqualByComparingTo("500");
    }

    @Test
    void toJson_writesIsoDatesInColumnOrder() {
        String json = exporter.toJson(List.of(closed("AAPL", 396, true)));

        assertThat(json).startsWith("[{\"symbol\":\"AAPL\",\"status\":\"CLOSED\"");
        assertThat(json).contains("\"firstBuyDate\":\"2023-01-01\"");
        assertThat(json).contains("\"lastSellDate\":\"2024-02-01\"");
        assertThat(json).contains("\"holdingPeriodDays\":396");
        assertThat(json).contains("\"taxTreatment\":\"Long-term Capital Gain\"");
    }

    @Test
    void toJson_emptyList() {
        assertThat(exporter.toJson(List.of())).isEqualTo("[]");
    }

    private static ClosedPosition closed(String symbol, long days, boolean longTerm) {
        return new ClosedPosition(symbol, BigDecimal.TEN, BigDecimal.TEN, new BigDecimal("1500"),
                new BigDecimal("2000"), BigDecimal.ZERO, new BigDecimal("500"), new BigDecimal("33.33"),
                LocalDate.of(2023, 1, 1), LocalDate.of(2024, 2, 1), days, longTerm, List.of());
    }
}
