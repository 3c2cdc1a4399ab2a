package com.holdingsledger.costbasis.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.holdingsledger.domain.ClosedPosition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Turns closed positions into export rows and serializes them as JSON.
 */
@Component
@Slf4j
public class ClosedPositionExporter {

    static final String STATUS_CLOSED = "CLOSED";
    static final String LONG_TERM = "Long-term Capital Gain";
    static final String SHORT_TERM = "Short-term Capital Gain";

    private final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    public List<ClosedPositionExport> toRows(List<ClosedPosition> closedPositions) {
        return closedPositions.stream().map(ClosedPositionExporter::toRow).toList();
    }

    public String toJson(List<ClosedPosition> closedPositions) {
        List<ClosedPositionExport> rows = toRows(closedPositions);
        try {
            return objectMapper.writeValueAsString(rows);
        } catch (JsonProcessingException e) {
            log.warn("Closed position export failed for {} rows: {}", rows.size(), e.getMessage());
            throw new IllegalStateException("Cannot serialize closed positions", e);
        }
    }

    static ClosedPositionExport toRow(ClosedPosition position) {
        return new ClosedPositionExport(
                position.symbol(),
                STATUS_CLOSED,
                position.totalSharesBought(),
                position.totalSharesSold(),
                position.totalCostBasis(),
                position.totalProceeds(),
                position.totalFees(),
                position.realizedGain(),
                position.realizedGainPercent(),
                position.firstBuyDate(),
                position.lastSellDate(),
                position.holdingPeriodDays(),
                position.isLongTerm() ? LONG_TERM : SHORT_TERM);
    }
}
