package it.floro.analytics.domain;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TrendSegment(
        Instant start,              // Primo timestamp della finestra
        Instant end,                // Ultimo timestamp effettivo della finestra
        int pointCount,
        double slope,               // Unità originali per unità di pendenza
        Double ciLower,             // null se l'intervallo non è stimabile
        Double ciUpper,
        TrendStatus status,
        TrendDirection direction
) {
}
