package it.floro.analytics.domain;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;

/**
 * Statistiche descrittive della serie pulita (unità originali).
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SeriesSummary(
        int count,
        Instant start,
        Instant end,
        double mean,
        double std,                 // Deviazione standard campionaria (0 con un solo punto)
        double min,
        double max,
        double median,
        Double skewness,            // null con meno di 3 punti
        Double kurtosis,            // null con meno di 4 punti
        int outlierCount,           // Punti fuori dai limiti IQR (k = 1.5)
        double slopePerStep,        // Pendenza globale per passo
        TrendDirection direction
) {
}
