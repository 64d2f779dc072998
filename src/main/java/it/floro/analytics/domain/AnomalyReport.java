package it.floro.analytics.domain;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AnomalyReport(
        AnomalyMethod method,
        double sensitivity,
        int window,
        Double contamination,           // Quota attesa di anomalie, solo per isolation-forest
        int flaggedCount,
        List<AnomalyFlag> flags         // Uno per ogni punto, in ordine
) {

    public AnomalyReport {
        flags = List.copyOf(flags);
    }

    public List<AnomalyFlag> anomalies() {
        return flags.stream().filter(AnomalyFlag::flagged).toList();
    }
}
