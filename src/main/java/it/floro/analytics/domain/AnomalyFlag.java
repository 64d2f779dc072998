package it.floro.analytics.domain;

import java.time.Instant;

public record AnomalyFlag(
        Instant timestamp,
        int position,           // Indice nella serie pulita
        double value,           // Valore osservato (unità originali)
        double baseline,        // Valore atteso (mediana o media)
        double score,           // Deviazione in unità di scala robusta
        boolean flagged         // score > sensitivity
) {
}
