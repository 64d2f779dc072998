package it.floro.analytics.domain;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * Sezione di valutazione dei modelli: un risultato per variante richiesta.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EvaluationReport(
        List<EvaluationResult> evaluations,
        ModelVariant bestModel,             // Variante con MAE medio minore (null se nessuna riuscita)
        List<String> features,              // Feature sopravvissute alla potatura
        int rows,                           // Righe usate per la valutazione
        SplitMode splitMode,
        int horizon
) {

    public EvaluationReport {
        evaluations = List.copyOf(evaluations);
        features = List.copyOf(features);
    }
}
