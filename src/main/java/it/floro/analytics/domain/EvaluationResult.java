package it.floro.analytics.domain;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Risultato della cross-validation di una variante di modello.
 *
 * {@code metrics} contiene sempre le chiavi mae, rmse, mse, r2; il valore è null
 * se nessun fold è riuscito. Metriche e previsione sono nelle unità originali della serie. Importanza e previsione provengono dal modello
 * ristimato su tutte le righe e sono null se quel fit non è possibile.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EvaluationResult(
        ModelVariant model,
        Map<String, Object> hyperparameters,
        List<FoldResult> folds,
        Map<String, MetricSummary> metrics,
        int failedFolds,
        Map<String, Double> featureImportance,
        Double forecast                         // Previsione a un passo, unità originali
) {

    public EvaluationResult {
        hyperparameters = Collections.unmodifiableMap(new LinkedHashMap<>(hyperparameters));
        folds = List.copyOf(folds);
        metrics = Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
        featureImportance = featureImportance == null
                ? null
                : Collections.unmodifiableMap(new LinkedHashMap<>(featureImportance));
    }

    public boolean hasSuccessfulFold() {
        return failedFolds < folds.size();
    }

    public Double meanMae() {
        MetricSummary s = metrics.get("mae");
        return s == null ? null : s.mean();
    }
}
