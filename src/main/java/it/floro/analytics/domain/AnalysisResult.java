package it.floro.analytics.domain;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Risultato immutabile di un'analisi, serializzato così com'è da storage e API.
 *
 * I nomi JSON sono snake_case e stabili. Le tre sezioni sono sempre presenti.
 * Mappe e liste annidate nei parametri vengono copiate in viste non modificabili.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonPropertyOrder({"id", "type", "dataset_id", "dataset_source", "created_at", "parameters",
        "summary", "evaluation", "anomalies", "trends", "warnings"})
public record AnalysisResult(
        String id,                              // Identificativo univoco del risultato
        AnalysisType type,
        String datasetId,
        String datasetSource,
        Instant createdAt,
        Map<String, Object> parameters,         // Parametri risolti, pulizia e normalizzazione incluse
        SeriesSummary summary,                  // null se la pulizia è fallita
        Section<EvaluationReport> evaluation,
        Section<AnomalyReport> anomalies,
        Section<TrendReport> trends,
        List<PipelineWarning> warnings
) {

    public AnalysisResult {
        parameters = freeze(parameters);
        warnings = List.copyOf(warnings);
    }

    // I valori null (es. lower_bound senza outlier) sono ammessi, quindi niente Map.copyOf
    private static Map<String, Object> freeze(Map<?, ?> map) {
        Map<String, Object> copy = new LinkedHashMap<>();
        map.forEach((k, v) -> copy.put(String.valueOf(k), freezeValue(v)));
        return Collections.unmodifiableMap(copy);
    }

    private static Object freezeValue(Object v) {
        if (v instanceof Map<?, ?> m) {
            return freeze(m);
        }
        if (v instanceof Collection<?> c) {
            List<Object> copy = new ArrayList<>(c.size());
            for (Object o : c) {
                copy.add(freezeValue(o));
            }
            return Collections.unmodifiableList(copy);
        }
        return v;
    }
}
