package it.floro.analytics.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Richiesta di analisi così come arriva dal livello API: tipo e parametri liberi.
 */
public record AnalysisRequest(
        String type,                        // "trend" | "anomaly" | "model-eval"
        Map<String, Object> parameters      // Parametri snake_case, tutti opzionali
) {

    public AnalysisRequest {
        parameters = (parameters == null || parameters.isEmpty())
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public static AnalysisRequest of(String type) {
        return new AnalysisRequest(type, Map.of());
    }
}
