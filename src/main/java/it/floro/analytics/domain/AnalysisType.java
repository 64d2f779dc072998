package it.floro.analytics.domain;

import com.fasterxml.jackson.annotation.JsonValue;
import it.floro.analytics.exception.ConfigurationException;

/**
 * Tipi di analisi supportati dalla pipeline.
 */
public enum AnalysisType {
    TREND("trend"),             // Pendenze per finestre temporali
    ANOMALY("anomaly"),         // Punteggio residuo per ogni punto
    MODEL_EVAL("model-eval");   // Cross-validation delle varianti di modello

    private final String code;

    AnalysisType(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /**
     * Parsing del tipo di analisi dalla richiesta.
     *
     * @param s Codice del tipo (case-insensitive)
     * @return Tipo corrispondente
     * @throws ConfigurationException se il tipo è assente o sconosciuto
     */
    public static AnalysisType fromCode(String s) {
        if (s == null || s.isBlank()) {
            throw new ConfigurationException("Tipo di analisi mancante");
        }
        return switch (s.trim().toLowerCase()) {
            case "trend" -> TREND;
            case "anomaly" -> ANOMALY;
            case "model-eval", "model_eval" -> MODEL_EVAL;
            default -> throw new ConfigurationException("Tipo di analisi sconosciuto: " + s);
        };
    }
}
