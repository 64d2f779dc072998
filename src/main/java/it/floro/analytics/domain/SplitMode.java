package it.floro.analytics.domain;

import com.fasterxml.jackson.annotation.JsonValue;
import it.floro.analytics.exception.ConfigurationException;

/**
 * Strategia di suddivisione delle righe in fold per la cross-validation.
 * In nessun caso le righe vengono mescolate.
 */
public enum SplitMode {
    BLOCKED("blocked"),                     // k blocchi contigui, ognuno validato sugli altri
    FORWARD_CHAINING("forward-chaining");   // Training espanso, validazione sempre successiva

    private final String code;

    SplitMode(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public static SplitMode fromCode(String s) {
        return switch (OutlierMethod.normalizeCode(s)) {
            case "blocked", "kfold", "k-fold" -> BLOCKED;
            case "forward-chaining", "forward" -> FORWARD_CHAINING;
            default -> throw new ConfigurationException("Modalità di split sconosciuta: " + s);
        };
    }
}
