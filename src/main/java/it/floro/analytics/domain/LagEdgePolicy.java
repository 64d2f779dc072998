package it.floro.analytics.domain;

import com.fasterxml.jackson.annotation.JsonValue;
import it.floro.analytics.exception.ConfigurationException;

/**
 * Trattamento delle prime righe prive di storico sufficiente per i lag.
 */
public enum LagEdgePolicy {
    DROP("drop"),   // Le prime max(lag) righe vengono scartate
    FILL("fill");   // I lag mancanti prendono il primo valore della serie

    private final String code;

    LagEdgePolicy(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public static LagEdgePolicy fromCode(String s) {
        return switch (OutlierMethod.normalizeCode(s)) {
            case "drop" -> DROP;
            case "fill" -> FILL;
            default -> throw new ConfigurationException("Politica lag sconosciuta: " + s);
        };
    }
}
