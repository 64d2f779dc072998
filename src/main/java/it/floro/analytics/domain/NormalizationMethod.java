package it.floro.analytics.domain;

import com.fasterxml.jackson.annotation.JsonValue;
import it.floro.analytics.exception.ConfigurationException;

public enum NormalizationMethod {
    MIN_MAX("min-max"),
    Z_SCORE("z-score"),
    NONE("none");

    private final String code;

    NormalizationMethod(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public static NormalizationMethod fromCode(String s) {
        return switch (OutlierMethod.normalizeCode(s)) {
            case "min-max", "minmax" -> MIN_MAX;
            case "z-score", "zscore", "standard" -> Z_SCORE;
            case "none" -> NONE;
            default -> throw new ConfigurationException("Metodo di normalizzazione sconosciuto: " + s);
        };
    }
}
