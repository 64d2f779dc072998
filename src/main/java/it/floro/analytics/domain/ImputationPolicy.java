package it.floro.analytics.domain;

import com.fasterxml.jackson.annotation.JsonValue;
import it.floro.analytics.exception.ConfigurationException;

public enum ImputationPolicy {
    MEAN("mean"),
    MEDIAN("median"),
    FORWARD_FILL("forward-fill"),
    LINEAR_INTERPOLATE("linear-interpolate");

    private final String code;

    ImputationPolicy(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public static ImputationPolicy fromCode(String s) {
        return switch (OutlierMethod.normalizeCode(s)) {
            case "mean" -> MEAN;
            case "median" -> MEDIAN;
            case "forward-fill", "ffill" -> FORWARD_FILL;
            case "linear-interpolate", "linear", "interpolate" -> LINEAR_INTERPOLATE;
            default -> throw new ConfigurationException("Politica di imputazione sconosciuta: " + s);
        };
    }
}
