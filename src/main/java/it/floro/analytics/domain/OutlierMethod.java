package it.floro.analytics.domain;

import com.fasterxml.jackson.annotation.JsonValue;
import it.floro.analytics.exception.ConfigurationException;

public enum OutlierMethod {
    IQR("iqr"),             // Fuori da [Q1 - k·IQR, Q3 + k·IQR]
    Z_SCORE("z-score"),     // |x - media| / std oltre soglia
    NONE("none");           // Nessuna rilevazione

    private final String code;

    OutlierMethod(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public static OutlierMethod fromCode(String s) {
        return switch (normalizeCode(s)) {
            case "iqr" -> IQR;
            case "z-score", "zscore" -> Z_SCORE;
            case "none" -> NONE;
            default -> throw new ConfigurationException("Metodo outlier sconosciuto: " + s);
        };
    }

    static String normalizeCode(String s) {
        return s == null ? "" : s.trim().toLowerCase().replace('_', '-');
    }
}
