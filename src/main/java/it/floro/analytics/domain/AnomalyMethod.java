package it.floro.analytics.domain;

import com.fasterxml.jackson.annotation.JsonValue;
import it.floro.analytics.exception.ConfigurationException;

public enum AnomalyMethod {
    ROLLING_MAD("rolling-mad"),     // Mediana mobile centrata e MAD robusta
    Z_SCORE("z-score"),             // Media e deviazione standard globali
    ISOLATION_FOREST("isolation-forest");   // Cammino medio negli alberi di isolamento

    private final String code;

    AnomalyMethod(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public static AnomalyMethod fromCode(String s) {
        return switch (OutlierMethod.normalizeCode(s)) {
            case "rolling-mad", "mad" -> ROLLING_MAD;
            case "z-score", "zscore" -> Z_SCORE;
            case "isolation-forest", "isolationforest", "iforest" -> ISOLATION_FOREST;
            default -> throw new ConfigurationException("Metodo di anomalia sconosciuto: " + s);
        };
    }
}
