package it.floro.analytics.domain;

import com.fasterxml.jackson.annotation.JsonValue;
import it.floro.analytics.exception.ConfigurationException;

public enum OutlierAction {
    IMPUTE("impute"),   // Outlier marcati e risolti dall'imputazione
    DROP("drop");       // Outlier rimossi dalla serie

    private final String code;

    OutlierAction(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public static OutlierAction fromCode(String s) {
        return switch (OutlierMethod.normalizeCode(s)) {
            case "impute" -> IMPUTE;
            case "drop" -> DROP;
            default -> throw new ConfigurationException("Azione outlier sconosciuta: " + s);
        };
    }
}
