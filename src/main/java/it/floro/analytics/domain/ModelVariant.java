package it.floro.analytics.domain;

import com.fasterxml.jackson.annotation.JsonValue;
import it.floro.analytics.exception.ConfigurationException;

/**
 * Insieme chiuso delle varianti di modello di regressione disponibili.
 */
public enum ModelVariant {
    RANDOM_FOREST("random-forest"),             // Ensemble di alberi su campioni bootstrap
    GRADIENT_BOOSTING("gradient-boosting"),     // Alberi aggiunti in sequenza sui residui
    SUPPORT_VECTOR("svr");                      // Regressione epsilon-insensitive con kernel RBF

    private final String code;

    ModelVariant(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public static ModelVariant fromCode(String s) {
        return switch (OutlierMethod.normalizeCode(s)) {
            case "random-forest", "randomforest", "rf" -> RANDOM_FOREST;
            case "gradient-boosting", "gradientboosting", "gb", "gbm" -> GRADIENT_BOOSTING;
            case "svr", "svm", "support-vector" -> SUPPORT_VECTOR;
            default -> throw new ConfigurationException("Variante di modello sconosciuta: " + s);
        };
    }
}
