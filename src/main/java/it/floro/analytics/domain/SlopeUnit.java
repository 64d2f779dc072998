package it.floro.analytics.domain;

import com.fasterxml.jackson.annotation.JsonValue;
import it.floro.analytics.exception.ConfigurationException;

/**
 * Unità dell'asse x usata per esprimere la pendenza di un trend.
 */
public enum SlopeUnit {
    STEP("step", 0),            // Indice del punto nella finestra
    HOUR("hour", 3_600),
    DAY("day", 86_400);

    private final String code;
    private final long seconds;

    SlopeUnit(String code, long seconds) {
        this.code = code;
        this.seconds = seconds;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /**
     * @return Durata dell'unità in secondi (0 per STEP, che non dipende dal tempo)
     */
    public long seconds() {
        return seconds;
    }

    public static SlopeUnit fromCode(String s) {
        return switch (OutlierMethod.normalizeCode(s)) {
            case "step", "index" -> STEP;
            case "hour", "hours" -> HOUR;
            case "day", "days" -> DAY;
            default -> throw new ConfigurationException("Unità di pendenza sconosciuta: " + s);
        };
    }
}
