package it.floro.analytics.domain;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Record che rappresenta una singola misurazione di una serie climatica.
 *
 * Il valore mancante è rappresentato esplicitamente da {@code value == null};
 * valori non finiti (NaN, infinito) sono trattati come non validi e gestiti
 * dalla pulizia come se fossero mancanti.
 *
 * I metadati sono una mappa opzionale di valori scalari (String, Number, Boolean),
 * verificata dal validatore prima di qualsiasi elaborazione.
 */
public record DataPoint(
        Instant timestamp,                  // Istante della misurazione
        Double value,                       // Valore misurato (null = mancante)
        Map<String, Object> metadata        // Metadati scalari opzionali (stazione, unità, ...)
) {

    public DataPoint {
        metadata = (metadata == null || metadata.isEmpty())
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static DataPoint of(Instant timestamp, double value) {
        return new DataPoint(timestamp, value, null);
    }

    public static DataPoint missing(Instant timestamp) {
        return new DataPoint(timestamp, null, null);
    }

    /**
     * @return true se il valore è assente o non finito
     */
    public boolean isMissing() {
        return value == null || !Double.isFinite(value);
    }
}
