package it.floro.analytics.model;

import it.floro.analytics.exception.ConfigurationException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Lettura tipizzata degli iperparametri di un modello.
 *
 * Tiene traccia delle chiavi lette: quelle rimaste sono sconosciute al modello e
 * vengono segnalate come avvisi, non come errori. Valori del tipo sbagliato o fuori
 * intervallo producono {@link ConfigurationException}.
 */
public final class Hyperparameters {

    private final String model;
    private final Map<String, Object> values;
    private final Set<String> consumed = new HashSet<>();

    public Hyperparameters(String model, Map<String, Object> values) {
        this.model = model;
        this.values = values;
    }

    public int intValue(String key, int defaultValue, int min) {
        consumed.add(key);
        Object v = values.get(key);
        if (v == null) {
            return defaultValue;
        }
        int out;
        if (v instanceof Number num && num.doubleValue() == Math.rint(num.doubleValue())) {
            if (num.doubleValue() < Integer.MIN_VALUE || num.doubleValue() > Integer.MAX_VALUE) {
                throw invalid(key, v, null);
            }
            out = num.intValue();
        } else if (v instanceof String s) {
            try {
                out = Integer.parseInt(s.trim());
            } catch (NumberFormatException e) {
                throw invalid(key, v, e);
            }
        } else {
            throw invalid(key, v, null);
        }
        if (out < min) {
            throw new ConfigurationException(String.format("%s: %s deve essere >= %d, ricevuto %d",
                    model, key, min, out));
        }
        return out;
    }

    public long longValue(String key, long defaultValue) {
        consumed.add(key);
        Object v = values.get(key);
        if (v == null) {
            return defaultValue;
        }
        if (v instanceof Number num) {
            return num.longValue();
        }
        try {
            return Long.parseLong(v.toString().trim());
        } catch (NumberFormatException e) {
            throw invalid(key, v, e);
        }
    }

    /**
     * @param lo Limite inferiore escluso
     * @param hi Limite superiore incluso
     */
    public double doubleValue(String key, double defaultValue, double lo, double hi) {
        consumed.add(key);
        Object v = values.get(key);
        if (v == null) {
            return defaultValue;
        }
        double out = parseDouble(key, v);
        if (!(out > lo && out <= hi)) {
            throw new ConfigurationException(String.format("%s: %s fuori dall'intervallo (%s, %s]: %s",
                    model, key, lo, hi, out));
        }
        return out;
    }

    /**
     * Legge un valore che può essere numerico oppure una parola chiave.
     *
     * @return Il valore grezzo (Number o String in minuscolo), oppure il default
     */
    public Object numberOrKeyword(String key, String defaultKeyword, Set<String> keywords) {
        consumed.add(key);
        Object v = values.get(key);
        if (v == null) {
            return defaultKeyword;
        }
        if (v instanceof Number num) {
            if (!(num.doubleValue() > 0.0) || !Double.isFinite(num.doubleValue())) {
                throw invalid(key, v, null);
            }
            return num.doubleValue();
        }
        String s = v.toString().trim().toLowerCase();
        if (keywords.contains(s)) {
            return s;
        }
        double d = parseDouble(key, v);
        if (!(d > 0.0)) {
            throw invalid(key, v, null);
        }
        return d;
    }

    public List<String> unknownKeys() {
        List<String> out = new ArrayList<>();
        for (String k : values.keySet()) {
            if (!consumed.contains(k)) {
                out.add(k);
            }
        }
        return out;
    }

    private double parseDouble(String key, Object v) {
        double out;
        if (v instanceof Number num) {
            out = num.doubleValue();
        } else {
            try {
                out = Double.parseDouble(v.toString().trim());
            } catch (NumberFormatException e) {
                throw invalid(key, v, e);
            }
        }
        if (!Double.isFinite(out)) {
            throw invalid(key, v, null);
        }
        return out;
    }

    private ConfigurationException invalid(String key, Object v, Throwable cause) {
        String msg = String.format("%s: valore non valido per %s: %s", model, key, v);
        return cause == null ? new ConfigurationException(msg) : new ConfigurationException(msg, cause);
    }
}
