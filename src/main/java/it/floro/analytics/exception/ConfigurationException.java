package it.floro.analytics.exception;

/**
 * Tipo di analisi, parametro o variante di modello sconosciuti o non validi.
 */
public class ConfigurationException extends AnalyticsException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
