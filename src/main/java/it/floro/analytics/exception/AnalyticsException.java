package it.floro.analytics.exception;

/**
 * Radice della gerarchia di eccezioni della pipeline di analisi.
 *
 * Tutte le eccezioni sono unchecked: solo {@link ValidationException} e
 * {@link ConfigurationException} escono da una richiesta di analisi, le altre
 * vengono catturate e riportate come sezioni fallite nel risultato.
 */
public class AnalyticsException extends RuntimeException {

    public AnalyticsException(String message) {
        super(message);
    }

    public AnalyticsException(String message, Throwable cause) {
        super(message, cause);
    }
}
