package it.floro.analytics.exception;

/**
 * Input malformato o insufficiente: errore del chiamante, non ritentabile
 * senza correggere il dataset.
 */
public class ValidationException extends AnalyticsException {

    public ValidationException(String message) {
        super(message);
    }
}
