package it.floro.analytics.exception;

/**
 * La politica di imputazione non riesce a risolvere i valori mancanti.
 */
public class ImputationException extends AnalyticsException {

    public ImputationException(String message) {
        super(message);
    }
}
