package it.floro.analytics.exception;

/**
 * Un modello non può essere addestrato sui dati di un fold (es. target a varianza nulla).
 * Registrata nel risultato del fold, non interrompe la valutazione.
 */
public class ModelFitException extends AnalyticsException {

    public ModelFitException(String message) {
        super(message);
    }
}
