package it.floro.analytics.exception;

public class UnimputableColumnException extends ImputationException {

    public UnimputableColumnException(String policy) {
        super("Nessun valore noto nella serie: impossibile applicare l'imputazione '" + policy + "'");
    }
}
