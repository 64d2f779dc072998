package it.floro.analytics.exception;

/**
 * Punto non valido: timestamp assente o metadati con valori non scalari.
 */
public class InvalidDataPointException extends ValidationException {

    public InvalidDataPointException(String message) {
        super(message);
    }
}
