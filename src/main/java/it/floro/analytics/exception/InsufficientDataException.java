package it.floro.analytics.exception;

public class InsufficientDataException extends ValidationException {

    private final int actual;
    private final int required;

    public InsufficientDataException(int actual, int required) {
        super(String.format("Dataset con %d punti, ne servono almeno %d", actual, required));
        this.actual = actual;
        this.required = required;
    }

    public int actual() {
        return actual;
    }

    public int required() {
        return required;
    }
}
