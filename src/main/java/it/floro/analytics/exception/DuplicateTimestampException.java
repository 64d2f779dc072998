package it.floro.analytics.exception;

import java.time.Instant;

public class DuplicateTimestampException extends ValidationException {

    private final Instant timestamp;

    public DuplicateTimestampException(Instant timestamp) {
        super("Timestamp duplicato nel dataset: " + timestamp);
        this.timestamp = timestamp;
    }

    public Instant timestamp() {
        return timestamp;
    }
}
