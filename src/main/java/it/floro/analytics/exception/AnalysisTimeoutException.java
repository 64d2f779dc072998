package it.floro.analytics.exception;

import java.time.Duration;

/**
 * Il budget di calcolo è stato superato durante un passo della pipeline.
 */
public class AnalysisTimeoutException extends AnalyticsException {

    public AnalysisTimeoutException(String step, Duration budget) {
        super(String.format("Budget di %d ms superato durante '%s'", budget.toMillis(), step));
    }

    public AnalysisTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
