package it.floro.analytics.domain;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Esito della valutazione su un singolo fold.
 *
 * Se il fit fallisce le metriche sono null e {@code error} riporta il motivo.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record FoldResult(
        int fold,
        int trainSize,
        int validationSize,
        Double mae,
        Double rmse,
        Double mse,
        Double r2,
        String error
) {

    public static FoldResult success(int fold, int trainSize, int validationSize, RegressionMetrics m) {
        return new FoldResult(fold, trainSize, validationSize, m.mae(), m.rmse(), m.mse(), m.r2(), null);
    }

    public static FoldResult failure(int fold, int trainSize, int validationSize, String error) {
        return new FoldResult(fold, trainSize, validationSize, null, null, null, null, error);
    }

    public boolean succeeded() {
        return error == null;
    }
}
