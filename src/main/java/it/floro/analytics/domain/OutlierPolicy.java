package it.floro.analytics.domain;

/**
 * Politica di rilevazione e trattamento degli outlier.
 */
public record OutlierPolicy(
        OutlierMethod method,
        OutlierAction action,
        double iqrK,                // Moltiplicatore dell'intervallo interquartile
        double zThreshold           // Soglia per il metodo z-score
) {

    public static OutlierPolicy iqr(double k) {
        return new OutlierPolicy(OutlierMethod.IQR, OutlierAction.IMPUTE, k, 3.0);
    }

    public static OutlierPolicy defaults() {
        return iqr(1.5);
    }

    public static OutlierPolicy none() {
        return new OutlierPolicy(OutlierMethod.NONE, OutlierAction.IMPUTE, 1.5, 3.0);
    }

    public OutlierPolicy withAction(OutlierAction newAction) {
        return new OutlierPolicy(method, newAction, iqrK, zThreshold);
    }
}
