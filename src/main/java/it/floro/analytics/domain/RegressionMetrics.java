package it.floro.analytics.domain;

/**
 * Metriche di errore di un insieme di predizioni rispetto ai valori osservati.
 */
public record RegressionMetrics(
        double mae,     // Errore assoluto medio
        double rmse,    // Radice dell'errore quadratico medio
        double mse,     // Errore quadratico medio
        double r2       // Coefficiente di determinazione
) {

    /**
     * Calcola le metriche.
     *
     * Con target di validazione costante R² vale 1 se le predizioni sono esatte, 0 altrimenti.
     *
     * @param actual Valori osservati
     * @param predicted Valori predetti (stessa lunghezza)
     */
    public static RegressionMetrics of(double[] actual, double[] predicted) {
        if (actual.length != predicted.length || actual.length == 0) {
            throw new IllegalArgumentException("Vettori vuoti o di lunghezza diversa");
        }
        int n = actual.length;
        double absSum = 0.0;
        double sqSum = 0.0;
        double mean = 0.0;
        for (double a : actual) {
            mean += a;
        }
        mean /= n;
        double ssTot = 0.0;
        for (int i = 0; i < n; i++) {
            double e = actual[i] - predicted[i];
            absSum += Math.abs(e);
            sqSum += e * e;
            double d = actual[i] - mean;
            ssTot += d * d;
        }
        double mse = sqSum / n;
        double r2;
        if (ssTot == 0.0) {
            r2 = sqSum == 0.0 ? 1.0 : 0.0;
        } else {
            r2 = 1.0 - sqSum / ssTot;
        }
        return new RegressionMetrics(absSum / n, Math.sqrt(mse), mse, r2);
    }
}
