package it.floro.analytics.domain;

/**
 * Parametri stimati dalla normalizzazione, conservati per poter riportare
 * le predizioni nelle unità originali.
 */
public record NormalizationParameters(
        NormalizationMethod method,
        double min,
        double max,
        double mean,
        double std,                 // Deviazione standard di popolazione
        boolean constant            // true se max == min (o varianza nulla)
) {

    /**
     * Inverte la trasformazione su un singolo valore normalizzato.
     *
     * Per una serie costante ogni valore normalizzato (0) corrisponde alla costante stessa.
     */
    public double denormalize(double normalized) {
        return switch (method) {
            case MIN_MAX -> constant ? min : min + normalized * (max - min);
            case Z_SCORE -> constant ? mean : mean + normalized * std;
            case NONE -> normalized;
        };
    }

    public double normalize(double raw) {
        return switch (method) {
            case MIN_MAX -> constant ? 0.0 : (raw - min) / (max - min);
            case Z_SCORE -> constant ? 0.0 : (raw - mean) / std;
            case NONE -> raw;
        };
    }
}
