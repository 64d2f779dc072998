package it.floro.analytics.domain;

public enum TrendDirection {
    INCREASING,
    DECREASING,
    FLAT;

    /**
     * Direzione di una pendenza: FLAT se l'intervallo di confidenza contiene lo zero
     * o se la pendenza è nulla.
     */
    public static TrendDirection of(double slope, Double ciLower, Double ciUpper) {
        if (ciLower != null && ciUpper != null && ciLower <= 0.0 && ciUpper >= 0.0) {
            return FLAT;
        }
        if (slope > 0.0) {
            return INCREASING;
        }
        if (slope < 0.0) {
            return DECREASING;
        }
        return FLAT;
    }
}
