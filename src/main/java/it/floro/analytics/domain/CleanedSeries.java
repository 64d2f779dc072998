package it.floro.analytics.domain;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;

/**
 * Serie pulita: nessun valore mancante, nessun valore non finito.
 *
 * Lunghezza uguale al dataset validato oppure minore se gli outlier vengono rimossi.
 */
public record CleanedSeries(
        List<Instant> timestamps,
        double[] values,
        CleaningReport report
) {

    public CleanedSeries {
        timestamps = List.copyOf(timestamps);
        values = values.clone();
        if (timestamps.size() != values.length) {
            throw new IllegalArgumentException("timestamps e values con lunghezze diverse");
        }
        for (double v : values) {
            if (!Double.isFinite(v)) {
                throw new IllegalArgumentException("La serie pulita contiene valori non finiti");
            }
        }
    }

    @Override
    public double[] values() {
        return values.clone();
    }

    public double valueAt(int i) {
        return values[i];
    }

    public int size() {
        return values.length;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof CleanedSeries other
                && timestamps.equals(other.timestamps)
                && Arrays.equals(values, other.values)
                && report.equals(other.report);
    }

    @Override
    public int hashCode() {
        return 31 * timestamps.hashCode() + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "CleanedSeries[size=" + values.length + ", report=" + report + "]";
    }
}
