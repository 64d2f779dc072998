package it.floro.analytics.domain;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Matrice delle feature: colonne nominate, tutte della stessa lunghezza, nell'ordine
 * di costruzione.
 *
 * Le righe sono allineate alla coda della serie di origine: la riga 0 corrisponde
 * alla posizione {@code rowOffset} della serie (le prime righe senza storico per i lag
 * possono essere state scartate).
 */
public final class FeatureMatrix {

    private final Map<String, double[]> columns;
    private final List<Instant> timestamps;
    private final int rowOffset;
    private final List<PipelineWarning> warnings;

    public FeatureMatrix(Map<String, double[]> columns, List<Instant> timestamps, int rowOffset,
                         List<PipelineWarning> warnings) {
        Map<String, double[]> copy = new LinkedHashMap<>();
        for (Map.Entry<String, double[]> e : columns.entrySet()) {
            if (e.getValue().length != timestamps.size()) {
                throw new IllegalArgumentException("Colonna '" + e.getKey() + "' di lunghezza "
                        + e.getValue().length + ", attesa " + timestamps.size());
            }
            copy.put(e.getKey(), e.getValue().clone());
        }
        this.columns = Collections.unmodifiableMap(copy);
        this.timestamps = List.copyOf(timestamps);
        this.rowOffset = rowOffset;
        this.warnings = List.copyOf(warnings);
    }

    public List<String> featureNames() {
        return new ArrayList<>(columns.keySet());
    }

    public boolean hasFeature(String name) {
        return columns.containsKey(name);
    }

    public double[] column(String name) {
        double[] c = columns.get(name);
        if (c == null) {
            throw new IllegalArgumentException("Feature sconosciuta: " + name);
        }
        return c.clone();
    }

    public int rowCount() {
        return timestamps.size();
    }

    public int columnCount() {
        return columns.size();
    }

    public List<Instant> timestamps() {
        return timestamps;
    }

    public int rowOffset() {
        return rowOffset;
    }

    public List<PipelineWarning> warnings() {
        return warnings;
    }

    public double[] row(int i) {
        double[] r = new double[columns.size()];
        int j = 0;
        for (double[] c : columns.values()) {
            r[j++] = c[i];
        }
        return r;
    }

    /**
     * @return Copia row-major della matrice ({@code [riga][colonna]})
     */
    public double[][] toRows() {
        double[][] out = new double[rowCount()][];
        for (int i = 0; i < out.length; i++) {
            out[i] = row(i);
        }
        return out;
    }

    /**
     * Sottoinsieme di righe, nell'ordine indicato. Gli avvisi non vengono propagati.
     */
    public FeatureMatrix selectRows(int[] rows) {
        Map<String, double[]> out = new LinkedHashMap<>();
        for (Map.Entry<String, double[]> e : columns.entrySet()) {
            double[] src = e.getValue();
            double[] dst = new double[rows.length];
            for (int i = 0; i < rows.length; i++) {
                dst[i] = src[rows[i]];
            }
            out.put(e.getKey(), dst);
        }
        List<Instant> ts = new ArrayList<>(rows.length);
        for (int r : rows) {
            ts.add(timestamps.get(r));
        }
        int offset = rows.length == 0 ? rowOffset : rowOffset + rows[0];
        return new FeatureMatrix(out, ts, offset, List.of());
    }

    public FeatureMatrix selectRange(int fromInclusive, int toExclusive) {
        int[] rows = new int[Math.max(0, toExclusive - fromInclusive)];
        for (int i = 0; i < rows.length; i++) {
            rows[i] = fromInclusive + i;
        }
        return selectRows(rows);
    }

    @Override
    public String toString() {
        return "FeatureMatrix[rows=" + rowCount() + ", features=" + columns.keySet() + "]";
    }
}
