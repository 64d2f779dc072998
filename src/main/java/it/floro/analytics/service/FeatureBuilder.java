package it.floro.analytics.service;

import it.floro.analytics.domain.FeatureConfig;
import it.floro.analytics.domain.FeatureMatrix;
import it.floro.analytics.domain.LagEdgePolicy;
import it.floro.analytics.domain.NormalizedSeries;
import it.floro.analytics.domain.PipelineWarning;
import it.floro.analytics.domain.WarningCode;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Costruzione della matrice delle feature da una serie normalizzata.
 *
 * Responsabilità:
 * - Feature di calendario (UTC): hour, day_of_week, day_of_month, day_of_year, month, is_weekend
 * - Statistiche mobili trailing per ogni finestra: rolling_mean_w, rolling_std_w, rolling_min_w, rolling_max_w
 * - Lag lag_k per ogni ritardo configurato
 * - Opzionali: quadrati (f_squared) e prodotti a coppie (a_x_b) delle colonne precedenti
 * - Rimozione delle colonne a varianza nulla
 * - Potatura della multicollinearità in ordine di costruzione
 *
 * Ogni riga usa solo valori passati e correnti. A parità di input e configurazione
 * l'output è identico.
 */
@Service
public class FeatureBuilder {

    private static final Logger logger = LoggerFactory.getLogger(FeatureBuilder.class);

    public FeatureMatrix build(NormalizedSeries series, FeatureConfig config) {
        return build(series.timestamps(), series.values(), config);
    }

    /**
     * @param timestamps Timestamp ordinati della serie
     * @param values Valori della serie (stessa lunghezza)
     * @param config Finestre, lag, soglia di correlazione e politica ai bordi
     * @return Matrice con righe allineate alla coda della serie
     */
    public FeatureMatrix build(List<Instant> timestamps, double[] values, FeatureConfig config) {
        if (timestamps.size() != values.length) {
            throw new IllegalArgumentException("timestamps e values con lunghezze diverse");
        }
        int n = values.length;
        Map<String, double[]> columns = new LinkedHashMap<>();

        // ===== CALENDARIO =====
        double[] hour = new double[n];
        double[] dayOfWeek = new double[n];
        double[] dayOfMonth = new double[n];
        double[] dayOfYear = new double[n];
        double[] month = new double[n];
        double[] weekend = new double[n];
        for (int i = 0; i < n; i++) {
            ZonedDateTime t = timestamps.get(i).atZone(ZoneOffset.UTC);
            hour[i] = t.getHour();
            dayOfWeek[i] = t.getDayOfWeek().getValue();
            dayOfMonth[i] = t.getDayOfMonth();
            dayOfYear[i] = t.getDayOfYear();
            month[i] = t.getMonthValue();
            DayOfWeek d = t.getDayOfWeek();
            weekend[i] = (d == DayOfWeek.SATURDAY || d == DayOfWeek.SUNDAY) ? 1.0 : 0.0;
        }
        columns.put("hour", hour);
        columns.put("day_of_week", dayOfWeek);
        columns.put("day_of_month", dayOfMonth);
        columns.put("day_of_year", dayOfYear);
        columns.put("month", month);
        columns.put("is_weekend", weekend);

        // ===== STATISTICHE MOBILI =====
        for (int w : config.windowSizes()) {
            double[] mean = new double[n];
            double[] std = new double[n];
            double[] min = new double[n];
            double[] max = new double[n];
            for (int i = 0; i < n; i++) {
                int from = Math.max(0, i - w + 1);
                int count = i - from + 1;
                double sum = 0.0;
                double lo = Double.POSITIVE_INFINITY;
                double hi = Double.NEGATIVE_INFINITY;
                for (int k = from; k <= i; k++) {
                    sum += values[k];
                    lo = Math.min(lo, values[k]);
                    hi = Math.max(hi, values[k]);
                }
                double mu = sum / count;
                double sq = 0.0;
                for (int k = from; k <= i; k++) {
                    double d = values[k] - mu;
                    sq += d * d;
                }
                mean[i] = mu;
                std[i] = Math.sqrt(sq / count);
                min[i] = lo;
                max[i] = hi;
            }
            columns.put("rolling_mean_" + w, mean);
            columns.put("rolling_std_" + w, std);
            columns.put("rolling_min_" + w, min);
            columns.put("rolling_max_" + w, max);
        }

        // ===== LAG =====
        for (int lag : config.lags()) {
            double[] col = new double[n];
            for (int i = 0; i < n; i++) {
                col[i] = i - lag >= 0 ? values[i - lag] : (n > 0 ? values[0] : 0.0);
            }
            columns.put("lag_" + lag, col);
        }

        // ===== POLINOMIALI E INTERAZIONI =====
        List<Map.Entry<String, double[]>> base = new ArrayList<>(columns.entrySet());
        if (config.squaredFeatures()) {
            for (Map.Entry<String, double[]> e : base) {
                double[] src = e.getValue();
                double[] sq = new double[n];
                for (int i = 0; i < n; i++) {
                    sq[i] = src[i] * src[i];
                }
                columns.put(e.getKey() + "_squared", sq);
            }
        }
        if (config.interactionFeatures()) {
            for (int a = 0; a < base.size(); a++) {
                for (int b = a + 1; b < base.size(); b++) {
                    double[] x = base.get(a).getValue();
                    double[] y = base.get(b).getValue();
                    double[] prod = new double[n];
                    for (int i = 0; i < n; i++) {
                        prod[i] = x[i] * y[i];
                    }
                    columns.put(base.get(a).getKey() + "_x_" + base.get(b).getKey(), prod);
                }
            }
        }

        // ===== BORDI =====
        int offset = config.edgePolicy() == LagEdgePolicy.DROP ? Math.min(config.maxLag(), n) : 0;
        int rows = n - offset;
        Map<String, double[]> trimmed = new LinkedHashMap<>();
        for (Map.Entry<String, double[]> e : columns.entrySet()) {
            double[] dst = new double[rows];
            System.arraycopy(e.getValue(), offset, dst, 0, rows);
            trimmed.put(e.getKey(), dst);
        }
        List<Instant> rowTimestamps = timestamps.subList(offset, n);

        List<PipelineWarning> warnings = new ArrayList<>();
        Map<String, double[]> pruned = prune(trimmed, config.correlationThreshold(), warnings);

        logger.debug("Feature costruite: {} righe, {} colonne ({} scartate)",
                rows, pruned.size(), trimmed.size() - pruned.size());
        return new FeatureMatrix(pruned, rowTimestamps, offset, warnings);
    }

    /**
     * Scarta le colonne costanti e, in ordine di costruzione, ogni colonna con |r| oltre
     * soglia rispetto a una colonna già mantenuta.
     */
    private static Map<String, double[]> prune(Map<String, double[]> columns, double threshold,
                                               List<PipelineWarning> warnings) {
        Map<String, double[]> kept = new LinkedHashMap<>();
        if (columns.values().stream().findFirst().map(c -> c.length).orElse(0) < 2) {
            return columns;
        }
        PearsonsCorrelation pearson = new PearsonsCorrelation();
        for (Map.Entry<String, double[]> e : columns.entrySet()) {
            String name = e.getKey();
            double[] col = e.getValue();
            if (isConstant(col)) {
                warnings.add(PipelineWarning.of(WarningCode.DROPPED_CONSTANT_FEATURE,
                        "Feature '%s' scartata: varianza nulla", name));
                continue;
            }
            String conflict = null;
            double r = 0.0;
            for (Map.Entry<String, double[]> k : kept.entrySet()) {
                r = pearson.correlation(col, k.getValue());
                if (Math.abs(r) > threshold) {
                    conflict = k.getKey();
                    break;
                }
            }
            if (conflict != null) {
                warnings.add(PipelineWarning.of(WarningCode.DROPPED_CORRELATED_FEATURE,
                        "Feature '%s' scartata: |r| = %.4f con '%s'", name, Math.abs(r), conflict));
                continue;
            }
            kept.put(name, col);
        }
        return kept;
    }

    private static boolean isConstant(double[] col) {
        for (int i = 1; i < col.length; i++) {
            if (col[i] != col[0]) {
                return false;
            }
        }
        return true;
    }
}
