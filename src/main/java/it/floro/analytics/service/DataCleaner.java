package it.floro.analytics.service;

import it.floro.analytics.domain.CleanedSeries;
import it.floro.analytics.domain.CleaningReport;
import it.floro.analytics.domain.DataPoint;
import it.floro.analytics.domain.ImputationPolicy;
import it.floro.analytics.domain.OutlierAction;
import it.floro.analytics.domain.OutlierPolicy;
import it.floro.analytics.domain.ValidatedDataset;
import it.floro.analytics.exception.UnimputableColumnException;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Pulizia della serie validata: rilevazione degli outlier e imputazione dei valori mancanti.
 *
 * Responsabilità:
 * - Rilevazione outlier con regola IQR (quartili interpolati linearmente) o z-score
 * - Trattamento outlier: marcatura e imputazione oppure rimozione
 * - Imputazione di ogni slot mancante o marcato con la politica scelta
 * - Resoconto delle operazioni applicate
 *
 * Le stime dell'imputazione (media, mediana, vicini) usano solo valori noti non outlier.
 */
@Service
public class DataCleaner {

    private static final Logger logger = LoggerFactory.getLogger(DataCleaner.class);

    /**
     * Pulisce la serie.
     *
     * @param validated Dataset validato e ordinato
     * @param outlierPolicy Metodo e azione per gli outlier
     * @param imputationPolicy Politica di imputazione
     * @return Serie con soli valori finiti
     * @throws UnimputableColumnException se nessun valore noto è disponibile per le stime
     */
    public CleanedSeries clean(ValidatedDataset validated, OutlierPolicy outlierPolicy,
                               ImputationPolicy imputationPolicy) {
        List<DataPoint> points = validated.points();
        int n = points.size();

        double[] raw = new double[n];
        boolean[] known = new boolean[n];
        int missingCount = 0;
        for (int i = 0; i < n; i++) {
            DataPoint p = points.get(i);
            if (p.isMissing()) {
                missingCount++;
            } else {
                raw[i] = p.value();
                known[i] = true;
            }
        }

        double[] knownValues = select(raw, known);
        if (knownValues.length == 0) {
            throw new UnimputableColumnException(imputationPolicy.code());
        }

        // ===== OUTLIER =====
        double[] bounds = bounds(knownValues, outlierPolicy);
        List<Integer> outliers = new ArrayList<>();
        boolean[] outlier = new boolean[n];
        if (bounds != null) {
            for (int i = 0; i < n; i++) {
                if (known[i] && (raw[i] < bounds[0] || raw[i] > bounds[1])) {
                    outliers.add(i);
                    outlier[i] = true;
                    known[i] = false;
                }
            }
        }

        // ===== SELEZIONE DEI PUNTI MANTENUTI =====
        boolean drop = outlierPolicy.action() == OutlierAction.DROP;
        List<Integer> kept = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            if (!(drop && outlier[i])) {
                kept.add(i);
            }
        }

        int m = kept.size();
        double[] values = new double[m];
        boolean[] present = new boolean[m];
        List<Instant> timestamps = new ArrayList<>(m);
        for (int j = 0; j < m; j++) {
            int i = kept.get(j);
            values[j] = raw[i];
            present[j] = known[i];
            timestamps.add(points.get(i).timestamp());
        }

        double[] inliers = select(values, present);
        if (inliers.length == 0) {
            throw new UnimputableColumnException(imputationPolicy.code());
        }

        // ===== IMPUTAZIONE =====
        List<Integer> imputed = new ArrayList<>();
        for (int j = 0; j < m; j++) {
            if (!present[j]) {
                imputed.add(kept.get(j));
            }
        }
        if (!imputed.isEmpty()) {
            impute(values, present, inliers, imputationPolicy);
        }

        CleaningReport report = new CleaningReport(
                outlierPolicy, imputationPolicy,
                bounds == null ? null : bounds[0],
                bounds == null ? null : bounds[1],
                missingCount, outliers, imputed, n - m);

        logger.debug("Pulizia completata: {} mancanti, {} outlier, {} imputati, {} rimossi",
                missingCount, outliers.size(), imputed.size(), n - m);
        return new CleanedSeries(timestamps, values, report);
    }

    // ========================================================================
    // OUTLIER
    // ========================================================================

    /**
     * @return Limiti [inferiore, superiore] oppure null se il metodo non rileva outlier
     */
    static double[] bounds(double[] knownValues, OutlierPolicy policy) {
        return switch (policy.method()) {
            case IQR -> {
                Percentile percentile = new Percentile().withEstimationType(Percentile.EstimationType.R_7);
                percentile.setData(knownValues);
                double q1 = percentile.evaluate(25.0);
                double q3 = percentile.evaluate(75.0);
                double iqr = q3 - q1;
                yield new double[]{q1 - policy.iqrK() * iqr, q3 + policy.iqrK() * iqr};
            }
            case Z_SCORE -> {
                double mean = new Mean().evaluate(knownValues);
                double std = new StandardDeviation(false).evaluate(knownValues);
                if (std == 0.0) {
                    yield new double[]{mean, mean};
                }
                yield new double[]{mean - policy.zThreshold() * std, mean + policy.zThreshold() * std};
            }
            case NONE -> null;
        };
    }

    // ========================================================================
    // IMPUTAZIONE
    // ========================================================================

    private static void impute(double[] values, boolean[] present, double[] inliers, ImputationPolicy policy) {
        switch (policy) {
            case MEAN -> fillConstant(values, present, new Mean().evaluate(inliers));
            case MEDIAN -> fillConstant(values, present,
                    new Percentile().withEstimationType(Percentile.EstimationType.R_7).evaluate(inliers, 50.0));
            case FORWARD_FILL -> forwardFill(values, present);
            case LINEAR_INTERPOLATE -> interpolate(values, present);
        }
    }

    private static void fillConstant(double[] values, boolean[] present, double fill) {
        for (int i = 0; i < values.length; i++) {
            if (!present[i]) {
                values[i] = fill;
            }
        }
    }

    /**
     * Propaga l'ultimo valore noto; il buco iniziale prende il primo valore noto.
     */
    private static void forwardFill(double[] values, boolean[] present) {
        int first = firstPresent(present);
        double last = values[first];
        for (int i = 0; i < values.length; i++) {
            if (present[i]) {
                last = values[i];
            } else {
                values[i] = last;
            }
        }
    }

    /**
     * Interpolazione lineare sugli indici; ai bordi il valore noto più vicino.
     */
    private static void interpolate(double[] values, boolean[] present) {
        int n = values.length;
        int prev = -1;
        for (int i = 0; i < n; i++) {
            if (present[i]) {
                if (prev == -1 && i > 0) {
                    for (int k = 0; k < i; k++) {
                        values[k] = values[i];
                    }
                } else if (prev != -1 && i - prev > 1) {
                    double step = (values[i] - values[prev]) / (i - prev);
                    for (int k = prev + 1; k < i; k++) {
                        values[k] = values[prev] + step * (k - prev);
                    }
                }
                prev = i;
            }
        }
        for (int k = prev + 1; k < n; k++) {
            values[k] = values[prev];
        }
    }

    private static int firstPresent(boolean[] present) {
        for (int i = 0; i < present.length; i++) {
            if (present[i]) {
                return i;
            }
        }
        throw new IllegalStateException("Nessun valore noto");
    }

    private static double[] select(double[] values, boolean[] mask) {
        int count = 0;
        for (boolean b : mask) {
            if (b) {
                count++;
            }
        }
        double[] out = new double[count];
        int j = 0;
        for (int i = 0; i < values.length; i++) {
            if (mask[i]) {
                out[j++] = values[i];
            }
        }
        return out;
    }
}
