package it.floro.analytics.service;

import it.floro.analytics.domain.AnomalyFlag;
import it.floro.analytics.domain.AnomalyMethod;
import it.floro.analytics.domain.AnomalyReport;
import it.floro.analytics.domain.CleanedSeries;
import it.floro.analytics.model.IsolationForest;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Punteggio di anomalia per ogni punto della serie pulita.
 *
 * Metodo di default rolling-mad: baseline = mediana della finestra centrata (troncata ai
 * bordi), scala = 1.4826 · MAD. Se la MAD è nulla la scala ripiega su 1.2533 · deviazione
 * assoluta media; se anche questa è nulla il punteggio è 0. Un punto è anomalo se il
 * punteggio supera la sensibilità.
 *
 * Con isolation-forest la soglia non dipende dalla sensibilità: è il quantile
 * (1 - contamination) dei punteggi della foresta, e sono anomali i punti che lo superano.
 */
@Service
public class AnomalyDetector {

    private static final Logger logger = LoggerFactory.getLogger(AnomalyDetector.class);

    public static final double DEFAULT_SENSITIVITY = 3.0;
    public static final int DEFAULT_WINDOW = 15;
    public static final double DEFAULT_CONTAMINATION = 0.1;
    public static final long ISOLATION_SEED = 42L;

    private static final double MAD_TO_SIGMA = 1.4826;
    private static final double MEAN_AD_TO_SIGMA = 1.2533;

    public AnomalyReport detect(CleanedSeries series, double sensitivity) {
        return detect(series, AnomalyMethod.ROLLING_MAD, sensitivity, DEFAULT_WINDOW);
    }

    public AnomalyReport detect(CleanedSeries series, AnomalyMethod method, double sensitivity, int window) {
        return detect(series, method, sensitivity, window, DEFAULT_CONTAMINATION);
    }

    /**
     * @param series Serie pulita (unità originali)
     * @param method Metodo di punteggio
     * @param sensitivity Soglia sul punteggio (> 0)
     * @param window Ampiezza della finestra centrata per rolling-mad (>= 1)
     * @param contamination Quota attesa di anomalie per isolation-forest, in (0, 0.5]
     * @return Un flag per punto, nell'ordine della serie
     */
    public AnomalyReport detect(CleanedSeries series, AnomalyMethod method, double sensitivity, int window,
                                double contamination) {
        double[] values = series.values();
        List<AnomalyFlag> flags = switch (method) {
            case ROLLING_MAD -> rollingMad(series, values, sensitivity, window);
            case Z_SCORE -> zScore(series, values, sensitivity);
            case ISOLATION_FOREST -> isolationForest(series, values, contamination);
        };
        int flagged = (int) flags.stream().filter(AnomalyFlag::flagged).count();
        logger.debug("Anomalie ({}): {} su {} punti", method.code(), flagged, values.length);
        return new AnomalyReport(method, sensitivity, window,
                method == AnomalyMethod.ISOLATION_FOREST ? contamination : null, flagged, flags);
    }

    private static List<AnomalyFlag> rollingMad(CleanedSeries series, double[] values, double sensitivity,
                                                int window) {
        int n = values.length;
        int half = window / 2;
        Median median = new Median();
        List<AnomalyFlag> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            int from = Math.max(0, i - half);
            int to = Math.min(n, i + half + 1);
            double[] w = Arrays.copyOfRange(values, from, to);
            double med = median.evaluate(w);

            double[] dev = new double[w.length];
            double devSum = 0.0;
            for (int k = 0; k < w.length; k++) {
                dev[k] = Math.abs(w[k] - med);
                devSum += dev[k];
            }
            double scale = MAD_TO_SIGMA * median.evaluate(dev);
            if (scale == 0.0) {
                scale = MEAN_AD_TO_SIGMA * devSum / w.length;
            }
            double score = scale == 0.0 ? 0.0 : Math.abs(values[i] - med) / scale;
            out.add(new AnomalyFlag(series.timestamps().get(i), i, values[i], med, score, score > sensitivity));
        }
        return out;
    }

    private static List<AnomalyFlag> zScore(CleanedSeries series, double[] values, double sensitivity) {
        double mean = new Mean().evaluate(values);
        double std = new StandardDeviation(false).evaluate(values);
        List<AnomalyFlag> out = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            double score = std == 0.0 ? 0.0 : Math.abs(values[i] - mean) / std;
            out.add(new AnomalyFlag(series.timestamps().get(i), i, values[i], mean, score, score > sensitivity));
        }
        return out;
    }

    private static List<AnomalyFlag> isolationForest(CleanedSeries series, double[] values, double contamination) {
        if (!(contamination > 0.0 && contamination <= 0.5)) {
            throw new IllegalArgumentException("contamination deve essere in (0, 0.5]: " + contamination);
        }
        double[][] x = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            x[i] = new double[]{values[i]};
        }
        IsolationForest forest = IsolationForest.fit(x, IsolationForest.DEFAULT_TREES,
                IsolationForest.DEFAULT_MAX_SAMPLES, ISOLATION_SEED);
        double[] scores = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            scores[i] = forest.score(x[i]);
        }
        double threshold = new Percentile().withEstimationType(EstimationType.R_7)
                .evaluate(scores, 100.0 * (1.0 - contamination));
        double baseline = new Median().evaluate(values);

        List<AnomalyFlag> out = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            out.add(new AnomalyFlag(series.timestamps().get(i), i, values[i], baseline, scores[i],
                    scores[i] > threshold));
        }
        return out;
    }
}
