package it.floro.analytics.service;

import it.floro.analytics.domain.CleanedSeries;
import it.floro.analytics.domain.OutlierPolicy;
import it.floro.analytics.domain.SeriesSummary;
import it.floro.analytics.domain.TrendDirection;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.springframework.stereotype.Service;

/**
 * Statistiche descrittive della serie pulita, riportate nel riepilogo di ogni risultato.
 */
@Service
public class SeriesProfiler {

    public SeriesSummary profile(CleanedSeries series) {
        double[] values = series.values();
        int n = values.length;
        DescriptiveStatistics stats = new DescriptiveStatistics(values);

        // Skewness e curtosi di Commons Math sono NaN sotto i 3 e 4 punti
        Double skewness = n >= 3 ? finiteOrNull(stats.getSkewness()) : null;
        Double kurtosis = n >= 4 ? finiteOrNull(stats.getKurtosis()) : null;

        double[] bounds = DataCleaner.bounds(values, OutlierPolicy.defaults());
        int outliers = 0;
        for (double v : values) {
            if (v < bounds[0] || v > bounds[1]) {
                outliers++;
            }
        }

        double slope = 0.0;
        if (n >= 2) {
            SimpleRegression regression = new SimpleRegression(true);
            for (int i = 0; i < n; i++) {
                regression.addData(i, values[i]);
            }
            slope = regression.getSlope();
        }

        return new SeriesSummary(
                n,
                series.timestamps().get(0),
                series.timestamps().get(n - 1),
                stats.getMean(),
                n > 1 ? stats.getStandardDeviation() : 0.0,
                stats.getMin(),
                stats.getMax(),
                stats.getPercentile(50.0),
                skewness,
                kurtosis,
                outliers,
                slope,
                TrendDirection.of(slope, null, null));
    }

    private static Double finiteOrNull(double v) {
        return Double.isFinite(v) ? v : null;
    }
}
