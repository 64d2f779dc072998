package it.floro.analytics.service;

import it.floro.analytics.domain.CleanedSeries;
import it.floro.analytics.domain.SlopeUnit;
import it.floro.analytics.domain.TrendDirection;
import it.floro.analytics.domain.TrendReport;
import it.floro.analytics.domain.TrendSegment;
import it.floro.analytics.domain.TrendStatus;
import org.apache.commons.math3.distribution.TDistribution;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Pendenza ai minimi quadrati per finestre non sovrapposte della serie pulita.
 *
 * Responsabilità:
 * - Suddivisione in finestre di {@code window} punti; l'ultima finestra parziale è mantenuta
 * - Pendenza nell'unità richiesta (passo, ora, giorno dall'inizio della finestra)
 * - Intervallo di confidenza da errore standard della pendenza e t di Student (n - 2 gradi di libertà)
 * - Direzione del trend
 *
 * Con meno di due punti la finestra ha pendenza 0 e stato INSUFFICIENT_DATA; con due
 * punti la pendenza è stimata senza intervallo. Una finestra degenere non interrompe
 * le altre.
 */
@Service
public class TrendDetector {

    private static final Logger logger = LoggerFactory.getLogger(TrendDetector.class);

    public TrendReport detect(CleanedSeries series, int window) {
        return detect(series, window, SlopeUnit.STEP, 0.95);
    }

    /**
     * @param series Serie pulita (unità originali)
     * @param window Punti per finestra (>= 1)
     * @param unit Unità dell'asse x
     * @param confidenceLevel Livello di confidenza in (0, 1)
     */
    public TrendReport detect(CleanedSeries series, int window, SlopeUnit unit, double confidenceLevel) {
        if (window < 1) {
            throw new IllegalArgumentException("La finestra deve essere >= 1");
        }
        List<Instant> ts = series.timestamps();
        double[] values = series.values();
        List<TrendSegment> segments = new ArrayList<>();
        for (int start = 0; start < values.length; start += window) {
            int end = Math.min(values.length, start + window);
            segments.add(segment(ts, values, start, end, unit, confidenceLevel));
        }
        logger.debug("Trend: {} finestre da {} punti", segments.size(), window);
        return new TrendReport(window, unit, confidenceLevel, segments);
    }

    private static TrendSegment segment(List<Instant> ts, double[] values, int from, int to, SlopeUnit unit,
                                        double confidenceLevel) {
        int n = to - from;
        Instant start = ts.get(from);
        Instant end = ts.get(to - 1);
        if (n < 2) {
            return new TrendSegment(start, end, n, 0.0, null, null, TrendStatus.INSUFFICIENT_DATA,
                    TrendDirection.FLAT);
        }

        SimpleRegression regression = new SimpleRegression(true);
        for (int i = from; i < to; i++) {
            regression.addData(x(ts, from, i, unit), values[i]);
        }
        double slope = regression.getSlope();
        if (!Double.isFinite(slope)) {
            // Asse x degenere (timestamp nella stessa unità)
            return new TrendSegment(start, end, n, 0.0, null, null, TrendStatus.INSUFFICIENT_DATA,
                    TrendDirection.FLAT);
        }
        if (n == 2) {
            return new TrendSegment(start, end, n, slope, null, null, TrendStatus.NO_INTERVAL,
                    TrendDirection.of(slope, null, null));
        }

        double se = regression.getSlopeStdErr();
        double t = new TDistribution(n - 2).inverseCumulativeProbability(1.0 - (1.0 - confidenceLevel) / 2.0);
        double lower = slope - t * se;
        double upper = slope + t * se;
        return new TrendSegment(start, end, n, slope, lower, upper, TrendStatus.OK,
                TrendDirection.of(slope, lower, upper));
    }

    private static double x(List<Instant> ts, int from, int i, SlopeUnit unit) {
        if (unit == SlopeUnit.STEP) {
            return i - from;
        }
        Duration d = Duration.between(ts.get(from), ts.get(i));
        return d.toMillis() / 1000.0 / unit.seconds();
    }
}
