package it.floro.analytics.service;

import it.floro.analytics.TestSeries;
import it.floro.analytics.domain.CleanedSeries;
import it.floro.analytics.domain.SlopeUnit;
import it.floro.analytics.domain.TrendDirection;
import it.floro.analytics.domain.TrendReport;
import it.floro.analytics.domain.TrendSegment;
import it.floro.analytics.domain.TrendStatus;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class TrendDetectorTest {

    private final TrendDetector detector = new TrendDetector();

    private static double[] linear(int n, double slope, double noise, long seed) {
        Random rnd = new Random(seed);
        double[] v = new double[n];
        for (int i = 0; i < n; i++) {
            v[i] = slope * i + noise * rnd.nextGaussian();
        }
        return v;
    }

    @Test
    void testRecoversSlopeWithinFivePercent() {
        TrendReport report = detector.detect(TestSeries.cleaned(linear(100, 2.0, 0.5, 3)), 100);

        assertEquals(1, report.segments().size());
        TrendSegment s = report.segments().get(0);
        assertEquals(100, s.pointCount());
        assertEquals(2.0, s.slope(), 0.1);
        assertEquals(TrendStatus.OK, s.status());
        assertEquals(TrendDirection.INCREASING, s.direction());
        assertTrue(s.ciLower() < s.slope() && s.slope() < s.ciUpper());
    }

    @Test
    void testLastPartialWindowKeepsTrueSpan() {
        CleanedSeries series = TestSeries.cleaned(linear(25, 1.0, 0.1, 1));
        TrendReport report = detector.detect(series, 10);

        assertEquals(List.of(10, 10, 5), report.segments().stream().map(TrendSegment::pointCount).toList());
        TrendSegment last = report.segments().get(2);
        assertEquals(series.timestamps().get(20), last.start());
        assertEquals(series.timestamps().get(24), last.end());
    }

    @Test
    void testSinglePointWindowIsInsufficient() {
        TrendReport report = detector.detect(TestSeries.cleaned(linear(21, 1.0, 0.1, 4)), 10);
        TrendSegment last = report.segments().get(2);
        assertEquals(1, last.pointCount());
        assertEquals(TrendStatus.INSUFFICIENT_DATA, last.status());
        assertEquals(0.0, last.slope(), 0.0);
        assertNull(last.ciLower());
        assertNull(last.ciUpper());
        assertEquals(TrendStatus.OK, report.segments().get(0).status());
    }

    @Test
    void testTwoPointWindowHasNoInterval() {
        TrendReport report = detector.detect(TestSeries.cleaned(1.0, 3.0), 10);
        TrendSegment s = report.segments().get(0);
        assertEquals(TrendStatus.NO_INTERVAL, s.status());
        assertEquals(2.0, s.slope(), 1e-12);
        assertNull(s.ciLower());
        assertEquals(TrendDirection.INCREASING, s.direction());
    }

    @Test
    void testSlopeUnits() {
        List<Instant> ts = new ArrayList<>();
        double[] v = new double[10];
        for (int i = 0; i < v.length; i++) {
            ts.add(TestSeries.START.plus(Duration.ofHours(12L * i)));
            v[i] = 3.0 * i;
        }
        CleanedSeries series = TestSeries.cleaned(ts, v);

        assertEquals(3.0, detector.detect(series, 10, SlopeUnit.STEP, 0.95).segments().get(0).slope(), 1e-9);
        assertEquals(6.0, detector.detect(series, 10, SlopeUnit.DAY, 0.95).segments().get(0).slope(), 1e-9);
        assertEquals(0.25, detector.detect(series, 10, SlopeUnit.HOUR, 0.95).segments().get(0).slope(), 1e-9);
    }

    @Test
    void testFlatSeries() {
        // Parabola simmetrica: pendenza ai minimi quadrati nulla
        double[] v = new double[50];
        for (int i = 0; i < v.length; i++) {
            v[i] = (i - 24.5) * (i - 24.5) / 100.0;
        }
        TrendSegment s = detector.detect(TestSeries.cleaned(v), 50).segments().get(0);
        assertEquals(TrendDirection.FLAT, s.direction());
    }

    @Test
    void testDecreasing() {
        TrendSegment s = detector.detect(TestSeries.cleaned(linear(40, -0.8, 0.2, 5)), 40).segments().get(0);
        assertEquals(TrendDirection.DECREASING, s.direction());
        assertTrue(s.ciUpper() < 0.0);
    }
}
