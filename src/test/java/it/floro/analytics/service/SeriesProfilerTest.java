package it.floro.analytics.service;

import it.floro.analytics.TestSeries;
import it.floro.analytics.domain.SeriesSummary;
import it.floro.analytics.domain.TrendDirection;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SeriesProfilerTest {

    private final SeriesProfiler profiler = new SeriesProfiler();

    @Test
    void testDescriptiveStatistics() {
        SeriesSummary s = profiler.profile(TestSeries.cleaned(1, 2, 3, 4, 5, 6, 7, 8, 9, 10));

        assertEquals(10, s.count());
        assertEquals(5.5, s.mean(), 1e-12);
        assertEquals(5.5, s.median(), 1e-12);
        assertEquals(1.0, s.min(), 0.0);
        assertEquals(10.0, s.max(), 0.0);
        assertEquals(0.0, s.skewness(), 1e-12);
        assertNotNull(s.kurtosis());
        assertEquals(0, s.outlierCount());
        assertEquals(1.0, s.slopePerStep(), 1e-12);
        assertEquals(TrendDirection.INCREASING, s.direction());
        assertEquals(TestSeries.START, s.start());
    }

    @Test
    void testShortSeriesHasNoShapeStatistics() {
        SeriesSummary s = profiler.profile(TestSeries.cleaned(4.0, 2.0));
        assertNull(s.skewness());
        assertNull(s.kurtosis());
        assertEquals(TrendDirection.DECREASING, s.direction());

        SeriesSummary single = profiler.profile(TestSeries.cleaned(4.0));
        assertEquals(0.0, single.std(), 0.0);
        assertEquals(0.0, single.slopePerStep(), 0.0);
        assertEquals(TrendDirection.FLAT, single.direction());
    }
}
