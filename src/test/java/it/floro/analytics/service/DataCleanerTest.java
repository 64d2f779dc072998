package it.floro.analytics.service;

import it.floro.analytics.TestSeries;
import it.floro.analytics.domain.CleanedSeries;
import it.floro.analytics.domain.Dataset;
import it.floro.analytics.domain.ImputationPolicy;
import it.floro.analytics.domain.OutlierAction;
import it.floro.analytics.domain.OutlierMethod;
import it.floro.analytics.domain.OutlierPolicy;
import it.floro.analytics.domain.ValidatedDataset;
import it.floro.analytics.domain.ValidationRequirements;
import it.floro.analytics.exception.ImputationException;
import it.floro.analytics.exception.UnimputableColumnException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DataCleanerTest {

    private final DatasetValidator validator = new DatasetValidator();
    private final DataCleaner cleaner = new DataCleaner();

    private ValidatedDataset validated(Double... values) {
        Dataset ds = TestSeries.dataset(values);
        return validator.validate(ds, new ValidationRequirements(1));
    }

    @Test
    void testMeanImputationFillsMissingWithMeanOfKnown() {
        ValidatedDataset v = validated(1.0, 2.0, 3.0, null, 4.0, 5.0, 6.0, null, 7.0, 8.0);

        CleanedSeries s = cleaner.clean(v, OutlierPolicy.none(), ImputationPolicy.MEAN);

        assertEquals(10, s.size());
        assertEquals(4.5, s.valueAt(3), 1e-12);
        assertEquals(4.5, s.valueAt(7), 1e-12);
        assertEquals(List.of(3, 7), s.report().imputedPositions());
        assertEquals(2, s.report().missingCount());
    }

    @Test
    void testEveryPolicyProducesFiniteValues() {
        for (ImputationPolicy policy : ImputationPolicy.values()) {
            ValidatedDataset v = validated(null, 2.0, Double.NaN, 4.0, Double.POSITIVE_INFINITY, 6.0, null);
            CleanedSeries s = cleaner.clean(v, OutlierPolicy.defaults(), policy);
            assertEquals(7, s.size(), policy.code());
            for (double x : s.values()) {
                assertTrue(Double.isFinite(x), policy.code());
            }
        }
    }

    @Test
    void testAllMissingIsUnimputable() {
        ValidatedDataset v = validated(null, null, null);
        ImputationException e = assertThrows(UnimputableColumnException.class,
                () -> cleaner.clean(v, OutlierPolicy.defaults(), ImputationPolicy.MEDIAN));
        assertTrue(e.getMessage().contains("median"));
    }

    @Test
    void testIqrOutlierIsImputed() {
        ValidatedDataset v = validated(10.0, 11.0, 12.0, 13.0, 14.0, 15.0, 16.0, 17.0, 18.0, 100.0);

        CleanedSeries s = cleaner.clean(v, OutlierPolicy.iqr(1.5), ImputationPolicy.MEAN);

        // Q1 = 12.25, Q3 = 16.75 (interpolazione lineare)
        assertEquals(5.5, s.report().lowerBound(), 1e-12);
        assertEquals(23.5, s.report().upperBound(), 1e-12);
        assertEquals(List.of(9), s.report().outlierPositions());
        assertEquals(14.0, s.valueAt(9), 1e-12);
        assertEquals(0, s.report().droppedCount());
    }

    @Test
    void testIqrOutlierDropped() {
        ValidatedDataset v = validated(10.0, 11.0, 12.0, 13.0, 14.0, 15.0, 16.0, 17.0, 18.0, 100.0);

        CleanedSeries s = cleaner.clean(v, OutlierPolicy.iqr(1.5).withAction(OutlierAction.DROP),
                ImputationPolicy.LINEAR_INTERPOLATE);

        assertEquals(9, s.size());
        assertEquals(1, s.report().droppedCount());
        assertEquals(v.points().get(8).timestamp(), s.timestamps().get(8));
        assertTrue(s.report().imputedPositions().isEmpty());
    }

    @Test
    void testManyOutliersDroppedOnLongSeries() {
        int n = 20_000;
        double[] values = new double[n];
        for (int i = 0; i < n; i++) {
            values[i] = i % 10 == 3 ? 500.0 : 10.0 + (i % 7);
        }
        ValidatedDataset v = validator.validate(TestSeries.dataset(values), new ValidationRequirements(1));

        CleanedSeries s = assertTimeoutPreemptively(Duration.ofSeconds(10), () -> cleaner.clean(v,
                OutlierPolicy.iqr(1.5).withAction(OutlierAction.DROP), ImputationPolicy.LINEAR_INTERPOLATE));

        assertEquals(n / 10, s.report().droppedCount());
        assertEquals(n - n / 10, s.size());
        assertTrue(Arrays.stream(s.values()).allMatch(x -> x < 500.0));
        assertEquals(v.points().get(4).timestamp(), s.timestamps().get(3));
    }

    @Test
    void testZScoreOutliers() {
        Double[] values = new Double[30];
        for (int i = 0; i < values.length; i++) {
            values[i] = 20.0 + (i % 3);
        }
        values[15] = 80.0;
        OutlierPolicy policy = new OutlierPolicy(OutlierMethod.Z_SCORE, OutlierAction.IMPUTE, 1.5, 3.0);

        CleanedSeries s = cleaner.clean(validated(values), policy, ImputationPolicy.FORWARD_FILL);

        assertEquals(List.of(15), s.report().outlierPositions());
        assertEquals(s.valueAt(14), s.valueAt(15), 1e-12);
    }

    @Test
    void testForwardFillBackfillsLeadingGap() {
        CleanedSeries s = cleaner.clean(validated(null, 2.0, null, null, 5.0),
                OutlierPolicy.none(), ImputationPolicy.FORWARD_FILL);
        assertArrayEquals(new double[]{2.0, 2.0, 2.0, 2.0, 5.0}, s.values(), 1e-12);
    }

    @Test
    void testLinearInterpolationUsesNearestAtEdges() {
        CleanedSeries s = cleaner.clean(validated(null, 1.0, null, null, 4.0, null),
                OutlierPolicy.none(), ImputationPolicy.LINEAR_INTERPOLATE);
        assertArrayEquals(new double[]{1.0, 1.0, 2.0, 3.0, 4.0, 4.0}, s.values(), 1e-12);
        assertEquals(List.of(0, 2, 3, 5), s.report().imputedPositions());
    }

    @Test
    void testMedianIgnoresOutliers() {
        ValidatedDataset v = validated(1.0, 2.0, 3.0, null, 4.0, 5.0, 1000.0);
        CleanedSeries s = cleaner.clean(v, OutlierPolicy.defaults(), ImputationPolicy.MEDIAN);
        assertEquals(3.0, s.valueAt(3), 1e-12);
        assertEquals(3.0, s.valueAt(6), 1e-12);
    }
}
