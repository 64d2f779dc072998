package it.floro.analytics.service;

import it.floro.analytics.TestSeries;
import it.floro.analytics.domain.EvaluationReport;
import it.floro.analytics.domain.EvaluationResult;
import it.floro.analytics.domain.EvaluationSettings;
import it.floro.analytics.domain.FeatureMatrix;
import it.floro.analytics.domain.FoldResult;
import it.floro.analytics.domain.ModelSpec;
import it.floro.analytics.domain.ModelVariant;
import it.floro.analytics.domain.SplitMode;
import it.floro.analytics.exception.AnalysisTimeoutException;
import it.floro.analytics.exception.ModelFitException;
import it.floro.analytics.model.ModelRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.DoubleUnaryOperator;

import static org.junit.jupiter.api.Assertions.*;

public class ModelEvaluatorTest {

    private ExecutorService executor;
    private ModelEvaluator evaluator;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        evaluator = new ModelEvaluator(new ModelRegistry(), executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static double[] wave(int n) {
        double[] s = new double[n];
        for (int i = 0; i < n; i++) {
            s[i] = Math.sin(i / 5.0) + 0.01 * i;
        }
        return s;
    }

    /**
     * Feature di una riga per posizione della serie: il valore corrente e l'indice.
     */
    private static FeatureMatrix features(double[] series) {
        double[] idx = new double[series.length];
        for (int i = 0; i < idx.length; i++) {
            idx[i] = i;
        }
        Map<String, double[]> cols = new LinkedHashMap<>();
        cols.put("current", series.clone());
        cols.put("index", idx);
        return new FeatureMatrix(cols, TestSeries.daily(series.length), 0, List.of());
    }

    private static ModelSpec smallForest() {
        return new ModelSpec(ModelVariant.RANDOM_FOREST, Map.of("n_estimators", 10));
    }

    private static EvaluationSettings settings(List<ModelSpec> models, int folds, SplitMode mode, Duration timeout) {
        return new EvaluationSettings(models, folds, mode, 1, timeout);
    }

    @Test
    void testFiveBlockedFoldsOnHundredRows() {
        double[] series = wave(101);
        EvaluationReport report = evaluator.evaluate(features(series), series,
                settings(List.of(smallForest()), 5, SplitMode.BLOCKED, Duration.ofSeconds(30)),
                DoubleUnaryOperator.identity());

        assertEquals(100, report.rows());
        EvaluationResult r = report.evaluations().get(0);
        assertEquals(5, r.folds().size());
        for (FoldResult f : r.folds()) {
            assertEquals(80, f.trainSize());
            assertEquals(20, f.validationSize());
            assertTrue(f.succeeded());
        }
        assertEquals(0, r.failedFolds());
        assertEquals(List.of("mae", "rmse", "mse", "r2"), List.copyOf(r.metrics().keySet()));
        assertEquals(Math.sqrt(r.folds().get(0).mse()), r.folds().get(0).rmse(), 1e-12);
        assertNotNull(r.forecast());
        assertEquals(1.0, r.featureImportance().values().stream().mapToDouble(Double::doubleValue).sum(), 1e-9);
        assertEquals(ModelVariant.RANDOM_FOREST, report.bestModel());
    }

    @Test
    void testDegenerateFoldIsRecordedAndOthersAggregated() {
        // Target delle righe 20..99 costante: il training del fold 0 è degenere
        double[] series = new double[101];
        for (int i = 0; i < series.length; i++) {
            series[i] = i <= 20 ? Math.sin(i) : 1.0;
        }
        EvaluationReport report = evaluator.evaluate(features(series), series,
                settings(List.of(smallForest()), 5, SplitMode.BLOCKED, Duration.ofSeconds(30)),
                DoubleUnaryOperator.identity());

        EvaluationResult r = report.evaluations().get(0);
        assertEquals(1, r.failedFolds());
        assertFalse(r.folds().get(0).succeeded());
        assertNotNull(r.folds().get(0).error());
        assertNull(r.folds().get(0).mae());
        for (int f = 1; f < 5; f++) {
            assertTrue(r.folds().get(f).succeeded(), "fold " + f);
        }

        double meanMae = r.folds().stream().skip(1).mapToDouble(FoldResult::mae).average().orElseThrow();
        assertEquals(meanMae, r.metrics().get("mae").mean(), 1e-12);
    }

    @Test
    void testMetricsAndForecastShareOriginalUnits() {
        double[] series = wave(101);
        EvaluationSettings s = settings(List.of(smallForest()), 5, SplitMode.BLOCKED, Duration.ofSeconds(30));
        EvaluationResult scaled = evaluator.evaluate(features(series), series, s, v -> 100.0 * v + 500.0)
                .evaluations().get(0);
        EvaluationResult raw = evaluator.evaluate(features(series), series, s, DoubleUnaryOperator.identity())
                .evaluations().get(0);

        assertEquals(100.0 * raw.metrics().get("mae").mean(), scaled.metrics().get("mae").mean(), 1e-9);
        assertEquals(100.0 * raw.metrics().get("rmse").mean(), scaled.metrics().get("rmse").mean(), 1e-9);
        assertEquals(raw.metrics().get("r2").mean(), scaled.metrics().get("r2").mean(), 1e-9);
        assertEquals(100.0 * raw.forecast() + 500.0, scaled.forecast(), 1e-9);
    }

    @Test
    void testForwardChainingValidatesAfterTraining() {
        double[] series = wave(101);
        EvaluationReport report = evaluator.evaluate(features(series), series,
                settings(List.of(smallForest()), 4, SplitMode.FORWARD_CHAINING, Duration.ofSeconds(30)),
                DoubleUnaryOperator.identity());

        List<FoldResult> folds = report.evaluations().get(0).folds();
        assertEquals(List.of(20, 40, 60, 80), folds.stream().map(FoldResult::trainSize).toList());
        assertTrue(folds.stream().allMatch(f -> f.validationSize() == 20));
    }

    @Test
    void testBlockedSplitSizes() {
        List<int[][]> splits = ModelEvaluator.splits(10, 3, SplitMode.BLOCKED);
        assertEquals(4, splits.get(0)[1].length);
        assertEquals(3, splits.get(1)[1].length);
        assertEquals(3, splits.get(2)[1].length);
        assertArrayEquals(new int[]{4, 5, 6}, splits.get(1)[1]);
        assertEquals(7, splits.get(1)[0].length);
    }

    @Test
    void testTooFewRowsForFolds() {
        double[] series = wave(5);
        assertThrows(ModelFitException.class, () -> evaluator.evaluate(features(series), series,
                settings(List.of(smallForest()), 5, SplitMode.BLOCKED, Duration.ofSeconds(30)),
                DoubleUnaryOperator.identity()));
    }

    @Test
    void testBudgetExceededRaisesTimeout() {
        double[] series = wave(201);
        List<ModelSpec> models = List.of(ModelSpec.of(ModelVariant.RANDOM_FOREST),
                ModelSpec.of(ModelVariant.GRADIENT_BOOSTING));
        assertThrows(AnalysisTimeoutException.class, () -> evaluator.evaluate(features(series), series,
                settings(models, 5, SplitMode.BLOCKED, Duration.ofNanos(1)),
                DoubleUnaryOperator.identity()));
    }

    @Test
    void testBestModelHasLowestMeanMae() {
        double[] series = wave(121);
        List<ModelSpec> models = List.of(smallForest(),
                new ModelSpec(ModelVariant.GRADIENT_BOOSTING, Map.of("n_estimators", 20)));
        EvaluationReport report = evaluator.evaluate(features(series), series,
                settings(models, 3, SplitMode.BLOCKED, Duration.ofSeconds(30)),
                v -> v * 10.0);

        EvaluationResult best = report.evaluations().stream()
                .min((a, b) -> Double.compare(a.meanMae(), b.meanMae())).orElseThrow();
        assertEquals(best.model(), report.bestModel());
        assertEquals(2, report.evaluations().size());
        assertEquals(ModelVariant.RANDOM_FOREST, report.evaluations().get(0).model());
    }
}
