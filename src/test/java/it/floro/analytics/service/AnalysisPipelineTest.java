package it.floro.analytics.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import it.floro.analytics.TestSeries;
import it.floro.analytics.config.AnalyticsProperties;
import it.floro.analytics.domain.AnalysisRequest;
import it.floro.analytics.domain.AnalysisResult;
import it.floro.analytics.domain.DataPoint;
import it.floro.analytics.domain.Dataset;
import it.floro.analytics.domain.FailureKind;
import it.floro.analytics.domain.SectionStatus;
import it.floro.analytics.domain.WarningCode;
import it.floro.analytics.exception.ConfigurationException;
import it.floro.analytics.exception.DuplicateTimestampException;
import it.floro.analytics.exception.InsufficientDataException;
import it.floro.analytics.model.ModelRegistry;
import it.floro.analytics.simulator.ClimateSeriesSimulator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

public class AnalysisPipelineTest {

    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");

    private ExecutorService executor;
    private AnalysisPipeline pipeline;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        ModelRegistry registry = new ModelRegistry();
        pipeline = new AnalysisPipeline(
                new ParameterResolver(new AnalyticsProperties(), registry),
                new DatasetValidator(),
                new DataCleaner(),
                new SeriesNormalizer(),
                new FeatureBuilder(),
                new ModelEvaluator(registry, executor),
                new AnomalyDetector(),
                new TrendDetector(),
                new SeriesProfiler(),
                new ResultAssembler(Clock.fixed(NOW, ZoneOffset.UTC)));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static Dataset simulated(int days) {
        return new ClimateSeriesSimulator(42L, LocalDate.of(2023, 1, 1), days)
                .withTrendPerYear(1.5)
                .withMissingRate(0.1)
                .generate("sim-" + days);
    }

    @Test
    void testTrendEndToEnd() {
        AnalysisResult r = pipeline.run(simulated(120), AnalysisRequest.of("trend"));

        assertEquals(SectionStatus.COMPLETED, r.trends().status());
        assertEquals(SectionStatus.NOT_REQUESTED, r.evaluation().status());
        assertEquals(SectionStatus.NOT_REQUESTED, r.anomalies().status());
        assertEquals(4, r.trends().data().segments().size());
        assertEquals(120, r.summary().count());
        assertEquals(NOW, r.createdAt());
        assertEquals("sim-120", r.datasetId());
        assertEquals("simulator", r.datasetSource());
        assertEquals("iqr", r.parameters().get("outlier_method"));
        assertTrue(r.parameters().containsKey("cleaning"));
        assertTrue(r.warnings().stream().anyMatch(w -> w.code() == WarningCode.VALUES_IMPUTED));
    }

    @Test
    void testAnomalyFlagsInjectedSpike() {
        Dataset base = new ClimateSeriesSimulator(7L, LocalDate.of(2023, 1, 1), 200).generate("spiky");
        List<DataPoint> points = new ArrayList<>(base.points());
        DataPoint p = points.get(100);
        points.set(100, new DataPoint(p.timestamp(), 80.0, p.metadata()));
        Dataset ds = Dataset.of("spiky", "simulator", points);

        AnalysisResult r = pipeline.run(ds, AnalysisRequest.of("anomaly"));

        assertEquals(SectionStatus.COMPLETED, r.anomalies().status());
        assertEquals(200, r.anomalies().data().flags().size());
        assertTrue(r.anomalies().data().flags().get(100).flagged());
        assertEquals("none", r.parameters().get("outlier_method"));
    }

    @Test
    void testModelEvaluationEndToEnd() {
        AnalysisResult r = pipeline.run(simulated(150), new AnalysisRequest("model-eval", Map.of(
                "models", List.of("random-forest", "gradient-boosting"),
                "hyperparameters", Map.of(
                        "random-forest", Map.of("n_estimators", 15),
                        "gradient-boosting", Map.of("n_estimators", 30)))));

        assertEquals(SectionStatus.COMPLETED, r.evaluation().status());
        var report = r.evaluation().data();
        assertEquals(2, report.evaluations().size());
        assertTrue(report.evaluations().stream().allMatch(e -> e.folds().size() == 5));
        assertNotNull(report.bestModel());
        assertFalse(report.features().isEmpty());
        assertTrue(r.parameters().containsKey("normalization_parameters"));
        assertEquals("z-score", r.parameters().get("normalization"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void testAssembledResultCannotBeModified() {
        AnalysisResult trend = pipeline.run(simulated(90), AnalysisRequest.of("trend"));
        Map<String, Object> cleaning = (Map<String, Object>) trend.parameters().get("cleaning");
        assertThrows(UnsupportedOperationException.class, () -> cleaning.put("missing_count", 999));
        assertThrows(UnsupportedOperationException.class, () -> trend.parameters().put("trend_window", 1));

        AnalysisResult eval = pipeline.run(simulated(120), new AnalysisRequest("model-eval", Map.of(
                "models", List.of("svr"),
                "folds", 3,
                "hyperparameters", Map.of("svr", Map.of("c", 2.0)))));
        Map<String, Object> normalization = (Map<String, Object>) eval.parameters().get("normalization_parameters");
        Map<String, Object> hyper = (Map<String, Object>) eval.parameters().get("hyperparameters");
        List<Object> windows = (List<Object>) eval.parameters().get("window_sizes");
        assertThrows(UnsupportedOperationException.class, () -> normalization.put("mean", 0.0));
        assertThrows(UnsupportedOperationException.class, () -> hyper.put("svr", Map.of()));
        assertThrows(UnsupportedOperationException.class,
                () -> ((Map<String, Object>) hyper.get("svr")).put("c", 5.0));
        assertThrows(UnsupportedOperationException.class, () -> windows.add(30));
    }

    @Test
    void testIsolationForestAnomalies() {
        List<DataPoint> points = new ArrayList<>();
        List<Instant> ts = TestSeries.daily(120);
        for (int i = 0; i < 120; i++) {
            points.add(new DataPoint(ts.get(i), i == 60 ? 200.0 : 15.0 + Math.sin(i / 7.0), Map.of()));
        }
        AnalysisResult r = pipeline.run(new Dataset("iso", "test", "picco isolato", points),
                new AnalysisRequest("anomaly", Map.of("anomaly_method", "isolation-forest")));

        assertEquals(SectionStatus.COMPLETED, r.anomalies().status());
        assertTrue(r.anomalies().data().flags().get(60).flagged());
        assertEquals("isolation-forest", r.parameters().get("anomaly_method"));
        assertEquals(0.1, r.parameters().get("contamination"));
    }

    @Test
    void testUnimputableSeriesFailsSectionOnly() {
        AnalysisResult r = pipeline.run(TestSeries.dataset(null, null, null, null), AnalysisRequest.of("trend"));

        assertEquals(SectionStatus.FAILED, r.trends().status());
        assertEquals(FailureKind.IMPUTATION, r.trends().failure().kind());
        assertEquals(SectionStatus.NOT_REQUESTED, r.evaluation().status());
        assertNull(r.summary());
        assertTrue(r.warnings().stream().anyMatch(w -> w.code() == WarningCode.SECTION_FAILED));
    }

    @Test
    void testTimeoutFailsEvaluationSection() {
        AnalysisResult r = pipeline.run(simulated(200),
                new AnalysisRequest("model-eval", Map.of("timeout_ms", 1)));

        assertEquals(SectionStatus.FAILED, r.evaluation().status());
        assertEquals(FailureKind.TIMEOUT, r.evaluation().failure().kind());
    }

    @Test
    void testTooFewRowsFailsEvaluationAsModelFit() {
        AnalysisResult r = pipeline.run(TestSeries.dataset(1.0, 4.0, 2.0, 5.0, 3.0, 6.0),
                AnalysisRequest.of("model-eval"));

        assertEquals(SectionStatus.FAILED, r.evaluation().status());
        assertEquals(FailureKind.MODEL_FIT, r.evaluation().failure().kind());
    }

    @Test
    void testValidationAndConfigurationErrorsEscape() {
        assertThrows(ConfigurationException.class,
                () -> pipeline.run(simulated(30), AnalysisRequest.of("clustering")));
        assertThrows(InsufficientDataException.class,
                () -> pipeline.run(Dataset.of("empty", "test", List.of()), AnalysisRequest.of("trend")));

        Instant t = TestSeries.START;
        Dataset dup = Dataset.of("dup", "test", List.of(
                DataPoint.of(t, 1.0), DataPoint.of(t.plusSeconds(60), 2.0), DataPoint.of(t, 3.0)));
        assertThrows(DuplicateTimestampException.class, () -> pipeline.run(dup, AnalysisRequest.of("anomaly")));
    }

    @Test
    void testUnknownParameterReportedInResult() {
        AnalysisResult r = pipeline.run(simulated(40), new AnalysisRequest("trend", Map.of("smoothing", 3)));
        assertTrue(r.warnings().stream().anyMatch(w ->
                w.code() == WarningCode.UNKNOWN_PARAMETER && w.message().contains("smoothing")));
        assertEquals(SectionStatus.COMPLETED, r.trends().status());
    }

    @Test
    void testSerializesWithStableSnakeCaseNames() throws Exception {
        AnalysisResult r = pipeline.run(simulated(60), AnalysisRequest.of("trend"));
        ObjectMapper mapper = JsonMapper.builder().addModule(new JavaTimeModule()).build();

        JsonNode json = mapper.readTree(mapper.writeValueAsString(r));

        assertEquals("trend", json.get("type").asText());
        assertEquals("sim-60", json.get("dataset_id").asText());
        assertTrue(json.has("created_at"));
        assertEquals("NOT_REQUESTED", json.get("evaluation").get("status").asText());
        JsonNode segment = json.get("trends").get("data").get("segments").get(0);
        assertTrue(segment.has("point_count"));
        assertTrue(segment.has("ci_lower"));
        assertTrue(json.get("summary").has("slope_per_step"));
        assertFalse(json.get("trends").has("completed"));
    }
}
