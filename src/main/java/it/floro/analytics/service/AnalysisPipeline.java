package it.floro.analytics.service;

import it.floro.analytics.domain.AnalysisRequest;
import it.floro.analytics.domain.AnalysisResult;
import it.floro.analytics.domain.AnomalyReport;
import it.floro.analytics.domain.CleanedSeries;
import it.floro.analytics.domain.CleaningReport;
import it.floro.analytics.domain.Dataset;
import it.floro.analytics.domain.EvaluationReport;
import it.floro.analytics.domain.EvaluationResult;
import it.floro.analytics.domain.FailureKind;
import it.floro.analytics.domain.FeatureMatrix;
import it.floro.analytics.domain.NormalizationParameters;
import it.floro.analytics.domain.NormalizedSeries;
import it.floro.analytics.domain.PipelineWarning;
import it.floro.analytics.domain.Section;
import it.floro.analytics.domain.SeriesSummary;
import it.floro.analytics.domain.TrendReport;
import it.floro.analytics.domain.ValidatedDataset;
import it.floro.analytics.domain.WarningCode;
import it.floro.analytics.exception.AnalysisTimeoutException;
import it.floro.analytics.exception.ConfigurationException;
import it.floro.analytics.exception.ImputationException;
import it.floro.analytics.exception.ModelFitException;
import it.floro.analytics.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Orchestrazione di un'analisi: validazione, pulizia, normalizzazione, feature,
 * analisi richiesta e composizione del risultato.
 *
 * Solo gli errori di validazione e di configurazione interrompono la richiesta.
 * Imputazione impossibile, fit falliti e budget superato diventano sezioni fallite
 * e avvisi. La pipeline non ha stato: ogni invocazione lavora sui propri dati.
 */
@Service
public class AnalysisPipeline {

    private static final Logger logger = LoggerFactory.getLogger(AnalysisPipeline.class);

    private final ParameterResolver resolver;
    private final DatasetValidator validator;
    private final DataCleaner cleaner;
    private final SeriesNormalizer normalizer;
    private final FeatureBuilder featureBuilder;
    private final ModelEvaluator evaluator;
    private final AnomalyDetector anomalyDetector;
    private final TrendDetector trendDetector;
    private final SeriesProfiler profiler;
    private final ResultAssembler assembler;

    public AnalysisPipeline(ParameterResolver resolver,
                            DatasetValidator validator,
                            DataCleaner cleaner,
                            SeriesNormalizer normalizer,
                            FeatureBuilder featureBuilder,
                            ModelEvaluator evaluator,
                            AnomalyDetector anomalyDetector,
                            TrendDetector trendDetector,
                            SeriesProfiler profiler,
                            ResultAssembler assembler) {
        this.resolver = resolver;
        this.validator = validator;
        this.cleaner = cleaner;
        this.normalizer = normalizer;
        this.featureBuilder = featureBuilder;
        this.evaluator = evaluator;
        this.anomalyDetector = anomalyDetector;
        this.trendDetector = trendDetector;
        this.profiler = profiler;
        this.assembler = assembler;
    }

    /**
     * Esegue l'analisi richiesta sul dataset.
     *
     * @throws ConfigurationException per tipo o parametri non validi
     * @throws ValidationException se il dataset non è analizzabile
     */
    public AnalysisResult run(Dataset dataset, AnalysisRequest request) {
        AnalysisParameters params = resolver.resolve(request);
        logger.info("Analisi '{}' sul dataset '{}' ({} punti)",
                params.type().code(), dataset.id(), dataset.size());

        ValidatedDataset validated = validator.validate(dataset, params.requirements());
        List<PipelineWarning> warnings = new ArrayList<>(params.warnings());

        // ===== PULIZIA =====
        CleanedSeries cleaning;
        try {
            cleaning = cleaner.clean(validated, params.outlierPolicy(), params.imputationPolicy());
        } catch (ImputationException e) {
            logger.warn("Pulizia fallita per il dataset '{}': {}", dataset.id(), e.getMessage());
            warnings.add(PipelineWarning.of(WarningCode.SECTION_FAILED,
                    "Sezione %s non calcolata: %s", params.type().code(), e.getMessage()));
            Section<EvaluationReport> evaluation = Section.notRequested();
            Section<AnomalyReport> anomalies = Section.notRequested();
            Section<TrendReport> trends = Section.notRequested();
            switch (params.type()) {
                case MODEL_EVAL -> evaluation = Section.failed(FailureKind.IMPUTATION, e.getMessage());
                case ANOMALY -> anomalies = Section.failed(FailureKind.IMPUTATION, e.getMessage());
                case TREND -> trends = Section.failed(FailureKind.IMPUTATION, e.getMessage());
            }
            return assembler.assemble(dataset, params, null, null, null, evaluation, anomalies, trends, warnings);
        }
        CleanedSeries cleaned = cleaning;
        addCleaningWarnings(cleaned.report(), warnings);
        SeriesSummary summary = profiler.profile(cleaned);

        // ===== ANALISI =====
        Section<EvaluationReport> evaluation = Section.notRequested();
        Section<AnomalyReport> anomalies = Section.notRequested();
        Section<TrendReport> trends = Section.notRequested();
        AtomicReference<NormalizationParameters> normalization = new AtomicReference<>();

        switch (params.type()) {
            case TREND -> trends = section("trend", warnings, () -> trendDetector.detect(
                    cleaned, params.trendWindow(), params.slopeUnit(), params.confidenceLevel()));
            case ANOMALY -> anomalies = section("anomaly", warnings, () -> anomalyDetector.detect(
                    cleaned, params.anomalyMethod(), params.sensitivity(), params.anomalyWindow(),
                    params.contamination()));
            case MODEL_EVAL -> evaluation = section("model-eval", warnings, () -> {
                NormalizedSeries normalized = normalizer.normalize(cleaned, params.normalization());
                normalization.set(normalized.parameters());
                warnings.addAll(normalized.warnings());
                FeatureMatrix features = featureBuilder.build(normalized, params.features());
                warnings.addAll(features.warnings());
                EvaluationReport report = evaluator.evaluate(features, normalized.values(), params.evaluation(),
                        normalized::denormalize);
                for (EvaluationResult r : report.evaluations()) {
                    if (r.failedFolds() > 0) {
                        warnings.add(PipelineWarning.of(WarningCode.MODEL_FIT_FAILED,
                                "%s: %d fold su %d falliti", r.model().code(), r.failedFolds(), r.folds().size()));
                    }
                }
                return report;
            });
        }

        AnalysisResult result = assembler.assemble(dataset, params, cleaned.report(), normalization.get(),
                summary, evaluation, anomalies, trends, warnings);
        logger.info("Analisi '{}' completata: risultato {} con {} avvisi",
                params.type().code(), result.id(), result.warnings().size());
        return result;
    }

    private static void addCleaningWarnings(CleaningReport report, List<PipelineWarning> warnings) {
        if (!report.outlierPositions().isEmpty()) {
            warnings.add(PipelineWarning.of(WarningCode.OUTLIERS_DETECTED,
                    "%d outlier rilevati (%s)", report.outlierPositions().size(),
                    report.outlierPolicy().method().code()));
        }
        if (!report.imputedPositions().isEmpty()) {
            warnings.add(PipelineWarning.of(WarningCode.VALUES_IMPUTED,
                    "%d valori imputati (%s)", report.imputedPositions().size(),
                    report.imputationPolicy().code()));
        }
    }

    /**
     * Esegue il calcolo di una sezione traducendo i fallimenti recuperabili in una sezione fallita.
     */
    private static <T> Section<T> section(String name, List<PipelineWarning> warnings, Supplier<T> body) {
        try {
            return Section.completed(body.get());
        } catch (ModelFitException e) {
            return failed(name, FailureKind.MODEL_FIT, e, warnings);
        } catch (AnalysisTimeoutException e) {
            return failed(name, FailureKind.TIMEOUT, e, warnings);
        } catch (ImputationException e) {
            return failed(name, FailureKind.IMPUTATION, e, warnings);
        } catch (ValidationException | ConfigurationException e) {
            throw e;
        } catch (RuntimeException e) {
            logger.error("Errore inatteso nella sezione {}", name, e);
            return failed(name, FailureKind.INTERNAL, e, warnings);
        }
    }

    private static <T> Section<T> failed(String name, FailureKind kind, RuntimeException e,
                                         List<PipelineWarning> warnings) {
        logger.warn("Sezione {} fallita ({}): {}", name, kind, e.getMessage());
        warnings.add(PipelineWarning.of(WarningCode.SECTION_FAILED, "Sezione %s fallita: %s", name, e.getMessage()));
        return Section.failed(kind, e.getMessage());
    }
}
