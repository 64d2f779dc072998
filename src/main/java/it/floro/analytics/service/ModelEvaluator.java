package it.floro.analytics.service;

import it.floro.analytics.domain.EvaluationReport;
import it.floro.analytics.domain.EvaluationResult;
import it.floro.analytics.domain.EvaluationSettings;
import it.floro.analytics.domain.FeatureMatrix;
import it.floro.analytics.domain.FoldResult;
import it.floro.analytics.domain.MetricSummary;
import it.floro.analytics.domain.ModelSpec;
import it.floro.analytics.domain.ModelVariant;
import it.floro.analytics.domain.RegressionMetrics;
import it.floro.analytics.domain.SplitMode;
import it.floro.analytics.exception.AnalysisTimeoutException;
import it.floro.analytics.exception.AnalyticsException;
import it.floro.analytics.exception.ModelFitException;
import it.floro.analytics.model.FittedModel;
import it.floro.analytics.model.ModelRegistry;
import it.floro.analytics.model.RegressionModel;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.DoubleUnaryOperator;

/**
 * Valutazione delle varianti di modello con cross-validation temporale.
 *
 * Responsabilità:
 * - Costruzione del target: valore normalizzato {@code horizon} passi dopo ogni riga
 * - Suddivisione in fold contigui (blocked) o a finestra crescente (forward-chaining), mai mescolati
 * - Esecuzione parallela dei fold sull'executor condiviso, entro il budget di tempo
 * - Aggregazione delle metriche sui fold riusciti (media e deviazione di popolazione)
 * - Ristima su tutte le righe per importanza delle feature e previsione
 *
 * Un fold il cui fit fallisce viene registrato come fallito senza interrompere gli altri.
 * Allo scadere del budget i task pendenti vengono cancellati.
 */
@Service
public class ModelEvaluator {

    private static final Logger logger = LoggerFactory.getLogger(ModelEvaluator.class);

    static final List<String> METRICS = List.of("mae", "rmse", "mse", "r2");

    private final ModelRegistry registry;
    private final ExecutorService executor;

    public ModelEvaluator(ModelRegistry registry, ExecutorService executor) {
        this.registry = registry;
        this.executor = executor;
    }

    /**
     * @param features Matrice delle feature; la riga r corrisponde alla posizione
     *                 {@code rowOffset + r} della serie
     * @param series Valori normalizzati della serie completa
     * @param settings Modelli, fold, modalità di split, orizzonte e budget
     * @param denormalize Conversione della previsione in unità originali
     * @throws ModelFitException se le righe con target non bastano per i fold richiesti
     * @throws AnalysisTimeoutException se il budget viene superato
     */
    public EvaluationReport evaluate(FeatureMatrix features, double[] series, EvaluationSettings settings,
                                     DoubleUnaryOperator denormalize) {
        long deadline = System.nanoTime() + settings.timeout().toNanos();
        int h = settings.horizon();

        // ===== TARGET =====
        int rows = Math.max(0, Math.min(features.rowCount(), series.length - h - features.rowOffset()));
        double[] target = new double[rows];
        for (int r = 0; r < rows; r++) {
            target[r] = series[features.rowOffset() + r + h];
        }
        if (rows < 2 || features.columnCount() == 0) {
            throw new ModelFitException(String.format(
                    "Righe di training insufficienti (%d) o nessuna feature per la valutazione", rows));
        }
        FeatureMatrix trainable = features.selectRange(0, rows);
        List<int[][]> splits = splits(rows, settings.folds(), settings.splitMode());

        // ===== FOLD =====
        List<Future<FoldResult>> foldFutures = new ArrayList<>();
        List<Future<Refit>> refitFutures = new ArrayList<>();
        try {
            for (ModelSpec spec : settings.models()) {
                RegressionModel model = registry.create(spec);
                for (int f = 0; f < splits.size(); f++) {
                    foldFutures.add(executor.submit(foldTask(model, trainable, target, f, splits.get(f), denormalize)));
                }
                refitFutures.add(executor.submit(refitTask(model, trainable, target, features, denormalize)));
            }

            List<EvaluationResult> results = new ArrayList<>();
            int perModel = splits.size();
            for (int m = 0; m < settings.models().size(); m++) {
                ModelSpec spec = settings.models().get(m);
                List<FoldResult> folds = new ArrayList<>();
                for (int f = 0; f < perModel; f++) {
                    folds.add(await(foldFutures.get(m * perModel + f), deadline, settings));
                }
                Refit refit = await(refitFutures.get(m), deadline, settings);
                results.add(aggregate(spec, folds, refit));
            }

            ModelVariant best = results.stream()
                    .filter(EvaluationResult::hasSuccessfulFold)
                    .min(Comparator.comparingDouble(EvaluationResult::meanMae))
                    .map(EvaluationResult::model)
                    .orElse(null);

            logger.info("Valutazione completata: {} modelli, {} fold, {} righe, migliore {}",
                    results.size(), perModel, rows, best == null ? "-" : best.code());
            return new EvaluationReport(results, best, features.featureNames(), rows,
                    settings.splitMode(), h);
        } finally {
            foldFutures.forEach(fu -> fu.cancel(true));
            refitFutures.forEach(fu -> fu.cancel(true));
        }
    }

    // ========================================================================
    // SPLIT
    // ========================================================================

    /**
     * @return Per ogni fold la coppia {training, validazione} di indici di riga
     */
    static List<int[][]> splits(int n, int k, SplitMode mode) {
        List<int[][]> out = new ArrayList<>();
        if (mode == SplitMode.BLOCKED) {
            if (n < k) {
                throw new ModelFitException(String.format("%d righe non bastano per %d fold", n, k));
            }
            int start = 0;
            for (int f = 0; f < k; f++) {
                int size = n / k + (f < n % k ? 1 : 0);
                int[] validation = range(start, start + size);
                int[] train = new int[n - size];
                int t = 0;
                for (int i = 0; i < n; i++) {
                    if (i < start || i >= start + size) {
                        train[t++] = i;
                    }
                }
                out.add(new int[][]{train, validation});
                start += size;
            }
        } else {
            int testSize = n / (k + 1);
            if (testSize < 1) {
                throw new ModelFitException(String.format(
                        "%d righe non bastano per %d fold a finestra crescente", n, k));
            }
            for (int f = 0; f < k; f++) {
                int trainEnd = n - (k - f) * testSize;
                out.add(new int[][]{range(0, trainEnd), range(trainEnd, trainEnd + testSize)});
            }
        }
        return out;
    }

    private static int[] range(int from, int to) {
        int[] r = new int[to - from];
        for (int i = 0; i < r.length; i++) {
            r[i] = from + i;
        }
        return r;
    }

    // ========================================================================
    // TASK
    // ========================================================================

    /**
     * Le metriche del fold sono calcolate dopo aver riportato osservati e predetti nelle
     * unità originali, le stesse della previsione.
     */
    private static Callable<FoldResult> foldTask(RegressionModel model, FeatureMatrix features, double[] target,
                                                 int fold, int[][] split, DoubleUnaryOperator denormalize) {
        return () -> {
            int[] train = split[0];
            int[] validation = split[1];
            try {
                FittedModel fitted = model.fit(features.selectRows(train), pick(target, train));
                double[] predicted = model.predict(fitted, features.selectRows(validation));
                RegressionMetrics metrics = RegressionMetrics.of(
                        denormalize(pick(target, validation), denormalize), denormalize(predicted, denormalize));
                return FoldResult.success(fold, train.length, validation.length, metrics);
            } catch (ModelFitException e) {
                logger.warn("Fold {} di {} fallito: {}", fold, model.variant().code(), e.getMessage());
                return FoldResult.failure(fold, train.length, validation.length, e.getMessage());
            }
        };
    }

    private static Callable<Refit> refitTask(RegressionModel model, FeatureMatrix trainable, double[] target,
                                             FeatureMatrix all, DoubleUnaryOperator denormalize) {
        return () -> {
            try {
                FittedModel fitted = model.fit(trainable, target);
                Map<String, Double> importance = model.importance(fitted);
                double next = fitted.predict(all.row(all.rowCount() - 1));
                return new Refit(importance, denormalize.applyAsDouble(next));
            } catch (ModelFitException e) {
                logger.warn("Ristima di {} fallita: {}", model.variant().code(), e.getMessage());
                return new Refit(null, null);
            }
        };
    }

    private static double[] denormalize(double[] v, DoubleUnaryOperator denormalize) {
        double[] out = new double[v.length];
        for (int i = 0; i < v.length; i++) {
            out[i] = denormalize.applyAsDouble(v[i]);
        }
        return out;
    }

    private static double[] pick(double[] v, int[] idx) {
        double[] out = new double[idx.length];
        for (int i = 0; i < idx.length; i++) {
            out[i] = v[idx[i]];
        }
        return out;
    }

    private static <T> T await(Future<T> future, long deadline, EvaluationSettings settings) {
        try {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0 && !future.isDone()) {
                throw new AnalysisTimeoutException("cross-validation", settings.timeout());
            }
            return future.get(Math.max(0L, remaining), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            throw new AnalysisTimeoutException("cross-validation", settings.timeout());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AnalysisTimeoutException("Valutazione interrotta", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            throw new AnalyticsException("Errore durante la valutazione", e.getCause());
        }
    }

    // ========================================================================
    // AGGREGAZIONE
    // ========================================================================

    private static EvaluationResult aggregate(ModelSpec spec, List<FoldResult> folds, Refit refit) {
        Map<String, DescriptiveStatistics> stats = new LinkedHashMap<>();
        METRICS.forEach(m -> stats.put(m, new DescriptiveStatistics()));
        int failed = 0;
        for (FoldResult f : folds) {
            if (!f.succeeded()) {
                failed++;
                continue;
            }
            stats.get("mae").addValue(f.mae());
            stats.get("rmse").addValue(f.rmse());
            stats.get("mse").addValue(f.mse());
            stats.get("r2").addValue(f.r2());
        }
        Map<String, MetricSummary> metrics = new LinkedHashMap<>();
        for (Map.Entry<String, DescriptiveStatistics> e : stats.entrySet()) {
            DescriptiveStatistics s = e.getValue();
            metrics.put(e.getKey(), s.getN() == 0
                    ? null
                    : new MetricSummary(s.getMean(), Math.sqrt(s.getPopulationVariance())));
        }
        return new EvaluationResult(spec.variant(), spec.hyperparameters(), folds, metrics, failed,
                refit.importance(), refit.forecast());
    }

    private record Refit(Map<String, Double> importance, Double forecast) {
    }
}
