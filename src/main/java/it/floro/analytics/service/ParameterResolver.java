package it.floro.analytics.service;

import it.floro.analytics.config.AnalyticsProperties;
import it.floro.analytics.domain.AnalysisRequest;
import it.floro.analytics.domain.AnalysisType;
import it.floro.analytics.domain.AnomalyMethod;
import it.floro.analytics.domain.EvaluationSettings;
import it.floro.analytics.domain.FeatureConfig;
import it.floro.analytics.domain.ImputationPolicy;
import it.floro.analytics.domain.LagEdgePolicy;
import it.floro.analytics.domain.ModelSpec;
import it.floro.analytics.domain.ModelVariant;
import it.floro.analytics.domain.NormalizationMethod;
import it.floro.analytics.domain.OutlierAction;
import it.floro.analytics.domain.OutlierMethod;
import it.floro.analytics.domain.OutlierPolicy;
import it.floro.analytics.domain.PipelineWarning;
import it.floro.analytics.domain.SlopeUnit;
import it.floro.analytics.domain.SplitMode;
import it.floro.analytics.domain.ValidationRequirements;
import it.floro.analytics.domain.WarningCode;
import it.floro.analytics.exception.ConfigurationException;
import it.floro.analytics.model.ModelRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Risoluzione dei parametri di una richiesta sui default di {@link AnalyticsProperties}.
 *
 * Responsabilità:
 * - Parsing e validazione di ogni parametro riconosciuto (valori non validi → ConfigurationException)
 * - Avviso UNKNOWN_PARAMETER per le chiavi non riconosciute
 * - Default dipendenti dal tipo: il rilevamento anomalie non rimuove outlier se non richiesto
 * - Verifica anticipata delle specifiche dei modelli
 */
@Component
public class ParameterResolver {

    private static final Logger logger = LoggerFactory.getLogger(ParameterResolver.class);

    static final Set<String> KNOWN_PARAMETERS = Set.of(
            "min_points", "outlier_method", "outlier_action", "iqr_k", "zscore_threshold",
            "imputation_policy", "normalization", "window_sizes", "lags", "lag_edge_policy",
            "correlation_threshold", "squared_features", "interaction_features", "models", "hyperparameters",
            "folds", "split_mode", "horizon", "timeout_ms", "sensitivity", "anomaly_method", "anomaly_window",
            "contamination", "trend_window", "slope_unit", "confidence_level");

    private final AnalyticsProperties properties;
    private final ModelRegistry registry;

    public ParameterResolver(AnalyticsProperties properties, ModelRegistry registry) {
        this.properties = properties;
        this.registry = registry;
    }

    /**
     * @throws ConfigurationException per tipo sconosciuto o valori non validi
     */
    public AnalysisParameters resolve(AnalysisRequest request) {
        AnalysisType type = AnalysisType.fromCode(request.type());
        Map<String, Object> p = request.parameters();
        List<PipelineWarning> warnings = new ArrayList<>();

        for (String key : p.keySet()) {
            if (!KNOWN_PARAMETERS.contains(key)) {
                logger.warn("Parametro sconosciuto ignorato: '{}'", key);
                warnings.add(PipelineWarning.of(WarningCode.UNKNOWN_PARAMETER,
                        "Parametro '%s' non riconosciuto, ignorato", key));
            }
        }

        AnalyticsProperties.Cleaning cleaning = properties.getCleaning();
        AnalyticsProperties.Features feat = properties.getFeatures();
        AnalyticsProperties.Evaluation eval = properties.getEvaluation();
        AnalyticsProperties.Anomaly anomaly = properties.getAnomaly();
        AnalyticsProperties.Trend trend = properties.getTrend();

        // ===== VALIDAZIONE E PULIZIA =====
        ValidationRequirements requirements = new ValidationRequirements(
                intParam(p, "min_points", properties.getValidation().getMinPoints(), 1));

        String methodDefault = type == AnalysisType.ANOMALY ? OutlierMethod.NONE.code() : cleaning.getOutlierMethod();
        OutlierPolicy outlierPolicy = new OutlierPolicy(
                OutlierMethod.fromCode(stringParam(p, "outlier_method", methodDefault)),
                OutlierAction.fromCode(stringParam(p, "outlier_action", cleaning.getOutlierAction())),
                positiveDouble(p, "iqr_k", cleaning.getIqrK()),
                positiveDouble(p, "zscore_threshold", cleaning.getZscoreThreshold()));
        ImputationPolicy imputation = ImputationPolicy.fromCode(
                stringParam(p, "imputation_policy", cleaning.getImputationPolicy()));
        NormalizationMethod normalization = NormalizationMethod.fromCode(
                stringParam(p, "normalization", properties.getNormalization().getMethod()));

        // ===== FEATURE =====
        double threshold = doubleParam(p, "correlation_threshold", feat.getCorrelationThreshold());
        if (!(threshold > 0.0 && threshold <= 1.0)) {
            throw new ConfigurationException("correlation_threshold deve essere in (0, 1]: " + threshold);
        }
        FeatureConfig features = new FeatureConfig(
                intList(p, "window_sizes", feat.getWindowSizes()),
                intList(p, "lags", feat.getLags()),
                threshold,
                LagEdgePolicy.fromCode(stringParam(p, "lag_edge_policy", feat.getLagEdgePolicy())),
                booleanParam(p, "squared_features", feat.isSquaredFeatures()),
                booleanParam(p, "interaction_features", feat.isInteractionFeatures()));

        // ===== VALUTAZIONE =====
        List<ModelSpec> models = modelSpecs(p, eval.getModels(), warnings);
        if (type == AnalysisType.MODEL_EVAL) {
            for (ModelSpec spec : models) {
                warnings.addAll(registry.validate(spec));
            }
        }
        long timeoutMs = p.containsKey("timeout_ms")
                ? intParam(p, "timeout_ms", 1, 1)
                : eval.getTimeout().toMillis();
        EvaluationSettings evaluation = new EvaluationSettings(
                models,
                intParam(p, "folds", eval.getFolds(), 2),
                SplitMode.fromCode(stringParam(p, "split_mode", eval.getSplitMode())),
                intParam(p, "horizon", eval.getHorizon(), 1),
                Duration.ofMillis(Math.max(1L, timeoutMs)));

        // ===== ANOMALIE E TREND =====
        AnomalyMethod anomalyMethod = AnomalyMethod.fromCode(stringParam(p, "anomaly_method", anomaly.getMethod()));
        double sensitivity = positiveDouble(p, "sensitivity", anomaly.getSensitivity());
        int anomalyWindow = intParam(p, "anomaly_window", anomaly.getWindow(), 1);
        double contamination = doubleParam(p, "contamination", anomaly.getContamination());
        if (!(contamination > 0.0 && contamination <= 0.5)) {
            throw new ConfigurationException("contamination deve essere in (0, 0.5]: " + contamination);
        }
        int trendWindow = intParam(p, "trend_window", trend.getWindow(), 1);
        SlopeUnit slopeUnit = SlopeUnit.fromCode(stringParam(p, "slope_unit", trend.getSlopeUnit()));
        double confidence = doubleParam(p, "confidence_level", trend.getConfidenceLevel());
        if (!(confidence > 0.0 && confidence < 1.0)) {
            throw new ConfigurationException("confidence_level deve essere in (0, 1): " + confidence);
        }

        return new AnalysisParameters(type, requirements, outlierPolicy, imputation, normalization, features,
                evaluation, anomalyMethod, sensitivity, anomalyWindow, contamination, trendWindow, slopeUnit,
                confidence,
                warnings);
    }

    // ========================================================================
    // MODELLI
    // ========================================================================

    private static List<ModelSpec> modelSpecs(Map<String, Object> p, List<String> defaults,
                                              List<PipelineWarning> warnings) {
        Object raw = p.get("models");
        List<String> names = new ArrayList<>();
        if (raw == null) {
            names.addAll(defaults);
        } else if (raw instanceof Collection<?> c) {
            c.forEach(o -> names.add(String.valueOf(o)));
        } else {
            for (String s : raw.toString().split(",")) {
                names.add(s);
            }
        }
        Set<ModelVariant> variants = new LinkedHashSet<>();
        for (String name : names) {
            variants.add(ModelVariant.fromCode(name));
        }
        if (variants.isEmpty()) {
            throw new ConfigurationException("Nessun modello richiesto");
        }

        Map<ModelVariant, Map<String, Object>> hyper = new LinkedHashMap<>();
        Object rawHp = p.get("hyperparameters");
        if (rawHp != null) {
            if (!(rawHp instanceof Map<?, ?> byModel)) {
                throw new ConfigurationException("hyperparameters deve essere una mappa modello → parametri");
            }
            for (Map.Entry<?, ?> e : byModel.entrySet()) {
                ModelVariant v = ModelVariant.fromCode(String.valueOf(e.getKey()));
                if (!(e.getValue() instanceof Map<?, ?> values)) {
                    throw new ConfigurationException("Iperparametri di " + v.code() + " non in forma di mappa");
                }
                Map<String, Object> typed = new LinkedHashMap<>();
                values.forEach((k, val) -> typed.put(String.valueOf(k), val));
                if (!variants.contains(v)) {
                    logger.warn("Iperparametri di {} ignorati: modello non richiesto", v.code());
                    warnings.add(PipelineWarning.of(WarningCode.UNKNOWN_PARAMETER,
                            "Iperparametri di %s ignorati: modello non presente in models", v.code()));
                }
                hyper.put(v, typed);
            }
        }

        List<ModelSpec> specs = new ArrayList<>();
        for (ModelVariant v : variants) {
            specs.add(new ModelSpec(v, hyper.getOrDefault(v, Map.of())));
        }
        return specs;
    }

    // ========================================================================
    // PARSING
    // ========================================================================

    private static String stringParam(Map<String, Object> p, String key, String defaultValue) {
        Object v = p.get(key);
        return v == null ? defaultValue : v.toString();
    }

    private static int intParam(Map<String, Object> p, String key, int defaultValue, int min) {
        Object v = p.get(key);
        if (v == null) {
            return defaultValue;
        }
        int out = toInt(key, v);
        if (out < min) {
            throw new ConfigurationException(String.format("%s deve essere >= %d: %d", key, min, out));
        }
        return out;
    }

    private static double doubleParam(Map<String, Object> p, String key, double defaultValue) {
        Object v = p.get(key);
        if (v == null) {
            return defaultValue;
        }
        double out;
        if (v instanceof Number n) {
            out = n.doubleValue();
        } else {
            try {
                out = Double.parseDouble(v.toString().trim());
            } catch (NumberFormatException e) {
                throw new ConfigurationException("Valore non numerico per " + key + ": " + v, e);
            }
        }
        if (!Double.isFinite(out)) {
            throw new ConfigurationException("Valore non finito per " + key + ": " + v);
        }
        return out;
    }

    private static double positiveDouble(Map<String, Object> p, String key, double defaultValue) {
        double out = doubleParam(p, key, defaultValue);
        if (out <= 0.0) {
            throw new ConfigurationException(key + " deve essere > 0: " + out);
        }
        return out;
    }

    private static List<Integer> intList(Map<String, Object> p, String key, List<Integer> defaults) {
        Object v = p.get(key);
        if (v == null) {
            return List.copyOf(defaults);
        }
        List<Integer> out = new ArrayList<>();
        if (v instanceof Collection<?> c) {
            for (Object o : c) {
                out.add(positiveInt(key, o));
            }
        } else {
            out.add(positiveInt(key, v));
        }
        return out;
    }

    private static int positiveInt(String key, Object v) {
        int out = toInt(key, v);
        if (out < 1) {
            throw new ConfigurationException(key + ": i valori devono essere >= 1, ricevuto " + out);
        }
        return out;
    }

    private static boolean booleanParam(Map<String, Object> p, String key, boolean defaultValue) {
        Object v = p.get(key);
        if (v == null) {
            return defaultValue;
        }
        if (v instanceof Boolean b) {
            return b;
        }
        return switch (v.toString().trim().toLowerCase()) {
            case "true", "yes", "1" -> true;
            case "false", "no", "0" -> false;
            default -> throw new ConfigurationException("Valore non booleano per " + key + ": " + v);
        };
    }

    private static int toInt(String key, Object v) {
        if (v instanceof Number n) {
            double d = n.doubleValue();
            if (d != Math.rint(d)) {
                throw new ConfigurationException("Valore non intero per " + key + ": " + v);
            }
            if (d < Integer.MIN_VALUE || d > Integer.MAX_VALUE) {
                throw new ConfigurationException("Valore fuori dal range intero per " + key + ": " + v);
            }
            return n.intValue();
        }
        try {
            return Integer.parseInt(v.toString().trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Valore non intero per " + key + ": " + v, e);
        }
    }
}
