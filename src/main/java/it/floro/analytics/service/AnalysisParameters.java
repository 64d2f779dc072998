package it.floro.analytics.service;

import it.floro.analytics.domain.AnalysisType;
import it.floro.analytics.domain.AnomalyMethod;
import it.floro.analytics.domain.EvaluationSettings;
import it.floro.analytics.domain.FeatureConfig;
import it.floro.analytics.domain.ImputationPolicy;
import it.floro.analytics.domain.ModelSpec;
import it.floro.analytics.domain.NormalizationMethod;
import it.floro.analytics.domain.OutlierPolicy;
import it.floro.analytics.domain.PipelineWarning;
import it.floro.analytics.domain.SlopeUnit;
import it.floro.analytics.domain.ValidationRequirements;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parametri completamente risolti di una richiesta: default di configurazione
 * sovrascritti dai valori della richiesta, già validati.
 */
public record AnalysisParameters(
        AnalysisType type,
        ValidationRequirements requirements,
        OutlierPolicy outlierPolicy,
        ImputationPolicy imputationPolicy,
        NormalizationMethod normalization,
        FeatureConfig features,
        EvaluationSettings evaluation,
        AnomalyMethod anomalyMethod,
        double sensitivity,
        int anomalyWindow,
        double contamination,
        int trendWindow,
        SlopeUnit slopeUnit,
        double confidenceLevel,
        List<PipelineWarning> warnings      // Parametri sconosciuti o ignorati
) {

    public AnalysisParameters {
        warnings = List.copyOf(warnings);
    }

    /**
     * Vista snake_case dei parametri effettivi, riportata nel risultato.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("min_points", requirements.minPoints());
        m.put("outlier_method", outlierPolicy.method().code());
        m.put("outlier_action", outlierPolicy.action().code());
        m.put("iqr_k", outlierPolicy.iqrK());
        m.put("zscore_threshold", outlierPolicy.zThreshold());
        m.put("imputation_policy", imputationPolicy.code());
        switch (type) {
            case MODEL_EVAL -> {
                m.put("normalization", normalization.code());
                m.put("window_sizes", features.windowSizes());
                m.put("lags", features.lags());
                m.put("lag_edge_policy", features.edgePolicy().code());
                m.put("correlation_threshold", features.correlationThreshold());
                m.put("squared_features", features.squaredFeatures());
                m.put("interaction_features", features.interactionFeatures());
                m.put("models", evaluation.models().stream().map(s -> s.variant().code()).toList());
                Map<String, Object> hp = new LinkedHashMap<>();
                for (ModelSpec s : evaluation.models()) {
                    hp.put(s.variant().code(), s.hyperparameters());
                }
                m.put("hyperparameters", Collections.unmodifiableMap(hp));
                m.put("folds", evaluation.folds());
                m.put("split_mode", evaluation.splitMode().code());
                m.put("horizon", evaluation.horizon());
                m.put("timeout_ms", evaluation.timeout().toMillis());
            }
            case ANOMALY -> {
                m.put("anomaly_method", anomalyMethod.code());
                m.put("sensitivity", sensitivity);
                m.put("anomaly_window", anomalyWindow);
                if (anomalyMethod == AnomalyMethod.ISOLATION_FOREST) {
                    m.put("contamination", contamination);
                }
            }
            case TREND -> {
                m.put("trend_window", trendWindow);
                m.put("slope_unit", slopeUnit.code());
                m.put("confidence_level", confidenceLevel);
            }
        }
        return m;
    }
}
