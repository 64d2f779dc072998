package it.floro.analytics.service;

import it.floro.analytics.domain.AnalysisResult;
import it.floro.analytics.domain.AnomalyReport;
import it.floro.analytics.domain.CleaningReport;
import it.floro.analytics.domain.Dataset;
import it.floro.analytics.domain.EvaluationReport;
import it.floro.analytics.domain.NormalizationParameters;
import it.floro.analytics.domain.PipelineWarning;
import it.floro.analytics.domain.Section;
import it.floro.analytics.domain.SeriesSummary;
import it.floro.analytics.domain.TrendReport;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Composizione del risultato finale.
 *
 * I parametri riportati sono quelli effettivi: default risolti, più le operazioni di
 * pulizia e la normalizzazione realmente applicate, così che due risultati siano
 * confrontabili.
 */
@Component
public class ResultAssembler {

    private final Clock clock;

    public ResultAssembler(Clock clock) {
        this.clock = clock;
    }

    public AnalysisResult assemble(Dataset dataset,
                                   AnalysisParameters params,
                                   CleaningReport cleaning,
                                   NormalizationParameters normalization,
                                   SeriesSummary summary,
                                   Section<EvaluationReport> evaluation,
                                   Section<AnomalyReport> anomalies,
                                   Section<TrendReport> trends,
                                   List<PipelineWarning> warnings) {
        Map<String, Object> parameters = params.toMap();
        if (cleaning != null) {
            Map<String, Object> c = new LinkedHashMap<>();
            c.put("missing_count", cleaning.missingCount());
            c.put("outlier_count", cleaning.outlierPositions().size());
            c.put("imputed_count", cleaning.imputedPositions().size());
            c.put("dropped_count", cleaning.droppedCount());
            c.put("lower_bound", cleaning.lowerBound());
            c.put("upper_bound", cleaning.upperBound());
            parameters.put("cleaning", Collections.unmodifiableMap(c));
        }
        if (normalization != null) {
            Map<String, Object> n = new LinkedHashMap<>();
            n.put("method", normalization.method().code());
            n.put("min", normalization.min());
            n.put("max", normalization.max());
            n.put("mean", normalization.mean());
            n.put("std", normalization.std());
            n.put("constant", normalization.constant());
            parameters.put("normalization_parameters", Collections.unmodifiableMap(n));
        }
        return new AnalysisResult(
                UUID.randomUUID().toString(),
                params.type(),
                dataset.id(),
                dataset.source(),
                clock.instant(),
                parameters,
                summary,
                evaluation,
                anomalies,
                trends,
                warnings);
    }
}
