package it.floro.analytics.cache;

import it.floro.analytics.domain.AnalysisRequest;
import it.floro.analytics.domain.AnalysisResult;
import it.floro.analytics.domain.Dataset;
import it.floro.analytics.service.AnalysisPipeline;
import org.springframework.stereotype.Service;

/**
 * Punto d'ingresso per i chiamanti che vogliono riutilizzare i risultati:
 * compone la cache con la pipeline senza che quest'ultima ne sia consapevole.
 */
@Service
public class CachingAnalysisService {

    private final AnalysisPipeline pipeline;
    private final AnalysisCache cache;

    public CachingAnalysisService(AnalysisPipeline pipeline, AnalysisCache cache) {
        this.pipeline = pipeline;
        this.cache = cache;
    }

    public AnalysisResult analyze(Dataset dataset, AnalysisRequest request) {
        return cache.getOrCompute(AnalysisKey.of(dataset.id(), request), () -> pipeline.run(dataset, request));
    }
}
