package it.floro.analytics.service;

import it.floro.analytics.domain.CleanedSeries;
import it.floro.analytics.domain.NormalizationMethod;
import it.floro.analytics.domain.NormalizationParameters;
import it.floro.analytics.domain.NormalizedSeries;
import it.floro.analytics.domain.PipelineWarning;
import it.floro.analytics.domain.WarningCode;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Normalizzazione della serie pulita per rendere confrontabili dataset diversi.
 *
 * Una serie costante (o a varianza nulla) produce tutti zeri e un avviso
 * {@link WarningCode#CONSTANT_SERIES}, mai una divisione per zero.
 */
@Service
public class SeriesNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(SeriesNormalizer.class);

    public NormalizedSeries normalize(CleanedSeries series, NormalizationMethod method) {
        double[] values = series.values();
        DescriptiveStatistics stats = new DescriptiveStatistics(values);
        double min = stats.getMin();
        double max = stats.getMax();
        double mean = stats.getMean();
        // Varianza di popolazione
        double std = Math.sqrt(stats.getPopulationVariance());
        boolean constant = max == min || std == 0.0;

        NormalizationParameters params = new NormalizationParameters(method, min, max, mean, std, constant);

        List<PipelineWarning> warnings = new ArrayList<>();
        if (constant && method != NormalizationMethod.NONE) {
            warnings.add(PipelineWarning.of(WarningCode.CONSTANT_SERIES,
                    "Serie costante (valore %s): normalizzazione a zero", min));
            logger.warn("Serie costante di {} punti, normalizzata a zero", values.length);
        }

        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = params.normalize(values[i]);
        }
        return new NormalizedSeries(series.timestamps(), out, params, warnings);
    }
}
