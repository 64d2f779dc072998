package it.floro.analytics.domain;

import java.time.Instant;
import java.util.List;

public record NormalizedSeries(
        List<Instant> timestamps,
        double[] values,
        NormalizationParameters parameters,
        List<PipelineWarning> warnings      // CONSTANT_SERIES se la serie è costante
) {

    public NormalizedSeries {
        timestamps = List.copyOf(timestamps);
        values = values.clone();
        warnings = List.copyOf(warnings);
    }

    @Override
    public double[] values() {
        return values.clone();
    }

    public int size() {
        return values.length;
    }

    public double denormalize(double normalized) {
        return parameters.denormalize(normalized);
    }

    public double[] denormalize(double[] normalized) {
        double[] out = new double[normalized.length];
        for (int i = 0; i < normalized.length; i++) {
            out[i] = parameters.denormalize(normalized[i]);
        }
        return out;
    }
}
