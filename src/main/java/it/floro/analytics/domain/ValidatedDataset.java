package it.floro.analytics.domain;

import java.util.List;

/**
 * Vista ordinata e verificata di un {@link Dataset}: timestamp strettamente crescenti,
 * metadati scalari, numero minimo di punti rispettato.
 */
public record ValidatedDataset(
        Dataset dataset,
        List<DataPoint> points,             // Copia immutabile ordinata per timestamp
        ValidationRequirements requirements
) {

    public ValidatedDataset {
        points = List.copyOf(points);
    }

    public int size() {
        return points.size();
    }

    public int missingCount() {
        return (int) points.stream().filter(DataPoint::isMissing).count();
    }
}
