package it.floro.analytics.domain;

/**
 * Media e deviazione standard (di popolazione) di una metrica sui fold riusciti.
 */
public record MetricSummary(
        double mean,
        double std
) {
}
