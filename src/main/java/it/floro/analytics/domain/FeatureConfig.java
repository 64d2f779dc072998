package it.floro.analytics.domain;

import java.util.List;

/**
 * Configurazione della costruzione delle feature.
 */
public record FeatureConfig(
        List<Integer> windowSizes,          // Finestre delle statistiche mobili
        List<Integer> lags,                 // Ritardi dei lag
        double correlationThreshold,        // |r| oltre cui una colonna viene scartata
        LagEdgePolicy edgePolicy,
        boolean squaredFeatures,            // Aggiunge <feature>_squared per ogni colonna di base
        boolean interactionFeatures         // Aggiunge <a>_x_<b> per ogni coppia di colonne di base
) {

    public FeatureConfig {
        windowSizes = List.copyOf(windowSizes);
        lags = List.copyOf(lags);
        if (windowSizes.stream().anyMatch(w -> w < 1)) {
            throw new IllegalArgumentException("Le finestre devono essere >= 1");
        }
        if (lags.stream().anyMatch(l -> l < 1)) {
            throw new IllegalArgumentException("I lag devono essere >= 1");
        }
    }

    public FeatureConfig(List<Integer> windowSizes, List<Integer> lags, double correlationThreshold,
                         LagEdgePolicy edgePolicy) {
        this(windowSizes, lags, correlationThreshold, edgePolicy, false, false);
    }

    public static FeatureConfig defaults() {
        return new FeatureConfig(List.of(7), List.of(1, 2, 3), 0.95, LagEdgePolicy.DROP);
    }

    public int maxLag() {
        return lags.stream().mapToInt(Integer::intValue).max().orElse(0);
    }
}
