package it.floro.analytics.domain;

import java.time.Duration;
import java.util.List;

/**
 * Parametri della cross-validation.
 */
public record EvaluationSettings(
        List<ModelSpec> models,     // Varianti da valutare, nell'ordine richiesto
        int folds,                  // Numero di fold (>= 2)
        SplitMode splitMode,
        int horizon,                // Passi avanti del target (>= 1)
        Duration timeout            // Budget complessivo di fold e ristima finale
) {

    public EvaluationSettings {
        models = List.copyOf(models);
        if (folds < 2) {
            throw new IllegalArgumentException("Servono almeno 2 fold");
        }
        if (horizon < 1) {
            throw new IllegalArgumentException("L'orizzonte deve essere >= 1");
        }
    }
}
