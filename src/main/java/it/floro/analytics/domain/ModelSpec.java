package it.floro.analytics.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public record ModelSpec(
        ModelVariant variant,
        Map<String, Object> hyperparameters     // Chiavi snake_case, es. n_estimators
) {

    public ModelSpec {
        Objects.requireNonNull(variant, "variant");
        hyperparameters = (hyperparameters == null || hyperparameters.isEmpty())
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(hyperparameters));
    }

    public static ModelSpec of(ModelVariant variant) {
        return new ModelSpec(variant, Map.of());
    }
}
