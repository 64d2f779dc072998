package it.floro.analytics.model;

import it.floro.analytics.domain.ModelSpec;
import it.floro.analytics.domain.PipelineWarning;
import it.floro.analytics.domain.WarningCode;
import it.floro.analytics.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Fabbrica delle varianti di modello a partire da una {@link ModelSpec}.
 *
 * L'insieme delle varianti è chiuso: lo switch è esaustivo sull'enum, quindi una nuova
 * variante non compila finché non viene registrata qui.
 */
@Component
public class ModelRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ModelRegistry.class);

    /**
     * @throws ConfigurationException se un iperparametro ha un valore non valido
     */
    public RegressionModel create(ModelSpec spec) {
        return build(spec).model();
    }

    /**
     * Verifica la specifica senza addestrare nulla.
     *
     * @return Avvisi per le chiavi di iperparametri non riconosciute dalla variante
     * @throws ConfigurationException se un iperparametro ha un valore non valido
     */
    public List<PipelineWarning> validate(ModelSpec spec) {
        Built built = build(spec);
        List<PipelineWarning> warnings = new ArrayList<>();
        for (String key : built.unknownKeys()) {
            logger.warn("Iperparametro '{}' ignorato per {}", key, spec.variant().code());
            warnings.add(PipelineWarning.of(WarningCode.UNKNOWN_PARAMETER,
                    "Iperparametro '%s' non riconosciuto per %s", key, spec.variant().code()));
        }
        return warnings;
    }

    private Built build(ModelSpec spec) {
        Hyperparameters hp = new Hyperparameters(spec.variant().code(), spec.hyperparameters());
        RegressionModel model = switch (spec.variant()) {
            case RANDOM_FOREST -> new RandomForestRegressor(hp);
            case GRADIENT_BOOSTING -> new GradientBoostingRegressor(hp);
            case SUPPORT_VECTOR -> new SupportVectorRegressor(hp);
        };
        return new Built(model, hp.unknownKeys());
    }

    private record Built(RegressionModel model, List<String> unknownKeys) {
    }
}
