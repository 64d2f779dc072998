package it.floro.analytics.model;

import it.floro.analytics.domain.FeatureMatrix;
import it.floro.analytics.domain.ModelVariant;
import it.floro.analytics.exception.ModelFitException;

import java.util.Map;

/**
 * Contratto uniforme delle varianti di regressione.
 *
 * Le istanze sono configurate ma senza stato di addestramento: ogni {@link #fit}
 * restituisce un nuovo {@link FittedModel}, quindi la stessa istanza può essere
 * usata da più fold in parallelo.
 */
public interface RegressionModel {

    ModelVariant variant();

    /**
     * @throws ModelFitException con meno di due righe o target a varianza nulla
     */
    FittedModel fit(FeatureMatrix features, double[] target);

    double[] predict(FittedModel fitted, FeatureMatrix features);

    /**
     * @return Importanza normalizzata (somma 1, oppure tutti zero) per nome di feature
     */
    Map<String, Double> importance(FittedModel fitted);
}
