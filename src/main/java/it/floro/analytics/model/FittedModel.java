package it.floro.analytics.model;

import java.util.List;

/**
 * Modello addestrato: predice una riga di feature nell'ordine di {@link #featureNames()}.
 */
public interface FittedModel {

    List<String> featureNames();

    double predict(double[] row);

    /**
     * @return Importanza grezza per feature, stesso ordine di {@link #featureNames()}
     */
    double[] rawImportance();
}
