package it.floro.analytics.model;

import it.floro.analytics.domain.FeatureMatrix;
import it.floro.analytics.exception.ModelFitException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Base comune: controlli sui dati di addestramento, predizione riga per riga,
 * normalizzazione dell'importanza.
 */
public abstract class AbstractRegressionModel implements RegressionModel {

    @Override
    public final FittedModel fit(FeatureMatrix features, double[] target) {
        if (features.rowCount() != target.length) {
            throw new IllegalArgumentException("Righe delle feature e target di lunghezza diversa");
        }
        if (target.length < 2) {
            throw new ModelFitException(String.format(
                    "%s: servono almeno 2 righe di training, ricevute %d", variant().code(), target.length));
        }
        if (isConstant(target)) {
            throw new ModelFitException(variant().code() + ": target di training a varianza nulla");
        }
        if (features.columnCount() == 0) {
            throw new ModelFitException(variant().code() + ": nessuna feature disponibile");
        }
        return doFit(features.toRows(), target.clone(), features.featureNames());
    }

    protected abstract FittedModel doFit(double[][] x, double[] y, List<String> featureNames);

    @Override
    public double[] predict(FittedModel fitted, FeatureMatrix features) {
        if (!fitted.featureNames().equals(features.featureNames())) {
            throw new IllegalArgumentException("Feature diverse da quelle di addestramento: "
                    + features.featureNames());
        }
        double[] out = new double[features.rowCount()];
        for (int i = 0; i < out.length; i++) {
            out[i] = fitted.predict(features.row(i));
        }
        return out;
    }

    @Override
    public Map<String, Double> importance(FittedModel fitted) {
        double[] raw = fitted.rawImportance();
        List<String> names = fitted.featureNames();
        double total = 0.0;
        for (double v : raw) {
            total += Math.max(0.0, v);
        }
        Map<String, Double> out = new LinkedHashMap<>();
        for (int j = 0; j < names.size(); j++) {
            out.put(names.get(j), total > 0.0 ? Math.max(0.0, raw[j]) / total : 0.0);
        }
        return out;
    }

    /**
     * Interrompe un addestramento il cui fold è stato cancellato per scadenza del budget.
     */
    protected static void checkInterrupted() {
        if (Thread.currentThread().isInterrupted()) {
            throw new ModelFitException("Addestramento interrotto");
        }
    }

    private static boolean isConstant(double[] v) {
        for (int i = 1; i < v.length; i++) {
            if (v[i] != v[0]) {
                return false;
            }
        }
        return true;
    }
}
