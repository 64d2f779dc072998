package it.floro.analytics.model;

import it.floro.analytics.domain.ModelVariant;

import java.util.List;
import java.util.Random;

/**
 * Foresta casuale: media di alberi CART addestrati su campioni bootstrap.
 *
 * Iperparametri: n_estimators (100), max_depth (8), min_samples_leaf (1),
 * max_features (1.0, frazione di feature per split), seed (42).
 */
public class RandomForestRegressor extends AbstractRegressionModel {

    private final int nEstimators;
    private final int maxDepth;
    private final int minSamplesLeaf;
    private final double maxFeatures;
    private final long seed;

    public RandomForestRegressor(Hyperparameters hp) {
        this.nEstimators = hp.intValue("n_estimators", 100, 1);
        this.maxDepth = hp.intValue("max_depth", 8, 1);
        this.minSamplesLeaf = hp.intValue("min_samples_leaf", 1, 1);
        this.maxFeatures = hp.doubleValue("max_features", 1.0, 0.0, 1.0);
        this.seed = hp.longValue("seed", 42L);
    }

    @Override
    public ModelVariant variant() {
        return ModelVariant.RANDOM_FOREST;
    }

    @Override
    protected FittedModel doFit(double[][] x, double[] y, List<String> featureNames) {
        Random rnd = new Random(seed);
        int n = y.length;
        RegressionTree[] trees = new RegressionTree[nEstimators];
        double[] importance = new double[featureNames.size()];
        for (int t = 0; t < nEstimators; t++) {
            int[] sample = new int[n];
            for (int i = 0; i < n; i++) {
                sample[i] = rnd.nextInt(n);
            }
            trees[t] = RegressionTree.grow(x, y, sample, maxDepth, minSamplesLeaf, maxFeatures, rnd);
            double[] imp = trees[t].importance();
            for (int j = 0; j < imp.length; j++) {
                importance[j] += imp[j];
            }
        }
        return new Fitted(featureNames, trees, importance);
    }

    private record Fitted(List<String> featureNames, RegressionTree[] trees, double[] importance)
            implements FittedModel {

        @Override
        public double predict(double[] row) {
            double sum = 0.0;
            for (RegressionTree t : trees) {
                sum += t.predict(row);
            }
            return sum / trees.length;
        }

        @Override
        public double[] rawImportance() {
            return importance.clone();
        }
    }
}
