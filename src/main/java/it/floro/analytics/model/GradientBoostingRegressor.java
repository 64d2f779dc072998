package it.floro.analytics.model;

import it.floro.analytics.domain.ModelVariant;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

/**
 * Gradient boosting con perdita quadratica: ogni albero approssima i residui correnti
 * e viene sommato con passo {@code learning_rate}.
 *
 * Iperparametri: n_estimators (100), learning_rate (0.1), max_depth (3),
 * subsample (1.0, frazione di righe senza reinserimento), seed (42).
 */
public class GradientBoostingRegressor extends AbstractRegressionModel {

    private final int nEstimators;
    private final double learningRate;
    private final int maxDepth;
    private final double subsample;
    private final long seed;

    public GradientBoostingRegressor(Hyperparameters hp) {
        this.nEstimators = hp.intValue("n_estimators", 100, 1);
        this.learningRate = hp.doubleValue("learning_rate", 0.1, 0.0, 1.0);
        this.maxDepth = hp.intValue("max_depth", 3, 1);
        this.subsample = hp.doubleValue("subsample", 1.0, 0.0, 1.0);
        this.seed = hp.longValue("seed", 42L);
    }

    @Override
    public ModelVariant variant() {
        return ModelVariant.GRADIENT_BOOSTING;
    }

    @Override
    protected FittedModel doFit(double[][] x, double[] y, List<String> featureNames) {
        int n = y.length;
        Random rnd = new Random(seed);
        double init = 0.0;
        for (double v : y) {
            init += v;
        }
        init /= n;

        double[] current = new double[n];
        Arrays.fill(current, init);
        double[] residual = new double[n];
        double[] importance = new double[featureNames.size()];
        List<RegressionTree> trees = new ArrayList<>(nEstimators);
        int sampleSize = Math.max(2, (int) Math.round(subsample * n));

        for (int m = 0; m < nEstimators; m++) {
            for (int i = 0; i < n; i++) {
                residual[i] = y[i] - current[i];
            }
            int[] rows = sampleRows(n, sampleSize, rnd);
            RegressionTree tree = RegressionTree.grow(x, residual, rows, maxDepth, 1, 1.0, rnd);
            trees.add(tree);
            for (int i = 0; i < n; i++) {
                current[i] += learningRate * tree.predict(x[i]);
            }
            double[] imp = tree.importance();
            for (int j = 0; j < imp.length; j++) {
                importance[j] += imp[j];
            }
        }
        return new Fitted(featureNames, init, learningRate, trees, importance);
    }

    private static int[] sampleRows(int n, int size, Random rnd) {
        int[] all = new int[n];
        for (int i = 0; i < n; i++) {
            all[i] = i;
        }
        if (size >= n) {
            return all;
        }
        for (int i = 0; i < size; i++) {
            int j = i + rnd.nextInt(n - i);
            int tmp = all[i];
            all[i] = all[j];
            all[j] = tmp;
        }
        return Arrays.copyOf(all, size);
    }

    private record Fitted(List<String> featureNames, double init, double learningRate,
                          List<RegressionTree> trees, double[] importance) implements FittedModel {

        @Override
        public double predict(double[] row) {
            double out = init;
            for (RegressionTree t : trees) {
                out += learningRate * t.predict(row);
            }
            return out;
        }

        @Override
        public double[] rawImportance() {
            return importance.clone();
        }
    }
}
