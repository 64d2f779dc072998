package it.floro.analytics.model;

import it.floro.analytics.domain.ModelVariant;

import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * Regressione epsilon-insensitive con kernel RBF, addestrata per discesa coordinata
 * sul problema duale.
 *
 * Le feature vengono standardizzate con media e deviazione del training. Il termine
 * noto è assorbito nel kernel (K + 1), quindi il duale ha solo i vincoli di box
 * {@code -c <= beta_i <= c}. L'importanza è per permutazione sul training.
 *
 * Iperparametri: c (1.0), epsilon (0.1), gamma ("scale", "auto" o numero),
 * max_iter (1000), tol (1e-4), seed (42, usato dalla permutazione).
 */
public class SupportVectorRegressor extends AbstractRegressionModel {

    private final double c;
    private final double epsilon;
    private final Object gamma;
    private final int maxIter;
    private final double tol;
    private final long seed;

    public SupportVectorRegressor(Hyperparameters hp) {
        this.c = hp.doubleValue("c", 1.0, 0.0, Double.MAX_VALUE);
        this.epsilon = hp.doubleValue("epsilon", 0.1, -Double.MIN_VALUE, Double.MAX_VALUE);
        this.gamma = hp.numberOrKeyword("gamma", "scale", Set.of("scale", "auto"));
        this.maxIter = hp.intValue("max_iter", 1000, 1);
        this.tol = hp.doubleValue("tol", 1e-4, 0.0, Double.MAX_VALUE);
        this.seed = hp.longValue("seed", 42L);
    }

    @Override
    public ModelVariant variant() {
        return ModelVariant.SUPPORT_VECTOR;
    }

    @Override
    protected FittedModel doFit(double[][] x, double[] y, List<String> featureNames) {
        int n = y.length;
        int d = featureNames.size();

        // ===== STANDARDIZZAZIONE =====
        double[] mean = new double[d];
        double[] scale = new double[d];
        for (int j = 0; j < d; j++) {
            double s = 0.0;
            for (double[] row : x) {
                s += row[j];
            }
            mean[j] = s / n;
            double sq = 0.0;
            for (double[] row : x) {
                double dv = row[j] - mean[j];
                sq += dv * dv;
            }
            double std = Math.sqrt(sq / n);
            scale[j] = std > 0.0 ? std : 1.0;
        }
        double[][] z = new double[n][];
        for (int i = 0; i < n; i++) {
            z[i] = standardize(x[i], mean, scale);
        }

        double g = resolveGamma(z, d);

        // ===== KERNEL =====
        double[][] k = new double[n][n];
        for (int i = 0; i < n; i++) {
            k[i][i] = 2.0;
            for (int j = i + 1; j < n; j++) {
                double v = kernel(z[i], z[j], g);
                k[i][j] = v;
                k[j][i] = v;
            }
        }

        // ===== DISCESA COORDINATA SUL DUALE =====
        double[] beta = new double[n];
        double[] f = new double[n];        // f = K beta
        for (int iter = 0; iter < maxIter; iter++) {
            checkInterrupted();
            double maxDelta = 0.0;
            for (int i = 0; i < n; i++) {
                double kii = k[i][i];
                double grad = f[i] - y[i];
                double candidate = softThreshold(beta[i] - grad / kii, epsilon / kii);
                double updated = Math.max(-c, Math.min(c, candidate));
                double delta = updated - beta[i];
                if (delta != 0.0) {
                    double[] ki = k[i];
                    for (int j = 0; j < n; j++) {
                        f[j] += delta * ki[j];
                    }
                    beta[i] = updated;
                    maxDelta = Math.max(maxDelta, Math.abs(delta));
                }
            }
            if (maxDelta < tol) {
                break;
            }
        }

        int support = 0;
        for (double b : beta) {
            if (b != 0.0) {
                support++;
            }
        }
        double[][] sv = new double[support][];
        double[] coef = new double[support];
        int s = 0;
        for (int i = 0; i < n; i++) {
            if (beta[i] != 0.0) {
                sv[s] = z[i];
                coef[s] = beta[i];
                s++;
            }
        }

        Fitted fitted = new Fitted(featureNames, mean, scale, g, sv, coef, new double[d]);
        double[] importance = permutationImportance(fitted, x, y);
        return new Fitted(featureNames, mean, scale, g, sv, coef, importance);
    }

    private double resolveGamma(double[][] z, int d) {
        if (gamma instanceof Double value) {
            return value;
        }
        if ("auto".equals(gamma)) {
            return 1.0 / d;
        }
        // "scale": 1 / (n_features * varianza di tutti i valori standardizzati)
        double sum = 0.0;
        double sumSq = 0.0;
        long count = 0;
        for (double[] row : z) {
            for (double v : row) {
                sum += v;
                sumSq += v * v;
                count++;
            }
        }
        double m = sum / count;
        double var = sumSq / count - m * m;
        return var > 0.0 ? 1.0 / (d * var) : 1.0;
    }

    private double[] permutationImportance(Fitted fitted, double[][] x, double[] y) {
        int n = y.length;
        int d = fitted.featureNames().size();
        double baseline = mse(fitted, x, y);
        Random rnd = new Random(seed);
        double[] out = new double[d];
        double[][] permuted = new double[n][];
        for (int i = 0; i < n; i++) {
            permuted[i] = x[i].clone();
        }
        for (int j = 0; j < d; j++) {
            checkInterrupted();
            int[] perm = permutation(n, rnd);
            for (int i = 0; i < n; i++) {
                permuted[i][j] = x[perm[i]][j];
            }
            out[j] = Math.max(0.0, mse(fitted, permuted, y) - baseline);
            for (int i = 0; i < n; i++) {
                permuted[i][j] = x[i][j];
            }
        }
        return out;
    }

    private static double mse(Fitted fitted, double[][] x, double[] y) {
        double sq = 0.0;
        for (int i = 0; i < y.length; i++) {
            double e = y[i] - fitted.predict(x[i]);
            sq += e * e;
        }
        return sq / y.length;
    }

    private static int[] permutation(int n, Random rnd) {
        int[] p = new int[n];
        for (int i = 0; i < n; i++) {
            p[i] = i;
        }
        for (int i = n - 1; i > 0; i--) {
            int j = rnd.nextInt(i + 1);
            int tmp = p[i];
            p[i] = p[j];
            p[j] = tmp;
        }
        return p;
    }

    private static double softThreshold(double v, double t) {
        if (v > t) {
            return v - t;
        }
        if (v < -t) {
            return v + t;
        }
        return 0.0;
    }

    private static double kernel(double[] a, double[] b, double gamma) {
        double dist = 0.0;
        for (int j = 0; j < a.length; j++) {
            double dv = a[j] - b[j];
            dist += dv * dv;
        }
        return Math.exp(-gamma * dist) + 1.0;
    }

    private static double[] standardize(double[] row, double[] mean, double[] scale) {
        double[] out = new double[row.length];
        for (int j = 0; j < row.length; j++) {
            out[j] = (row[j] - mean[j]) / scale[j];
        }
        return out;
    }

    private record Fitted(List<String> featureNames, double[] mean, double[] scale, double gamma,
                          double[][] supportVectors, double[] coefficients, double[] importance)
            implements FittedModel {

        @Override
        public double predict(double[] row) {
            double[] z = standardize(row, mean, scale);
            double out = 0.0;
            for (int i = 0; i < supportVectors.length; i++) {
                out += coefficients[i] * kernel(supportVectors[i], z, gamma);
            }
            return out;
        }

        @Override
        public double[] rawImportance() {
            return importance.clone();
        }
    }
}
