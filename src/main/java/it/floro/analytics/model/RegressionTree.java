package it.floro.analytics.model;

import java.util.Arrays;
import java.util.Random;

/**
 * Albero di regressione CART: split binari che massimizzano la riduzione della somma
 * dei quadrati dei residui. Base comune di foresta casuale e gradient boosting.
 *
 * L'importanza di una feature è la riduzione totale di SSE ottenuta dai suoi split.
 */
final class RegressionTree {

    private static final class Node {
        int feature = -1;       // -1 = foglia
        double threshold;
        double value;           // Media del target nella foglia
        Node left;
        Node right;
    }

    private final Node root;
    private final double[] importance;

    private RegressionTree(Node root, double[] importance) {
        this.root = root;
        this.importance = importance;
    }

    /**
     * Addestra un albero sulle righe indicate (che possono ripetersi, per il bootstrap).
     *
     * @param maxFeatures Frazione (0, 1] di feature candidate a ogni split
     */
    static RegressionTree grow(double[][] x, double[] y, int[] rows, int maxDepth, int minSamplesLeaf,
                               double maxFeatures, Random rnd) {
        int nFeatures = x[0].length;
        double[] importance = new double[nFeatures];
        Builder b = new Builder(x, y, maxDepth, minSamplesLeaf,
                Math.max(1, (int) Math.round(maxFeatures * nFeatures)), rnd, importance);
        Node root = b.build(rows, 0);
        return new RegressionTree(root, importance);
    }

    double predict(double[] row) {
        Node n = root;
        while (n.feature >= 0) {
            n = row[n.feature] <= n.threshold ? n.left : n.right;
        }
        return n.value;
    }

    double[] importance() {
        return importance.clone();
    }

    // ========================================================================
    // COSTRUZIONE
    // ========================================================================

    private static final class Builder {
        private final double[][] x;
        private final double[] y;
        private final int maxDepth;
        private final int minSamplesLeaf;
        private final int featuresPerSplit;
        private final Random rnd;
        private final double[] importance;

        Builder(double[][] x, double[] y, int maxDepth, int minSamplesLeaf, int featuresPerSplit,
                Random rnd, double[] importance) {
            this.x = x;
            this.y = y;
            this.maxDepth = maxDepth;
            this.minSamplesLeaf = minSamplesLeaf;
            this.featuresPerSplit = featuresPerSplit;
            this.rnd = rnd;
            this.importance = importance;
        }

        Node build(int[] rows, int depth) {
            AbstractRegressionModel.checkInterrupted();
            Node node = new Node();
            double sum = 0.0;
            double sumSq = 0.0;
            for (int r : rows) {
                sum += y[r];
                sumSq += y[r] * y[r];
            }
            int n = rows.length;
            node.value = sum / n;
            double sse = sumSq - sum * sum / n;

            if (depth >= maxDepth || n < 2 * minSamplesLeaf || sse <= 1e-12) {
                return node;
            }

            int bestFeature = -1;
            double bestThreshold = 0.0;
            double bestGain = 0.0;

            Integer[] order = new Integer[n];
            for (int f : candidateFeatures()) {
                for (int i = 0; i < n; i++) {
                    order[i] = rows[i];
                }
                final int feat = f;
                Arrays.sort(order, (a, c) -> Double.compare(x[a][feat], x[c][feat]));

                double leftSum = 0.0;
                double leftSq = 0.0;
                for (int i = 0; i < n - 1; i++) {
                    double v = y[order[i]];
                    leftSum += v;
                    leftSq += v * v;
                    int nl = i + 1;
                    int nr = n - nl;
                    if (nl < minSamplesLeaf || nr < minSamplesLeaf) {
                        continue;
                    }
                    double cur = x[order[i]][feat];
                    double next = x[order[i + 1]][feat];
                    if (cur == next) {
                        continue;
                    }
                    double rightSum = sum - leftSum;
                    double rightSq = sumSq - leftSq;
                    double childSse = (leftSq - leftSum * leftSum / nl) + (rightSq - rightSum * rightSum / nr);
                    double gain = sse - childSse;
                    if (gain > bestGain + 1e-12) {
                        bestGain = gain;
                        bestFeature = feat;
                        bestThreshold = (cur + next) / 2.0;
                    }
                }
            }

            if (bestFeature < 0) {
                return node;
            }

            int nl = 0;
            for (int r : rows) {
                if (x[r][bestFeature] <= bestThreshold) {
                    nl++;
                }
            }
            int[] left = new int[nl];
            int[] right = new int[n - nl];
            int li = 0;
            int ri = 0;
            for (int r : rows) {
                if (x[r][bestFeature] <= bestThreshold) {
                    left[li++] = r;
                } else {
                    right[ri++] = r;
                }
            }

            importance[bestFeature] += bestGain;
            node.feature = bestFeature;
            node.threshold = bestThreshold;
            node.left = build(left, depth + 1);
            node.right = build(right, depth + 1);
            return node;
        }

        /**
         * Sottoinsieme casuale di feature (tutte se la frazione è 1), in ordine crescente.
         */
        private int[] candidateFeatures() {
            int total = x[0].length;
            int[] all = new int[total];
            for (int i = 0; i < total; i++) {
                all[i] = i;
            }
            if (featuresPerSplit >= total) {
                return all;
            }
            for (int i = 0; i < featuresPerSplit; i++) {
                int j = i + rnd.nextInt(total - i);
                int tmp = all[i];
                all[i] = all[j];
                all[j] = tmp;
            }
            int[] out = Arrays.copyOf(all, featuresPerSplit);
            Arrays.sort(out);
            return out;
        }
    }
}
