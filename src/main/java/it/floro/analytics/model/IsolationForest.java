package it.floro.analytics.model;

import java.util.Random;

/**
 * Isolation forest: alberi costruiti con split casuali su sottocampioni senza
 * reinserimento. Un punto anomalo viene isolato con pochi split, quindi ha un cammino
 * medio più corto e un punteggio più alto.
 *
 * Punteggio s(x) = 2^(-E[h(x)] / c(ψ)) in (0, 1], dove ψ è la dimensione del sottocampione
 * e c(ψ) il cammino medio di una ricerca fallita in un albero binario di ψ elementi.
 */
public final class IsolationForest {

    public static final int DEFAULT_TREES = 100;
    public static final int DEFAULT_MAX_SAMPLES = 256;

    private static final double EULER_GAMMA = 0.5772156649015329;

    private static final class Node {
        int feature = -1;       // -1 = foglia
        double threshold;
        int size;               // Righe arrivate nella foglia
        Node left;
        Node right;
    }

    private final Node[] trees;
    private final int sampleSize;

    private IsolationForest(Node[] trees, int sampleSize) {
        this.trees = trees;
        this.sampleSize = sampleSize;
    }

    /**
     * @param x Righe di osservazioni (almeno una)
     * @param nTrees Numero di alberi (>= 1)
     * @param maxSamples Dimensione massima del sottocampione di ogni albero
     * @param seed Seed del generatore (stesso seed = stessa foresta)
     */
    public static IsolationForest fit(double[][] x, int nTrees, int maxSamples, long seed) {
        if (x.length == 0 || nTrees < 1 || maxSamples < 1) {
            throw new IllegalArgumentException("Isolation forest: dati vuoti o parametri non validi");
        }
        Random rnd = new Random(seed);
        int psi = Math.min(maxSamples, x.length);
        int heightLimit = (int) Math.ceil(Math.log(Math.max(2, psi)) / Math.log(2));
        Node[] trees = new Node[nTrees];
        for (int t = 0; t < nTrees; t++) {
            trees[t] = grow(x, sample(x.length, psi, rnd), 0, heightLimit, rnd);
        }
        return new IsolationForest(trees, psi);
    }

    /**
     * @return Punteggio di anomalia in (0, 1]; 0.5 se il sottocampione ha un solo punto
     */
    public double score(double[] row) {
        double c = averagePath(sampleSize);
        if (c == 0.0) {
            return 0.5;
        }
        double sum = 0.0;
        for (Node tree : trees) {
            sum += pathLength(row, tree, 0);
        }
        return Math.pow(2.0, -(sum / trees.length) / c);
    }

    // ========================================================================
    // COSTRUZIONE
    // ========================================================================

    private static Node grow(double[][] x, int[] rows, int depth, int heightLimit, Random rnd) {
        Node node = new Node();
        node.size = rows.length;
        if (depth >= heightLimit || rows.length <= 1) {
            return node;
        }

        // Solo le feature non costanti sulle righe del nodo possono separarle
        int nFeatures = x[0].length;
        int[] candidates = new int[nFeatures];
        double[] lo = new double[nFeatures];
        double[] hi = new double[nFeatures];
        int nCandidates = 0;
        for (int f = 0; f < nFeatures; f++) {
            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            for (int r : rows) {
                min = Math.min(min, x[r][f]);
                max = Math.max(max, x[r][f]);
            }
            if (max > min) {
                candidates[nCandidates] = f;
                lo[nCandidates] = min;
                hi[nCandidates] = max;
                nCandidates++;
            }
        }
        if (nCandidates == 0) {
            return node;
        }

        int pick = rnd.nextInt(nCandidates);
        int feature = candidates[pick];
        double threshold = lo[pick] + rnd.nextDouble() * (hi[pick] - lo[pick]);

        int leftCount = 0;
        for (int r : rows) {
            if (x[r][feature] < threshold) {
                leftCount++;
            }
        }
        int[] left = new int[leftCount];
        int[] right = new int[rows.length - leftCount];
        int l = 0;
        int rr = 0;
        for (int r : rows) {
            if (x[r][feature] < threshold) {
                left[l++] = r;
            } else {
                right[rr++] = r;
            }
        }
        node.feature = feature;
        node.threshold = threshold;
        node.left = grow(x, left, depth + 1, heightLimit, rnd);
        node.right = grow(x, right, depth + 1, heightLimit, rnd);
        return node;
    }

    private static int[] sample(int n, int k, Random rnd) {
        int[] idx = new int[n];
        for (int i = 0; i < n; i++) {
            idx[i] = i;
        }
        // Fisher-Yates parziale
        for (int i = 0; i < k; i++) {
            int j = i + rnd.nextInt(n - i);
            int tmp = idx[i];
            idx[i] = idx[j];
            idx[j] = tmp;
        }
        int[] out = new int[k];
        System.arraycopy(idx, 0, out, 0, k);
        return out;
    }

    // ========================================================================
    // PUNTEGGIO
    // ========================================================================

    private static double pathLength(double[] row, Node node, int depth) {
        Node n = node;
        int d = depth;
        while (n.feature >= 0) {
            n = row[n.feature] < n.threshold ? n.left : n.right;
            d++;
        }
        return d + averagePath(n.size);
    }

    static double averagePath(int n) {
        if (n <= 1) {
            return 0.0;
        }
        if (n == 2) {
            return 1.0;
        }
        double harmonic = Math.log(n - 1.0) + EULER_GAMMA;
        return 2.0 * harmonic - 2.0 * (n - 1.0) / n;
    }
}
