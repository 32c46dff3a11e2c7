package com.tony.fantasyAnalytics.ml.forest;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import org.apache.commons.math3.random.RandomGenerator;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Arbre de régression CART (critère : réduction de la somme des carrés des écarts).
 * Toutes les features sont candidates à chaque split.
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public class RegressionTree {

    private static final double MIN_GAIN = 1e-12;

    private List<TreeNode> nodes = new ArrayList<>();

    // Réduction d'impureté cumulée par feature, pendant le fit uniquement
    private transient double[] impurityDecrease;

    RegressionTree() {
    }

    static RegressionTree fit(double[][] x, double[] y, int[] sampleIdx, int maxDepth,
                              int minSamplesSplit, int minSamplesLeaf) {
        RegressionTree tree = new RegressionTree();
        tree.impurityDecrease = new double[x[0].length];
        tree.grow(x, y, sampleIdx, 0, maxDepth, minSamplesSplit, minSamplesLeaf);
        return tree;
    }

    /**
     * Échantillon bootstrap (tirage avec remise) de taille n.
     */
    static int[] bootstrap(int n, RandomGenerator rng) {
        int[] idx = new int[n];
        for (int i = 0; i < n; i++) {
            idx[i] = rng.nextInt(n);
        }
        return idx;
    }

    double predict(double[] x) {
        int i = 0;
        TreeNode node = nodes.get(0);
        while (!node.isLeaf()) {
            i = x[node.getFeature()] <= node.getThreshold() ? node.getLeft() : node.getRight();
            node = nodes.get(i);
        }
        return node.getValue();
    }

    double[] impurityDecrease() {
        return impurityDecrease;
    }

    private int grow(double[][] x, double[] y, int[] idx, int depth, int maxDepth,
                     int minSamplesSplit, int minSamplesLeaf) {
        int n = idx.length;
        double sum = 0;
        double sumSq = 0;
        for (int i : idx) {
            sum += y[i];
            sumSq += y[i] * y[i];
        }
        double mean = sum / n;
        double parentSse = sumSq - sum * sum / n;

        int nodeId = nodes.size();
        nodes.add(TreeNode.leaf(mean));

        if (depth >= maxDepth || n < minSamplesSplit || n < 2 * minSamplesLeaf || parentSse <= MIN_GAIN) {
            return nodeId;
        }

        Split best = findBestSplit(x, y, idx, parentSse, minSamplesLeaf);
        if (best == null) return nodeId;

        impurityDecrease[best.feature] += parentSse - best.childSse;

        int[] leftIdx = Arrays.stream(idx).filter(i -> x[i][best.feature] <= best.threshold).toArray();
        int[] rightIdx = Arrays.stream(idx).filter(i -> x[i][best.feature] > best.threshold).toArray();

        int left = grow(x, y, leftIdx, depth + 1, maxDepth, minSamplesSplit, minSamplesLeaf);
        int right = grow(x, y, rightIdx, depth + 1, maxDepth, minSamplesSplit, minSamplesLeaf);
        nodes.set(nodeId, new TreeNode(best.feature, best.threshold, left, right, mean));
        return nodeId;
    }

    private Split findBestSplit(double[][] x, double[] y, int[] idx, double parentSse, int minSamplesLeaf) {
        int n = idx.length;
        int featureCount = x[0].length;
        Split best = null;

        for (int f = 0; f < featureCount; f++) {
            final int feature = f;
            Integer[] sorted = Arrays.stream(idx).boxed().toArray(Integer[]::new);
            Arrays.sort(sorted, Comparator.comparingDouble(i -> x[i][feature]));

            double totalSum = 0;
            double totalSq = 0;
            for (int i : sorted) {
                totalSum += y[i];
                totalSq += y[i] * y[i];
            }

            double leftSum = 0;
            double leftSq = 0;
            for (int k = 1; k < n; k++) {
                int prev = sorted[k - 1];
                leftSum += y[prev];
                leftSq += y[prev] * y[prev];

                if (k < minSamplesLeaf || n - k < minSamplesLeaf) continue;
                double a = x[prev][feature];
                double b = x[sorted[k]][feature];
                if (a == b) continue;

                double rightSum = totalSum - leftSum;
                double rightSq = totalSq - leftSq;
                double childSse = (leftSq - leftSum * leftSum / k) + (rightSq - rightSum * rightSum / (n - k));

                if (parentSse - childSse > MIN_GAIN && (best == null || childSse < best.childSse)) {
                    best = new Split(feature, (a + b) / 2.0, childSse);
                }
            }
        }
        return best;
    }

    private record Split(int feature, double threshold, double childSse) {
    }
}
