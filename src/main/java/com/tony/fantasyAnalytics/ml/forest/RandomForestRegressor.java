package com.tony.fantasyAnalytics.ml.forest;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.tony.fantasyAnalytics.ml.FitSummary;
import com.tony.fantasyAnalytics.ml.RegressionMetrics;
import com.tony.fantasyAnalytics.ml.RegressionModel;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

import java.util.ArrayList;
import java.util.List;

/**
 * Forêt aléatoire de régression : bagging d'arbres CART, prédiction = moyenne des arbres.
 * Importance des features = réduction d'impureté normalisée par arbre puis moyennée.
 */
@Slf4j
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public class RandomForestRegressor implements RegressionModel {

    public static final String MODEL_TYPE = "RandomForestRegressor";

    private int numTrees;
    private int maxDepth;
    private int minSamplesSplit;
    private int minSamplesLeaf;
    private long seed;

    private int featureCount;
    private List<RegressionTree> trees = new ArrayList<>();
    private double[] featureImportances = new double[0];

    // Jackson
    RandomForestRegressor() {
    }

    public RandomForestRegressor(int numTrees, int maxDepth, int minSamplesSplit, int minSamplesLeaf, long seed) {
        if (numTrees < 1 || maxDepth < 1 || minSamplesSplit < 2 || minSamplesLeaf < 1) {
            throw new IllegalArgumentException("Hyperparamètres invalides pour la forêt");
        }
        this.numTrees = numTrees;
        this.maxDepth = maxDepth;
        this.minSamplesSplit = minSamplesSplit;
        this.minSamplesLeaf = minSamplesLeaf;
        this.seed = seed;
    }

    @Override
    public FitSummary fit(double[][] x, double[] y) {
        if (x.length == 0 || x.length != y.length) {
            throw new IllegalArgumentException("Jeu d'entraînement vide ou incohérent (" + x.length + " / " + y.length + ")");
        }
        this.featureCount = x[0].length;
        RandomGenerator rng = new Well19937c(seed);

        List<RegressionTree> fitted = new ArrayList<>(numTrees);
        double[] importances = new double[featureCount];
        for (int t = 0; t < numTrees; t++) {
            int[] sample = RegressionTree.bootstrap(x.length, rng);
            RegressionTree tree = RegressionTree.fit(x, y, sample, maxDepth, minSamplesSplit, minSamplesLeaf);
            fitted.add(tree);

            double[] decrease = tree.impurityDecrease();
            double total = 0;
            for (double d : decrease) total += d;
            if (total > 0) {
                for (int f = 0; f < featureCount; f++) importances[f] += decrease[f] / total;
            }
        }
        this.trees = fitted;
        this.featureImportances = normalize(importances);

        double trainingMse = RegressionMetrics.mse(y, predict(x));
        log.debug("🌲 Forêt entraînée : {} arbres, {} échantillons, MSE train {}", numTrees, x.length, trainingMse);
        return new FitSummary(x.length, featureCount, trainingMse, featureImportances.clone());
    }

    @Override
    public double predict(double[] x) {
        if (trees.isEmpty()) throw new IllegalStateException("Modèle non entraîné");
        if (x.length != featureCount) {
            throw new IllegalArgumentException("Attendu " + featureCount + " features, reçu " + x.length);
        }
        double sum = 0;
        for (RegressionTree tree : trees) {
            sum += tree.predict(x);
        }
        return sum / trees.size();
    }

    @Override
    public double[] featureImportances() {
        return featureImportances.clone();
    }

    @Override
    public int featureCount() {
        return featureCount;
    }

    @Override
    public String modelType() {
        return MODEL_TYPE;
    }

    public int numTrees() {
        return numTrees;
    }

    private static double[] normalize(double[] values) {
        double total = 0;
        for (double v : values) total += v;
        double[] out = new double[values.length];
        if (total <= 0) return out;
        for (int i = 0; i < values.length; i++) out[i] = values[i] / total;
        return out;
    }
}
