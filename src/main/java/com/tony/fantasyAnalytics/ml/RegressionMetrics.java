package com.tony.fantasyAnalytics.ml;

import org.apache.commons.math3.stat.StatUtils;

public final class RegressionMetrics {

    private RegressionMetrics() {
    }

    public static double mse(double[] actual, double[] predicted) {
        checkSameLength(actual, predicted);
        if (actual.length == 0) return 0.0;
        double sum = 0;
        for (int i = 0; i < actual.length; i++) {
            double d = actual[i] - predicted[i];
            sum += d * d;
        }
        return sum / actual.length;
    }

    /**
     * R² = 1 - SSres / SStot. Variance nulle des labels : 1.0 si prédiction parfaite, 0.0 sinon
     * (jamais NaN ni infini).
     */
    public static double r2(double[] actual, double[] predicted) {
        checkSameLength(actual, predicted);
        if (actual.length == 0) return 0.0;
        double mean = StatUtils.mean(actual);
        double ssRes = 0;
        double ssTot = 0;
        for (int i = 0; i < actual.length; i++) {
            ssRes += Math.pow(actual[i] - predicted[i], 2);
            ssTot += Math.pow(actual[i] - mean, 2);
        }
        if (ssTot == 0.0) return ssRes == 0.0 ? 1.0 : 0.0;
        return 1.0 - ssRes / ssTot;
    }

    private static void checkSameLength(double[] a, double[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Tailles différentes : " + a.length + " vs " + b.length);
        }
    }
}
