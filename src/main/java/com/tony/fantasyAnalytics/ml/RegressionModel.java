package com.tony.fantasyAnalytics.ml;

/**
 * Capacité minimale attendue d'un régresseur par le pipeline : l'implémentation (forêt aléatoire
 * aujourd'hui) est interchangeable sans toucher à l'entraînement ni à la prédiction.
 */
public interface RegressionModel {

    FitSummary fit(double[][] features, double[] labels);

    double predict(double[] features);

    default double[] predict(double[][] features) {
        double[] out = new double[features.length];
        for (int i = 0; i < features.length; i++) {
            out[i] = predict(features[i]);
        }
        return out;
    }

    /**
     * Importance par feature, dans l'ordre des colonnes, somme à 1 (ou que des zéros si aucun split).
     */
    double[] featureImportances();

    int featureCount();

    String modelType();
}
