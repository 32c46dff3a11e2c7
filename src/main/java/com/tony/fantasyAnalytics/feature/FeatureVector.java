package com.tony.fantasyAnalytics.feature;

import com.tony.fantasyAnalytics.model.AttributeEstimate;

import java.util.Arrays;

/**
 * Vecteur ordonné selon {@link FeatureSchema}, avec l'estimation d'âge qui l'a produit.
 */
public final class FeatureVector {

    private final FeatureSchema schema;
    private final double[] values;
    private final AttributeEstimate attributes;

    public FeatureVector(FeatureSchema schema, double[] values, AttributeEstimate attributes) {
        if (values.length != schema.size()) {
            throw new IllegalArgumentException("Vecteur de taille " + values.length
                    + " incompatible avec le schéma " + schema.version() + " (" + schema.size() + ")");
        }
        this.schema = schema;
        this.values = values.clone();
        this.attributes = attributes;
    }

    public FeatureSchema schema() {
        return schema;
    }

    public double[] values() {
        return values.clone();
    }

    public double get(String featureName) {
        int idx = schema.featureNames().indexOf(featureName);
        if (idx < 0) throw new IllegalArgumentException("Feature absente du schéma " + schema.version() + " : " + featureName);
        return values[idx];
    }

    public int size() {
        return values.length;
    }

    public AttributeEstimate attributes() {
        return attributes;
    }

    @Override
    public String toString() {
        return schema.version() + Arrays.toString(values);
    }
}
