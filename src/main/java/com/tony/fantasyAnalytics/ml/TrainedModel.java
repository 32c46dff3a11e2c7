package com.tony.fantasyAnalytics.ml;

import com.tony.fantasyAnalytics.model.ModelMetadata;

/**
 * Modèle entraîné + métadonnées. Jamais modifié après création.
 */
public record TrainedModel(RegressionModel model, ModelMetadata metadata) {
}
