package com.tony.fantasyAnalytics.feature;

import com.tony.fantasyAnalytics.model.TransitionProvenance;

/**
 * Paire (features saison i, points saison i+1).
 */
public record TrainingExample(FeatureVector features, double label, TransitionProvenance provenance) {
}
