package com.tony.fantasyAnalytics.feature;

import com.tony.fantasyAnalytics.config.PipelineProperties;
import com.tony.fantasyAnalytics.model.AttributeEstimate;
import com.tony.fantasyAnalytics.model.Position;
import org.apache.commons.math3.random.RandomGenerator;

/**
 * Comportement historique : nouveau tirage uniforme à chaque appel, sans mémoire par joueur.
 */
public class RandomAttributeEstimator implements AttributeEstimator {

    private final PipelineProperties properties;
    private final RandomGenerator random;

    public RandomAttributeEstimator(PipelineProperties properties, RandomGenerator random) {
        this.properties = properties;
        this.random = random;
    }

    @Override
    public synchronized AttributeEstimate estimate(String playerName, Position position) {
        PipelineProperties.AgeRange range = properties.ageRangeFor(position != null ? position : Position.OTHER);
        int width = Math.max(1, range.getMax() - range.getMin());
        return AttributeEstimate.fromAge(range.getMin() + random.nextInt(width));
    }
}
