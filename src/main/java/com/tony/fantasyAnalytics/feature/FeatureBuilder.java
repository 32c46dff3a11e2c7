package com.tony.fantasyAnalytics.feature;

import com.tony.fantasyAnalytics.config.PipelineProperties;
import com.tony.fantasyAnalytics.model.AttributeEstimate;
import com.tony.fantasyAnalytics.model.Position;
import com.tony.fantasyAnalytics.model.SeasonRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Encode une saison en vecteur de features. Seul point de construction des vecteurs :
 * l'entraînement et l'inférence passent tous deux par {@link #encode}.
 */
@Component
@RequiredArgsConstructor
public class FeatureBuilder {

    private static final int PEAK_AGE = 27;
    private static final double AGE_DECAY_PER_YEAR = 0.05;
    private static final double EXPERIENCE_STEP = 0.2;
    private static final double WEIGHTED_POINTS_FACTOR = 0.8;

    private final PipelineProperties properties;
    private final AttributeEstimator attributeEstimator;

    public FeatureSchema schema() {
        return properties.getFeatureSchema();
    }

    /**
     * Vecteur d'une transition (saison i -> saison i+1). La continuité d'équipe est observée.
     */
    public FeatureVector buildForTransition(SeasonRecord current, SeasonRecord next, Position position) {
        boolean sameTeam = next != null && Objects.equals(normalizeTeam(current.getTeam()), normalizeTeam(next.getTeam()));
        return encode(current, position, sameTeam);
    }

    /**
     * Vecteur d'inférence : l'équipe de la saison suivante est inconnue, on suppose qu'elle ne change pas.
     * Approximation assumée (pas d'information de transfert disponible).
     */
    public FeatureVector buildForInference(SeasonRecord current) {
        return encode(current, current.safePosition(), true);
    }

    FeatureVector encode(SeasonRecord record, Position position, boolean teamConsistent) {
        Position pos = position != null ? position : Position.OTHER;
        FeatureSchema schema = schema();
        AttributeEstimate attributes = attributeEstimator.estimate(record.getPlayerName(), pos);
        int age = attributes.age();

        double points = record.safePoints();
        double[] values = new double[schema.size()];
        values[0] = points;
        values[1] = points * WEIGHTED_POINTS_FACTOR;

        // One-hot poste (OTHER -> que des zéros)
        values[2] = pos == Position.QB ? 1 : 0;
        values[3] = pos == Position.RB ? 1 : 0;
        values[4] = pos == Position.WR ? 1 : 0;
        values[5] = pos == Position.TE ? 1 : 0;

        values[6] = ageFactor(age);
        values[7] = experienceFactor(attributes.experience());

        values[8] = (pos == Position.RB && age > 28) ? 1 : 0;
        values[9] = (pos == Position.WR && age >= 26 && age <= 32) ? 1 : 0;

        if (schema.includesTrend()) {
            int year = record.getYear() != null ? record.getYear() : properties.getEpochYear();
            values[10] = year - properties.getEpochYear();
            values[11] = teamConsistent ? 1 : 0;
        }
        return new FeatureVector(schema, values, attributes);
    }

    // Pic à 27 ans, décroissance linéaire, plancher à 0
    public static double ageFactor(int age) {
        return Math.max(0.0, 1.0 - Math.abs(PEAK_AGE - age) * AGE_DECAY_PER_YEAR);
    }

    // Saturation à 5 ans d'expérience
    public static double experienceFactor(int experience) {
        return Math.min(1.0, experience * EXPERIENCE_STEP);
    }

    private static String normalizeTeam(String team) {
        return team == null ? null : team.trim();
    }
}
