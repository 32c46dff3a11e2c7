package com.tony.fantasyAnalytics.feature;

import com.tony.fantasyAnalytics.config.PipelineProperties;
import com.tony.fantasyAnalytics.model.AttributeEstimate;
import com.tony.fantasyAnalytics.model.Position;
import org.apache.commons.math3.random.Well19937c;

import java.util.Locale;

/**
 * Tirage pseudo-aléatoire dérivé de l'identité du joueur : le même joueur (nom + poste)
 * reçoit toujours le même âge, à l'entraînement comme à l'inférence.
 */
public class IdentityStableAttributeEstimator implements AttributeEstimator {

    private final PipelineProperties properties;

    public IdentityStableAttributeEstimator(PipelineProperties properties) {
        this.properties = properties;
    }

    @Override
    public AttributeEstimate estimate(String playerName, Position position) {
        Position pos = position != null ? position : Position.OTHER;
        PipelineProperties.AgeRange range = properties.ageRangeFor(pos);

        Well19937c rng = new Well19937c(seedFor(playerName, pos));
        int width = Math.max(1, range.getMax() - range.getMin());
        int age = range.getMin() + rng.nextInt(width);
        return AttributeEstimate.fromAge(age);
    }

    static long seedFor(String playerName, Position position) {
        String key = (playerName == null ? "" : playerName.trim().toLowerCase(Locale.ROOT)) + "|" + position.name();
        // FNV-1a 64 bits : stable d'une JVM à l'autre (contrairement à un hash d'objet)
        long hash = 0xcbf29ce484222325L;
        for (int i = 0; i < key.length(); i++) {
            hash ^= key.charAt(i);
            hash *= 0x100000001b3L;
        }
        return hash;
    }
}
