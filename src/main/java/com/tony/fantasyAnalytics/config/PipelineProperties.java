package com.tony.fantasyAnalytics.config;

import com.tony.fantasyAnalytics.feature.FeatureSchema;
import com.tony.fantasyAnalytics.model.Position;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.EnumMap;
import java.util.Map;

/**
 * Configuration explicite du pipeline (plus de lecture d'environnement au fil de l'eau).
 * Les valeurs par défaut reproduisent le modèle de production.
 */
@Configuration
@ConfigurationProperties(prefix = "fantasy.pipeline")
@Validated
@Data
public class PipelineProperties {

    public enum AttributeMode { IDENTITY_STABLE, RANDOM }

    // --- Features ---
    private int epochYear = 2019;
    @NotNull
    private FeatureSchema featureSchema = FeatureSchema.V2_EXTENDED;
    @NotNull
    private AttributeMode attributeMode = AttributeMode.IDENTITY_STABLE;

    // Intervalles d'âge [min, max[ par poste
    private Map<Position, AgeRange> ageRanges = defaultAgeRanges();
    private AgeRange defaultAgeRange = new AgeRange(24, 29);

    // --- Prédiction ---
    private Map<Position, Double> positionVariance = defaultVariance();
    @DecimalMin("0.0") @DecimalMax("1.0")
    private double defaultVariance = 0.20;
    private double confidenceMin = 70.0;
    private double confidenceMax = 95.0;
    @Min(1)
    private int defaultTopN = 50;

    // Saison "courante" forcée ; sinon la plus récente en base
    private Integer currentSeason;

    // --- Analyse ---
    @Min(2)
    private int trendWindowYears = 3;
    @Min(1)
    private int topMovers = 10;

    @Valid
    private Forest forest = new Forest();
    @Valid
    private Scraper scraper = new Scraper();
    private Job job = new Job();

    public AgeRange ageRangeFor(Position position) {
        return ageRanges.getOrDefault(position, defaultAgeRange);
    }

    public double varianceFor(Position position) {
        return positionVariance.getOrDefault(position, defaultVariance);
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AgeRange {
        private int min;
        // Exclusif
        private int max;
    }

    @Data
    public static class Forest {
        @Min(1)
        private int trees = 200;
        @Min(1)
        private int maxDepth = 12;
        @Min(2)
        private int minSamplesSplit = 5;
        @Min(1)
        private int minSamplesLeaf = 2;
        private long seed = 42L;
        @DecimalMin("0.0") @DecimalMax("0.9")
        private double testFraction = 0.2;
    }

    @Data
    public static class Scraper {
        private String urlTemplate = "https://www.pro-football-reference.com/years/%d/fantasy.htm";
        @Min(1000)
        private int timeoutMs = 30000;
        @Min(0)
        private int yearsBack = 4;
    }

    @Data
    public static class Job {
        private boolean enabled = false;
        private String cron = "0 0 6 * * TUE";
    }

    private static Map<Position, AgeRange> defaultAgeRanges() {
        Map<Position, AgeRange> ranges = new EnumMap<>(Position.class);
        ranges.put(Position.QB, new AgeRange(25, 35));
        ranges.put(Position.RB, new AgeRange(22, 28));
        ranges.put(Position.WR, new AgeRange(23, 30));
        ranges.put(Position.TE, new AgeRange(23, 29));
        return ranges;
    }

    private static Map<Position, Double> defaultVariance() {
        Map<Position, Double> variance = new EnumMap<>(Position.class);
        variance.put(Position.QB, 0.15);
        variance.put(Position.RB, 0.25);
        variance.put(Position.WR, 0.20);
        variance.put(Position.TE, 0.30);
        return variance;
    }
}
