package com.tony.fantasyAnalytics.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.tony.fantasyAnalytics.model.Position;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PredictionAnalysis {

    @Builder.Default
    @JsonProperty("position_breakdown")
    private Map<Position, Long> positionBreakdown = new EnumMap<>(Position.class);

    @Builder.Default
    @JsonProperty("avg_predicted_change_by_position")
    private Map<Position, Double> avgPredictedChangeByPosition = new EnumMap<>(Position.class);

    @Builder.Default
    @JsonProperty("top_10_breakout_candidates")
    private List<PlayerMovement> breakoutCandidates = new ArrayList<>();

    @Builder.Default
    @JsonProperty("risk_candidates")
    private List<PlayerMovement> riskCandidates = new ArrayList<>();

    @Builder.Default
    @JsonProperty("age_analysis")
    private AgeAnalysis ageAnalysis = new AgeAnalysis();

    @Builder.Default
    @JsonProperty("confidence_analysis")
    private ConfidenceAnalysis confidenceAnalysis = new ConfidenceAnalysis();

    public static PredictionAnalysis empty() {
        return PredictionAnalysis.builder().build();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return positionBreakdown.isEmpty();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AgeAnalysis {
        @JsonProperty("avg_age_by_position")
        private Map<Position, Double> avgAgeByPosition = new EnumMap<>(Position.class);
        @JsonProperty("experience_by_position")
        private Map<Position, Double> experienceByPosition = new EnumMap<>(Position.class);
        @JsonProperty("avg_age")
        private Double avgAge;
        @JsonProperty("avg_experience")
        private Double avgExperience;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ConfidenceAnalysis {
        @JsonProperty("avg_confidence")
        private Double avgConfidence;
        @JsonProperty("confidence_by_position")
        private Map<Position, Double> confidenceByPosition = new EnumMap<>(Position.class);
    }
}
