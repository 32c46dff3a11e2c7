package com.tony.fantasyAnalytics.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Réponse de /api/v1/analysis. Les sections non demandées (paramètre type) restent absentes.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AnalysisReport {

    @JsonProperty("predictions_analysis")
    private PredictionAnalysis predictionsAnalysis;

    @JsonProperty("historical_analysis")
    private HistoricalAnalysis historicalAnalysis;

    private List<String> insights;

    private Metadata metadata;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Metadata {
        @JsonProperty("analysis_timestamp")
        private LocalDateTime analysisTimestamp;
        @JsonProperty("analysis_type")
        private String analysisType;
        // Saison des prédictions analysées, null si aucune
        @JsonProperty("prediction_season")
        private Integer predictionSeason;
    }
}
