package com.tony.fantasyAnalytics.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tony.fantasyAnalytics.model.Position;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PredictionSummary {
    @JsonProperty("total_predictions")
    private int totalPredictions;
    @JsonProperty("position_breakdown")
    private Map<Position, Long> positionBreakdown;
    // Moyenne des Percent_Change définis (null si aucun)
    @JsonProperty("avg_predicted_change")
    private Double avgPredictedChange;
    @JsonProperty("top_predicted_player")
    private String topPlayer;
    @JsonProperty("top_predicted_points")
    private Double topPredictedPoints;
}
