package com.tony.fantasyAnalytics.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tony.fantasyAnalytics.model.Position;
import com.tony.fantasyAnalytics.model.PredictionRecord;

/**
 * Vue réduite d'une prédiction pour les listes "breakout" / "risque".
 */
public record PlayerMovement(
        @JsonProperty("Player") String player,
        @JsonProperty("Position") Position position,
        @JsonProperty("Current_Points") Double currentPoints,
        @JsonProperty("Predicted_Next_Year") Double predictedNextYear,
        @JsonProperty("Percent_Change") Double percentChange,
        @JsonProperty("Confidence") Double confidence) {

    public static PlayerMovement of(PredictionRecord p) {
        return new PlayerMovement(p.getPlayer(), p.getPosition(), p.getCurrentPoints(),
                p.getPredictedNextYear(), p.getPercentChange(), p.getConfidence());
    }
}
