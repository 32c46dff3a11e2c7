package com.tony.fantasyAnalytics.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tony.fantasyAnalytics.model.Position;

public record TopScorer(
        @JsonProperty("Player") String player,
        @JsonProperty("Position") Position position,
        @JsonProperty("Team") String team,
        @JsonProperty("Fantasy_Points") double fantasyPoints) {
}
