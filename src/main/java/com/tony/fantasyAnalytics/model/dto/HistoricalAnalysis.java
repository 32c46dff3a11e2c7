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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class HistoricalAnalysis {

    // --- Vue d'ensemble ---
    @JsonProperty("total_records")
    private long totalRecords;
    @Builder.Default
    @JsonProperty("years_covered")
    private List<Integer> yearsCovered = new ArrayList<>();
    @Builder.Default
    @JsonProperty("positions")
    private Map<Position, Long> positions = new EnumMap<>(Position.class);
    // 10 équipes les plus représentées, par effectif décroissant
    @Builder.Default
    @JsonProperty("teams")
    private Map<String, Long> teams = new LinkedHashMap<>();

    // --- Points ---
    @Builder.Default
    @JsonProperty("avg_points_by_year")
    private Map<Integer, Double> avgPointsByYear = new TreeMap<>();
    @Builder.Default
    @JsonProperty("avg_points_by_position")
    private Map<Position, Double> avgPointsByPosition = new EnumMap<>(Position.class);
    @Builder.Default
    @JsonProperty("top_scorers_by_year")
    private Map<Integer, List<TopScorer>> topScorersByYear = new TreeMap<>();

    // --- Tendances ---
    @Builder.Default
    @JsonProperty("points_trend_by_position")
    private Map<Position, Map<Integer, Double>> pointsTrendByPosition = new EnumMap<>(Position.class);

    public static HistoricalAnalysis empty() {
        return HistoricalAnalysis.builder().build();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return totalRecords == 0;
    }
}
