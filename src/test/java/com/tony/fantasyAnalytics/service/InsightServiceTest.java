package com.tony.fantasyAnalytics.service;

import com.tony.fantasyAnalytics.config.PipelineProperties;
import com.tony.fantasyAnalytics.model.Position;
import com.tony.fantasyAnalytics.model.PredictionRecord;
import com.tony.fantasyAnalytics.model.SeasonRecord;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class InsightServiceTest {

    private final InsightService insightService = new InsightService(new PipelineProperties());

    @Test
    void noInputNoInsight() {
        assertThat(insightService.generateInsights(List.of(), List.of())).isEmpty();
        assertThat(insightService.generateInsights(null, null)).isEmpty();
    }

    @Test
    void describesPredictionSet() {
        List<PredictionRecord> predictions = List.of(
                PredictionRecord.builder().player("Puka Nacua").position(Position.WR).percentChange(35.5).age(23).build(),
                PredictionRecord.builder().player("Davante Adams").position(Position.WR).percentChange(-18.2).age(31).build(),
                PredictionRecord.builder().player("Derrick Henry").position(Position.RB).percentChange(null).age(30).build());

        List<String> insights = insightService.generateInsights(predictions, List.of());

        assertThat(insights).hasSize(4);
        assertThat(insights.get(0)).contains("WR").contains("2 joueurs");
        assertThat(insights.get(1)).contains("Puka Nacua").contains("+35.5");
        assertThat(insights.get(2)).contains("Davante Adams").contains("-18.2");
        assertThat(insights.get(3)).contains("28.0 ans");
    }

    @Test
    void trendUsesTheLastThreeSeasons() {
        // 2020 très haut, mais hors fenêtre : seules 2021 -> 2023 comptent
        List<SeasonRecord> history = List.of(
                new SeasonRecord("A", Position.QB, "X", 900.0, 2020),
                new SeasonRecord("A", Position.QB, "X", 100.0, 2021),
                new SeasonRecord("A", Position.QB, "X", 50.0, 2022),
                new SeasonRecord("A", Position.QB, "X", 150.0, 2023));

        List<String> insights = insightService.generateInsights(List.of(), history);

        assertThat(insights).hasSize(1);
        assertThat(insights.get(0)).contains("hausse").contains("3 dernières saisons");
    }

    @Test
    void singleSeasonHasNoTrend() {
        List<String> insights = insightService.generateInsights(List.of(),
                List.of(new SeasonRecord("A", Position.QB, "X", 100.0, 2023)));

        assertThat(insights).isEmpty();
    }
}
