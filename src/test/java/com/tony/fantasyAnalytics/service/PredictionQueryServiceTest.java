package com.tony.fantasyAnalytics.service;

import com.tony.fantasyAnalytics.config.PipelineProperties;
import com.tony.fantasyAnalytics.exception.PredictionsNotFoundException;
import com.tony.fantasyAnalytics.model.Position;
import com.tony.fantasyAnalytics.model.PredictionRecord;
import com.tony.fantasyAnalytics.model.dto.PredictionQueryResponse;
import com.tony.fantasyAnalytics.repository.PredictionRecordRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PredictionQueryServiceTest {

    @Mock
    private PredictionRecordRepository repository;

    private PredictionQueryService queryService;

    @BeforeEach
    void setUp() {
        PipelineProperties properties = new PipelineProperties();
        properties.setDefaultTopN(3);
        queryService = new PredictionQueryService(repository, properties);
    }

    private static PredictionRecord prediction(String player, Position position, double predicted, Double change) {
        return PredictionRecord.builder()
                .player(player).position(position).team("X")
                .currentPoints(100.0).predictedNextYear(predicted).percentChange(change)
                .confidence(80.0).age(27).experience(5).season(2024)
                .build();
    }

    private void givenStoredPredictions() {
        when(repository.findLatestSeason()).thenReturn(Optional.of(2024));
        when(repository.findBySeasonOrderByPredictedNextYearDesc(2024)).thenReturn(new ArrayList<>(List.of(
                prediction("Qb One", Position.QB, 330.0, 10.0),
                prediction("Wr One", Position.WR, 250.0, 25.0),
                prediction("Rb One", Position.RB, 240.0, null),
                prediction("Wr Two", Position.WR, 200.0, -20.0),
                prediction("Te One", Position.TE, 150.0, 5.0))));
    }

    @Test
    void defaultTopNComesFromConfiguration() {
        givenStoredPredictions();

        PredictionQueryResponse response = queryService.query(null, null);

        assertThat(response.getPredictions()).extracting(PredictionRecord::getPlayer)
                .containsExactly("Qb One", "Wr One", "Rb One");
        assertThat(response.getSeason()).isEqualTo(2024);
        assertThat(response.getSummary().getTotalPredictions()).isEqualTo(3);
        assertThat(response.getSummary().getTopPlayer()).isEqualTo("Qb One");
        assertThat(response.getSummary().getTopPredictedPoints()).isEqualTo(330.0);
        // Moyenne des changements définis : (10 + 25) / 2
        assertThat(response.getSummary().getAvgPredictedChange()).isEqualTo(17.5);
        assertThat(response.getNote()).contains("2025");
    }

    @Test
    @DisplayName("Le filtre de poste est insensible à la casse")
    void positionFilterIsCaseInsensitive() {
        givenStoredPredictions();

        PredictionQueryResponse response = queryService.query(10, "wr");

        assertThat(response.getPredictions()).extracting(PredictionRecord::getPlayer).containsExactly("Wr One", "Wr Two");
        assertThat(response.getSummary().getPositionBreakdown()).containsEntry(Position.WR, 2L).hasSize(1);
    }

    @Test
    void unknownPositionIsNotFound() {
        givenStoredPredictions();

        assertThatThrownBy(() -> queryService.query(10, "LS"))
                .isInstanceOf(PredictionsNotFoundException.class)
                .hasMessageContaining("LS");
    }

    @Test
    void noPersistedPredictionsIsNotFound() {
        when(repository.findLatestSeason()).thenReturn(Optional.empty());

        assertThatThrownBy(() -> queryService.query(5, null)).isInstanceOf(PredictionsNotFoundException.class);
    }

    @Test
    void nonPositiveTopNIsRejected() {
        assertThatThrownBy(() -> queryService.query(0, null)).isInstanceOf(IllegalArgumentException.class);
    }
}
