package com.tony.fantasyAnalytics.service;

import com.tony.fantasyAnalytics.model.Position;
import com.tony.fantasyAnalytics.model.PredictionRecord;
import com.tony.fantasyAnalytics.model.SeasonRecord;
import com.tony.fantasyAnalytics.model.dto.AnalysisReport;
import com.tony.fantasyAnalytics.model.dto.HistoricalAnalysis;
import com.tony.fantasyAnalytics.model.dto.PredictionAnalysis;
import com.tony.fantasyAnalytics.repository.PredictionRecordRepository;
import com.tony.fantasyAnalytics.repository.SeasonRecordRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AnalysisReportServiceTest {

    @Mock
    private PredictionRecordRepository predictionRepository;
    @Mock
    private SeasonRecordRepository seasonRepository;
    @Mock
    private AnalysisService analysisService;
    @Mock
    private InsightService insightService;

    @InjectMocks
    private AnalysisReportService reportService;

    private final List<PredictionRecord> predictions = List.of(PredictionRecord.builder()
            .player("A").position(Position.WR).predictedNextYear(200.0).build());
    private final List<SeasonRecord> history = List.of(new SeasonRecord("A", Position.WR, "MIA", 180.0, 2024));

    @BeforeEach
    void setUp() {
        lenient().when(predictionRepository.findLatestSeason()).thenReturn(Optional.of(2024));
        lenient().when(predictionRepository.findBySeasonOrderByPredictedNextYearDesc(2024)).thenReturn(predictions);
        lenient().when(seasonRepository.findAllByOrderByPlayerNameAscYearAsc()).thenReturn(history);
        lenient().when(analysisService.analyzePredictions(anyList())).thenReturn(PredictionAnalysis.empty());
        lenient().when(analysisService.analyzeHistorical(anyList())).thenReturn(HistoricalAnalysis.empty());
    }

    @Test
    void allContainsEverySection() {
        when(insightService.generateInsights(predictions, history)).thenReturn(List.of("📊 ..."));

        AnalysisReport report = reportService.buildReport(null);

        assertThat(report.getPredictionsAnalysis()).isNotNull();
        assertThat(report.getHistoricalAnalysis()).isNotNull();
        assertThat(report.getInsights()).containsExactly("📊 ...");
        assertThat(report.getMetadata().getAnalysisType()).isEqualTo("all");
        assertThat(report.getMetadata().getPredictionSeason()).isEqualTo(2024);
    }

    @Test
    void predictionsOnlySkipsHistoryAndInsights() {
        AnalysisReport report = reportService.buildReport("Predictions");

        assertThat(report.getPredictionsAnalysis()).isNotNull();
        assertThat(report.getHistoricalAnalysis()).isNull();
        assertThat(report.getInsights()).isNull();
        verify(seasonRepository, never()).findAllByOrderByPlayerNameAscYearAsc();
    }

    @Test
    void historicalOnlyNeverTouchesPredictions() {
        AnalysisReport report = reportService.buildReport("historical");

        assertThat(report.getPredictionsAnalysis()).isNull();
        assertThat(report.getHistoricalAnalysis()).isNotNull();
        assertThat(report.getMetadata().getPredictionSeason()).isNull();
        verify(predictionRepository, never()).findLatestSeason();
    }

    @Test
    void missingPredictionsGiveEmptySection() {
        when(predictionRepository.findLatestSeason()).thenReturn(Optional.empty());

        AnalysisReport report = reportService.buildReport("predictions");

        verify(analysisService).analyzePredictions(List.of());
        assertThat(report.getMetadata().getPredictionSeason()).isNull();
    }

    @Test
    void unknownTypeIsRejected() {
        assertThatThrownBy(() -> reportService.buildReport("weekly"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("weekly");
    }
}
