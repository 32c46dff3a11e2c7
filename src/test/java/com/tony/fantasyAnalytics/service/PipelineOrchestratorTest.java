package com.tony.fantasyAnalytics.service;

import com.tony.fantasyAnalytics.config.PipelineProperties;
import com.tony.fantasyAnalytics.exception.ArtifactUnavailableException;
import com.tony.fantasyAnalytics.exception.DataAcquisitionException;
import com.tony.fantasyAnalytics.exception.InsufficientDataException;
import com.tony.fantasyAnalytics.exception.PipelineStage;
import com.tony.fantasyAnalytics.feature.TransitionExtractor;
import com.tony.fantasyAnalytics.ml.RegressionModel;
import com.tony.fantasyAnalytics.ml.TrainedModel;
import com.tony.fantasyAnalytics.model.ModelMetadata;
import com.tony.fantasyAnalytics.model.ModelMetrics;
import com.tony.fantasyAnalytics.model.Position;
import com.tony.fantasyAnalytics.model.PredictionRecord;
import com.tony.fantasyAnalytics.model.SeasonRecord;
import com.tony.fantasyAnalytics.model.dto.StageReport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PipelineOrchestratorTest {

    @Spy
    private PipelineProperties properties = new PipelineProperties();
    @Mock
    private FantasyStatsScraperService scraperService;
    @Mock
    private SeasonCsvImportService csvImportService;
    @Mock
    private SeasonDataService seasonDataService;
    @Mock
    private TransitionExtractor transitionExtractor;
    @Mock
    private ModelTrainingService trainingService;
    @Mock
    private ModelArtifactService artifactService;
    @Mock
    private PredictionService predictionService;

    @InjectMocks
    private PipelineOrchestrator orchestrator;

    private final List<SeasonRecord> history = List.of(new SeasonRecord("A", Position.QB, "BUF", 300.0, 2023));

    @Test
    @DisplayName("Données insuffisantes : échec en valeur, aucun modèle persisté")
    void insufficientDataIsAFailedReportWithoutSave() {
        when(seasonDataService.loadHistory()).thenReturn(history);
        when(transitionExtractor.extract(history)).thenReturn(List.of());
        when(trainingService.train(List.of())).thenThrow(new InsufficientDataException("Aucun exemple"));

        StageReport report = orchestrator.train();

        assertThat(report.isSuccess()).isFalse();
        assertThat(report.getStage()).isEqualTo(PipelineStage.TRAIN);
        assertThat(report.getErrorCode()).isEqualTo("ERR-DATA-002");
        assertThat(report.isRetryable()).isFalse();
        verify(artifactService, never()).save(any());
    }

    @Test
    void successfulTrainingPublishesArtifact() {
        TrainedModel trained = new TrainedModel(mock(RegressionModel.class), ModelMetadata.builder()
                .trainingSamples(6).heldOutSamples(2)
                .metrics(ModelMetrics.builder().mse(4.0).rmse(2.0).r2(0.5).build())
                .build());
        when(seasonDataService.loadHistory()).thenReturn(history);
        when(transitionExtractor.extract(history)).thenReturn(List.of());
        when(trainingService.train(anyList())).thenReturn(trained);
        when(artifactService.save(trained)).thenReturn("fantasy_predictor_1");

        StageReport report = orchestrator.train();

        assertThat(report.isSuccess()).isTrue();
        assertThat(report.getDetails()).containsEntry("artifactKey", "fantasy_predictor_1").containsEntry("r2", 0.5);
    }

    @Test
    void scrapeKeepsSuccessfulYearsAndReportsFailedOnes() {
        when(scraperService.scrapeSeason(2022)).thenThrow(new DataAcquisitionException(PipelineStage.SCRAPE, "HTTP 429", null));
        when(scraperService.scrapeSeason(2023)).thenReturn(history);
        when(seasonDataService.replaceSeasons(history)).thenReturn(1);

        StageReport report = orchestrator.scrape(List.of(2022, 2023));

        assertThat(report.isSuccess()).isTrue();
        assertThat(report.getDetails()).containsEntry("records", 1).containsEntry("failedYears", List.of(2022));
    }

    @Test
    @DisplayName("Échec d'I/O sur toutes les saisons : rapport 'retryable'")
    void scrapeFailureIsRetryable() {
        when(scraperService.scrapeSeason(anyInt())).thenThrow(new DataAcquisitionException(PipelineStage.SCRAPE, "timeout", new IOException()));

        StageReport report = orchestrator.scrape(List.of(2023));

        assertThat(report.isSuccess()).isFalse();
        assertThat(report.isRetryable()).isTrue();
        assertThat(report.getErrorCode()).isEqualTo("ERR-IO-001");
        verify(seasonDataService, never()).replaceSeasons(anyList());
    }

    @Test
    void defaultScrapeYearsFollowConfiguration() {
        properties.getScraper().setYearsBack(3);

        List<Integer> years = orchestrator.defaultYears();

        assertThat(years).hasSize(3).isSorted();
        assertThat(years.get(2)).isEqualTo(java.time.LocalDate.now().getYear() - 1);
    }

    @Test
    void predictWithoutModelFailsFast() {
        when(seasonDataService.resolveCurrentSeason()).thenReturn(2024);
        when(seasonDataService.loadSeason(2024)).thenReturn(history);
        when(artifactService.latestKey()).thenThrow(new ArtifactUnavailableException("Aucun modèle"));

        StageReport report = orchestrator.predict();

        assertThat(report.isSuccess()).isFalse();
        assertThat(report.getErrorCode()).isEqualTo("ERR-MODEL-001");
        verify(predictionService, never()).replaceSeason(anyInt(), anyString(), anyList());
    }

    @Test
    void predictPersistsFullSetForCurrentSeason() {
        TrainedModel trained = new TrainedModel(mock(RegressionModel.class), new ModelMetadata());
        List<PredictionRecord> predictions = List.of(PredictionRecord.builder().player("A").build());
        when(seasonDataService.resolveCurrentSeason()).thenReturn(2024);
        when(seasonDataService.loadSeason(2024)).thenReturn(history);
        when(artifactService.latestKey()).thenReturn("fantasy_predictor_1");
        when(artifactService.load("fantasy_predictor_1")).thenReturn(trained);
        when(predictionService.predict(history, trained, null)).thenReturn(predictions);
        when(predictionService.replaceSeason(2024, "fantasy_predictor_1", predictions)).thenReturn(1);

        StageReport report = orchestrator.predict();

        assertThat(report.isSuccess()).isTrue();
        assertThat(report.getDetails()).containsEntry("season", 2024).containsEntry("predictions", 1);
    }

    @Test
    void pipelineStopsAtFirstFailure() {
        when(seasonDataService.loadHistory()).thenThrow(new IllegalStateException("base indisponible"));

        List<StageReport> reports = orchestrator.runPipeline(false, List.of());

        assertThat(reports).hasSize(1);
        assertThat(reports.get(0).getStage()).isEqualTo(PipelineStage.TRAIN);
        assertThat(reports.get(0).getErrorCode()).isEqualTo("ERR-SYS-001");
        verify(seasonDataService, never()).resolveCurrentSeason();
        verify(predictionService, never()).predict(anyList(), any(), eq(null));
    }
}
