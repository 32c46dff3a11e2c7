package com.tony.fantasyAnalytics.service;

import com.tony.fantasyAnalytics.model.PredictionRecord;
import com.tony.fantasyAnalytics.model.SeasonRecord;
import com.tony.fantasyAnalytics.model.dto.AnalysisReport;
import com.tony.fantasyAnalytics.repository.PredictionRecordRepository;
import com.tony.fantasyAnalytics.repository.SeasonRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Assemble le rapport d'analyse selon le type demandé : all, predictions, historical ou insights.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AnalysisReportService {

    public static final Set<String> TYPES = Set.of("all", "predictions", "historical", "insights");

    private final PredictionRecordRepository predictionRepository;
    private final SeasonRecordRepository seasonRepository;
    private final AnalysisService analysisService;
    private final InsightService insightService;

    @Transactional(readOnly = true)
    public AnalysisReport buildReport(String type) {
        String normalized = type == null || type.isBlank() ? "all" : type.trim().toLowerCase(Locale.ROOT);
        if (!TYPES.contains(normalized)) {
            throw new IllegalArgumentException("Type d'analyse inconnu : " + type + " (attendu : " + TYPES + ")");
        }

        boolean withPredictions = !normalized.equals("historical");
        boolean withHistory = !normalized.equals("predictions");
        boolean withInsights = normalized.equals("all") || normalized.equals("insights");

        Integer season = withPredictions ? predictionRepository.findLatestSeason().orElse(null) : null;
        List<PredictionRecord> predictions = season != null
                ? predictionRepository.findBySeasonOrderByPredictedNextYearDesc(season)
                : List.of();
        List<SeasonRecord> history = withHistory ? seasonRepository.findAllByOrderByPlayerNameAscYearAsc() : List.of();

        log.info("📊 Analyse '{}' : {} prédictions, {} lignes historiques", normalized, predictions.size(), history.size());

        AnalysisReport.AnalysisReportBuilder report = AnalysisReport.builder()
                .metadata(new AnalysisReport.Metadata(LocalDateTime.now(), normalized, season));
        if (withPredictions) {
            report.predictionsAnalysis(analysisService.analyzePredictions(predictions));
        }
        if (withHistory) {
            report.historicalAnalysis(analysisService.analyzeHistorical(history));
        }
        if (withInsights) {
            report.insights(insightService.generateInsights(predictions, history));
        }
        return report.build();
    }
}
