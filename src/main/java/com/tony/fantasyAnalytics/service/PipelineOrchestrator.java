package com.tony.fantasyAnalytics.service;

import com.tony.fantasyAnalytics.config.PipelineProperties;
import com.tony.fantasyAnalytics.exception.DataAcquisitionException;
import com.tony.fantasyAnalytics.exception.DataUnavailableException;
import com.tony.fantasyAnalytics.exception.PipelineException;
import com.tony.fantasyAnalytics.exception.PipelineStage;
import com.tony.fantasyAnalytics.feature.TrainingExample;
import com.tony.fantasyAnalytics.feature.TransitionExtractor;
import com.tony.fantasyAnalytics.ml.TrainedModel;
import com.tony.fantasyAnalytics.model.ModelMetrics;
import com.tony.fantasyAnalytics.model.PredictionRecord;
import com.tony.fantasyAnalytics.model.SeasonRecord;
import com.tony.fantasyAnalytics.model.dto.StageReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.InputStream;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Enchaîne les étapes scraping / import -> entraînement -> prédiction.
 * Chaque étape rend un {@link StageReport} : un échec est une valeur, rien ne remonte à l'appelant.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PipelineOrchestrator {

    private final PipelineProperties properties;
    private final FantasyStatsScraperService scraperService;
    private final SeasonCsvImportService csvImportService;
    private final SeasonDataService seasonDataService;
    private final TransitionExtractor transitionExtractor;
    private final ModelTrainingService trainingService;
    private final ModelArtifactService artifactService;
    private final PredictionService predictionService;

    public StageReport scrape(List<Integer> years) {
        return runStage(PipelineStage.SCRAPE, () -> {
            List<Integer> targets = (years == null || years.isEmpty()) ? defaultYears() : years;

            List<SeasonRecord> records = new ArrayList<>();
            List<Integer> failedYears = new ArrayList<>();
            DataAcquisitionException lastFailure = null;
            for (Integer year : targets) {
                try {
                    records.addAll(scraperService.scrapeSeason(year));
                } catch (DataAcquisitionException e) {
                    log.warn("⚠️ Saison {} non récupérée : {}", year, e.getMessage());
                    failedYears.add(year);
                    lastFailure = e;
                }
            }
            if (records.isEmpty()) {
                if (lastFailure != null) throw lastFailure;
                throw new DataUnavailableException(PipelineStage.SCRAPE, "Aucune donnée récupérée pour " + targets);
            }

            int saved = seasonDataService.replaceSeasons(records);
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("years", targets);
            details.put("records", saved);
            details.put("failedYears", failedYears);
            return StageReport.ok(PipelineStage.SCRAPE, saved + " lignes historiques enregistrées", details);
        });
    }

    public StageReport importCsv(InputStream input) {
        return runStage(PipelineStage.IMPORT, () -> {
            List<SeasonRecord> records = csvImportService.read(input);
            if (records.isEmpty()) {
                throw new DataUnavailableException(PipelineStage.IMPORT, "Le fichier ne contient aucune ligne exploitable.");
            }
            int saved = seasonDataService.replaceSeasons(records);
            return StageReport.ok(PipelineStage.IMPORT, saved + " lignes importées", Map.of("records", saved));
        });
    }

    /**
     * Entraîne sur tout l'historique et publie l'artefact comme "latest". Rien n'est persisté en cas d'échec.
     */
    public StageReport train() {
        return runStage(PipelineStage.TRAIN, () -> {
            List<SeasonRecord> history = seasonDataService.loadHistory();
            List<TrainingExample> examples = transitionExtractor.extract(history);
            TrainedModel trained = trainingService.train(examples);
            String key = artifactService.save(trained);

            ModelMetrics metrics = trained.metadata().getMetrics();
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("artifactKey", key);
            details.put("trainingSamples", trained.metadata().getTrainingSamples());
            details.put("heldOutSamples", trained.metadata().getHeldOutSamples());
            details.put("mse", metrics.getMse());
            details.put("rmse", metrics.getRmse());
            details.put("r2", metrics.getR2());
            details.put("featureImportance", metrics.getFeatureImportance());
            return StageReport.ok(PipelineStage.TRAIN, "Modèle " + key + " entraîné sur " + examples.size() + " transitions", details);
        });
    }

    public StageReport predict() {
        return runStage(PipelineStage.PREDICT, () -> {
            int season = seasonDataService.resolveCurrentSeason();
            List<SeasonRecord> current = seasonDataService.loadSeason(season);

            String key = artifactService.latestKey();
            TrainedModel trained = artifactService.load(key);
            List<PredictionRecord> predictions = predictionService.predict(current, trained, null);
            int saved = predictionService.replaceSeason(season, key, predictions);

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("season", season);
            details.put("artifactKey", key);
            details.put("predictions", saved);
            return StageReport.ok(PipelineStage.PREDICT, saved + " prédictions pour la saison " + (season + 1), details);
        });
    }

    /**
     * Scraping (si des années sont fournies ou si demandé), entraînement puis prédiction. S'arrête au premier échec.
     */
    public List<StageReport> runPipeline(boolean scrapeFirst, List<Integer> years) {
        List<StageReport> reports = new ArrayList<>();
        List<Supplier<StageReport>> stages = new ArrayList<>();
        if (scrapeFirst) stages.add(() -> scrape(years));
        stages.add(this::train);
        stages.add(this::predict);

        for (Supplier<StageReport> stage : stages) {
            StageReport report = stage.get();
            reports.add(report);
            if (!report.isSuccess()) {
                log.warn("⛔ Pipeline interrompu à l'étape {} ({})", report.getStage(), report.getErrorCode());
                break;
            }
        }
        return reports;
    }

    // N dernières saisons terminées
    List<Integer> defaultYears() {
        int lastSeason = LocalDate.now().getYear() - 1;
        List<Integer> years = new ArrayList<>();
        for (int y = lastSeason - properties.getScraper().getYearsBack() + 1; y <= lastSeason; y++) {
            years.add(y);
        }
        return years;
    }

    private StageReport runStage(PipelineStage stage, Supplier<StageReport> body) {
        log.info("▶️ Étape {} démarrée", stage);
        try {
            StageReport report = body.get();
            log.info("✅ Étape {} terminée : {}", stage, report.getMessage());
            return report;
        } catch (PipelineException e) {
            if (e.isRetryable()) {
                log.warn("🔁 Étape {} en échec (nouvel essai possible) : {}", stage, e.getMessage());
            } else {
                log.warn("❌ Étape {} en échec : [{}] {}", stage, e.getErrorCode(), e.getMessage());
            }
            StageReport report = StageReport.failed(e);
            report.setStage(stage);
            return report;
        } catch (Exception e) {
            log.error("❌ Erreur inattendue pendant l'étape {}", stage, e);
            return StageReport.unexpected(stage, e);
        }
    }
}
