package com.tony.fantasyAnalytics.job;

import com.tony.fantasyAnalytics.config.PipelineProperties;
import com.tony.fantasyAnalytics.model.dto.StageReport;
import com.tony.fantasyAnalytics.service.PipelineOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@RequiredArgsConstructor
@Slf4j
public class WeeklyPipelineJob {

    private final PipelineOrchestrator orchestrator;
    private final PipelineProperties properties;

    /**
     * Scraping des dernières saisons, ré-entraînement puis prédiction.
     * Fréquence : fantasy.pipeline.job.cron (mardi 6h par défaut, après la journée NFL du lundi soir).
     */
    @Scheduled(cron = "${fantasy.pipeline.job.cron:0 0 6 * * TUE}")
    public void runWeeklyPipeline() {
        if (!properties.getJob().isEnabled()) {
            log.debug("Job hebdomadaire désactivé (fantasy.pipeline.job.enabled=false)");
            return;
        }
        log.info("⏰ [CRON] Démarrage du pipeline hebdomadaire...");
        List<StageReport> reports = orchestrator.runPipeline(true, List.of());
        reports.forEach(r -> log.info("   -> {} : {} ({})", r.getStage(), r.isSuccess() ? "OK" : "ÉCHEC", r.getMessage()));

        boolean allOk = reports.stream().allMatch(StageReport::isSuccess);
        if (allOk) {
            log.info("✅ [CRON] Pipeline hebdomadaire terminé.");
        } else {
            log.error("❌ [CRON] Pipeline hebdomadaire en échec.");
        }
    }
}
