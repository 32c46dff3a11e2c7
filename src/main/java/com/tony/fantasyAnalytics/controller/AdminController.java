package com.tony.fantasyAnalytics.controller;

import com.tony.fantasyAnalytics.exception.DataAcquisitionException;
import com.tony.fantasyAnalytics.exception.PipelineStage;
import com.tony.fantasyAnalytics.model.ModelMetadata;
import com.tony.fantasyAnalytics.model.dto.ArtifactSummary;
import com.tony.fantasyAnalytics.model.dto.ScrapeRequest;
import com.tony.fantasyAnalytics.model.dto.StageReport;
import com.tony.fantasyAnalytics.service.ModelArtifactService;
import com.tony.fantasyAnalytics.service.PipelineOrchestrator;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

@RestController
@RequestMapping("/api/v1/admin")
@RequiredArgsConstructor
@Slf4j
public class AdminController {

    private final PipelineOrchestrator orchestrator;
    private final ModelArtifactService artifactService;

    // Body optionnel : {"years": [2021, 2022, 2023]}
    @PostMapping("/scrape")
    public ResponseEntity<StageReport> scrape(@Valid @RequestBody(required = false) ScrapeRequest request) {
        List<Integer> years = yearsOf(request);
        log.info("🌐 Scraping demandé par l'admin pour {}", years.isEmpty() ? "les dernières saisons" : years);
        return toResponse(orchestrator.scrape(years));
    }

    @PostMapping(value = "/import", consumes = "multipart/form-data")
    public ResponseEntity<StageReport> importCsv(@RequestParam("file") MultipartFile file) {
        log.info("📥 Import CSV : {} ({} octets)", file.getOriginalFilename(), file.getSize());
        try (InputStream input = file.getInputStream()) {
            return toResponse(orchestrator.importCsv(input));
        } catch (IOException e) {
            throw new DataAcquisitionException(PipelineStage.IMPORT, "Fichier illisible : " + file.getOriginalFilename(), e);
        }
    }

    @PostMapping("/train")
    public ResponseEntity<StageReport> train() {
        log.info("🧠 Entraînement demandé par l'admin");
        return toResponse(orchestrator.train());
    }

    @PostMapping("/predict")
    public ResponseEntity<StageReport> predict() {
        log.info("🔮 Prédiction demandée par l'admin");
        return toResponse(orchestrator.predict());
    }

    /**
     * Pipeline complet. Avec scrape=false, on réutilise l'historique déjà en base.
     */
    @PostMapping("/run-pipeline")
    public ResponseEntity<List<StageReport>> runPipeline(
            @RequestParam(defaultValue = "false") boolean scrape,
            @Valid @RequestBody(required = false) ScrapeRequest request) {
        List<StageReport> reports = orchestrator.runPipeline(scrape, yearsOf(request));
        boolean allOk = reports.stream().allMatch(StageReport::isSuccess);
        return ResponseEntity.status(allOk ? HttpStatus.OK : HttpStatus.UNPROCESSABLE_ENTITY).body(reports);
    }

    @GetMapping("/models")
    public ResponseEntity<List<ArtifactSummary>> listModels() {
        String latest = artifactService.latestKeyOrNull();
        return ResponseEntity.ok(artifactService.listArtifacts().stream()
                .map(a -> ArtifactSummary.of(a, latest))
                .toList());
    }

    @GetMapping("/models/latest")
    public ResponseEntity<ModelMetadata> latestModel() {
        return ResponseEntity.ok(artifactService.latestMetadata());
    }

    // Pas de body ou {"years": null} : saisons par défaut
    private static List<Integer> yearsOf(ScrapeRequest request) {
        return request != null && request.getYears() != null ? request.getYears() : List.of();
    }

    // Échec "retryable" (I/O) -> 503, autre échec -> 422
    private ResponseEntity<StageReport> toResponse(StageReport report) {
        if (report.isSuccess()) return ResponseEntity.ok(report);
        HttpStatus status = report.isRetryable() ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.UNPROCESSABLE_ENTITY;
        return ResponseEntity.status(status).body(report);
    }
}
