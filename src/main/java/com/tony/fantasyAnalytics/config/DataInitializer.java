package com.tony.fantasyAnalytics.config;

import com.tony.fantasyAnalytics.model.dto.StageReport;
import com.tony.fantasyAnalytics.service.PipelineOrchestrator;
import com.tony.fantasyAnalytics.service.SeasonDataService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.InputStream;

/**
 * Au premier démarrage (base vide), charge l'échantillon embarqué pour que l'API soit utilisable sans scraping.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DataInitializer implements CommandLineRunner {

    static final String SAMPLE_RESOURCE = "data/sample-seasons.csv";

    private final SeasonDataService seasonDataService;
    private final PipelineOrchestrator orchestrator;

    @Value("${fantasy.bootstrap.sample-data:false}")
    private boolean loadSampleData;

    @Override
    public void run(String... args) throws Exception {
        // On ne remplit que si la base est vide
        if (!loadSampleData || seasonDataService.count() > 0) return;

        log.info("🌱 Base vide : import de l'échantillon {}", SAMPLE_RESOURCE);
        try (InputStream input = new ClassPathResource(SAMPLE_RESOURCE).getInputStream()) {
            StageReport report = orchestrator.importCsv(input);
            if (!report.isSuccess()) {
                log.warn("⚠️ Échantillon non importé : {}", report.getMessage());
            }
        }
    }
}
