package com.tony.fantasyAnalytics.service;

import com.tony.fantasyAnalytics.config.PipelineProperties;
import com.tony.fantasyAnalytics.exception.DataUnavailableException;
import com.tony.fantasyAnalytics.exception.PipelineStage;
import com.tony.fantasyAnalytics.model.SeasonRecord;
import com.tony.fantasyAnalytics.repository.SeasonRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Stockage de l'historique : une saison importée remplace entièrement la précédente version de cette saison.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SeasonDataService {

    private final SeasonRecordRepository repository;
    private final PipelineProperties properties;

    @Transactional
    public int replaceSeasons(List<SeasonRecord> records) {
        List<SeasonRecord> valid = records.stream()
                .filter(r -> r.getYear() != null && r.getPlayerName() != null && !r.getPlayerName().isBlank())
                .toList();
        if (valid.size() < records.size()) {
            log.warn("⚠️ {} lignes sans joueur ou sans année ignorées.", records.size() - valid.size());
        }
        if (valid.isEmpty()) return 0;

        Set<Integer> years = new TreeSet<>();
        valid.forEach(r -> years.add(r.getYear()));
        int deleted = repository.deleteByYearIn(years);
        if (deleted > 0) log.info("🧹 {} lignes remplacées pour les saisons {}", deleted, years);

        repository.saveAll(valid);
        log.info("💾 {} lignes enregistrées pour les saisons {}", valid.size(), years);
        return valid.size();
    }

    @Transactional(readOnly = true)
    public List<SeasonRecord> loadHistory() {
        List<SeasonRecord> all = repository.findAllByOrderByPlayerNameAscYearAsc();
        if (all.isEmpty()) {
            throw new DataUnavailableException(PipelineStage.TRAIN, "Aucune donnée historique en base. Lancez un scraping ou un import CSV.");
        }
        return all;
    }

    /**
     * Saison forcée par la configuration, sinon la plus récente en base.
     */
    @Transactional(readOnly = true)
    public int resolveCurrentSeason() {
        if (properties.getCurrentSeason() != null) return properties.getCurrentSeason();
        return repository.findLatestYear()
                .orElseThrow(() -> new DataUnavailableException(PipelineStage.PREDICT, "Aucune saison disponible en base."));
    }

    @Transactional(readOnly = true)
    public List<SeasonRecord> loadSeason(int year) {
        List<SeasonRecord> season = repository.findByYear(year);
        if (season.isEmpty()) {
            throw new DataUnavailableException(PipelineStage.PREDICT, "Aucune donnée pour la saison " + year);
        }
        return season;
    }

    @Transactional(readOnly = true)
    public long count() {
        return repository.count();
    }
}
