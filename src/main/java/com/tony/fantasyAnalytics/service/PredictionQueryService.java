package com.tony.fantasyAnalytics.service;

import com.tony.fantasyAnalytics.config.PipelineProperties;
import com.tony.fantasyAnalytics.exception.PredictionsNotFoundException;
import com.tony.fantasyAnalytics.model.Position;
import com.tony.fantasyAnalytics.model.PredictionRecord;
import com.tony.fantasyAnalytics.model.dto.PredictionQueryResponse;
import com.tony.fantasyAnalytics.model.dto.PredictionSummary;
import com.tony.fantasyAnalytics.repository.PredictionRecordRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Lecture du dernier jeu de prédictions persisté, découpé par poste et top N.
 */
@Service
@RequiredArgsConstructor
public class PredictionQueryService {

    private final PredictionRecordRepository repository;
    private final PipelineProperties properties;

    @Transactional(readOnly = true)
    public PredictionQueryResponse query(Integer topN, String position) {
        int limit = topN != null ? topN : properties.getDefaultTopN();
        if (limit < 1) throw new IllegalArgumentException("top_n doit être un entier positif");

        int season = latestSeason();
        List<PredictionRecord> predictions = new ArrayList<>(repository.findBySeasonOrderByPredictedNextYearDesc(season));
        predictions.sort(PredictionService.BY_PREDICTED_DESC);

        if (position != null && !position.isBlank()) {
            String wanted = position.trim();
            predictions.removeIf(p -> p.getPosition() == null || !p.getPosition().name().equalsIgnoreCase(wanted));
            if (predictions.isEmpty()) {
                throw new PredictionsNotFoundException("Aucun joueur trouvé pour le poste " + position);
            }
        }
        if (predictions.size() > limit) {
            predictions = new ArrayList<>(predictions.subList(0, limit));
        }

        return new PredictionQueryResponse(season, predictions, summarize(predictions),
                "Prédictions fantasy pour la saison " + (season + 1) + " (à partir de " + season + ")");
    }

    public int latestSeason() {
        return repository.findLatestSeason()
                .orElseThrow(() -> new PredictionsNotFoundException(
                        "Aucune prédiction disponible. Lancez d'abord un scraping puis un entraînement."));
    }

    public static PredictionSummary summarize(List<PredictionRecord> predictions) {
        Map<Position, Long> breakdown = new EnumMap<>(Position.class);
        predictions.forEach(p -> breakdown.merge(p.getPosition() != null ? p.getPosition() : Position.OTHER, 1L, Long::sum));

        OptionalDouble avgChange = predictions.stream()
                .map(PredictionRecord::getPercentChange)
                .filter(Objects::nonNull)
                .mapToDouble(Double::doubleValue)
                .average();

        PredictionRecord top = predictions.isEmpty() ? null : predictions.get(0);
        return new PredictionSummary(
                predictions.size(),
                breakdown,
                avgChange.isPresent() ? Math.round(avgChange.getAsDouble() * 10.0) / 10.0 : null,
                top != null ? top.getPlayer() : null,
                top != null ? top.getPredictedNextYear() : null);
    }
}
