package com.tony.fantasyAnalytics.service;

import com.tony.fantasyAnalytics.config.PipelineProperties;
import com.tony.fantasyAnalytics.exception.FeatureSchemaMismatchException;
import com.tony.fantasyAnalytics.feature.FeatureBuilder;
import com.tony.fantasyAnalytics.feature.FeatureSchema;
import com.tony.fantasyAnalytics.feature.FeatureVector;
import com.tony.fantasyAnalytics.ml.TrainedModel;
import com.tony.fantasyAnalytics.model.ModelMetadata;
import com.tony.fantasyAnalytics.model.Position;
import com.tony.fantasyAnalytics.model.PredictionRecord;
import com.tony.fantasyAnalytics.model.SeasonRecord;
import com.tony.fantasyAnalytics.repository.PredictionRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.random.RandomGenerator;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Prédiction saison N+1 : même transformation de features qu'à l'entraînement, puis bruit par poste.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PredictionService {

    private final PipelineProperties properties;
    private final FeatureBuilder featureBuilder;
    private final RandomGenerator predictionRandom;
    private final PredictionRecordRepository repository;

    public static final Comparator<PredictionRecord> BY_PREDICTED_DESC = Comparator
            .comparing(PredictionRecord::getPredictedNextYear, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(PredictionRecord::getPlayer, Comparator.nullsLast(Comparator.naturalOrder()));

    /**
     * @param topN null ou <= 0 : pas de troncature
     */
    public List<PredictionRecord> predict(List<SeasonRecord> currentSeason, TrainedModel trained, Integer topN) {
        if (currentSeason == null || currentSeason.isEmpty()) {
            log.warn("Aucune saison courante fournie : ensemble de prédictions vide.");
            return new ArrayList<>();
        }
        checkCompatibility(trained.metadata());

        List<PredictionRecord> predictions = new ArrayList<>(currentSeason.size());
        for (SeasonRecord record : currentSeason) {
            if (record == null || record.getPlayerName() == null || record.getPlayerName().isBlank()) continue;

            FeatureVector features = featureBuilder.buildForInference(record);
            if (features.size() != trained.model().featureCount()) {
                throw new FeatureSchemaMismatchException("Le modèle attend " + trained.model().featureCount()
                        + " features, le pipeline en produit " + features.size());
            }

            double raw = trained.model().predict(features.values());
            Position position = record.safePosition();
            double predicted = round(raw * varianceMultiplier(position));
            double current = record.safePoints();

            predictions.add(PredictionRecord.builder()
                    .season(record.getYear())
                    .player(record.getPlayerName().trim())
                    .position(position)
                    .team(record.getTeam())
                    .currentPoints(current)
                    .predictedNextYear(predicted)
                    .percentChange(percentChange(current, predicted))
                    .confidence(round(drawConfidence()))
                    .age(features.attributes().age())
                    .experience(features.attributes().experience())
                    .build());
        }

        predictions.sort(BY_PREDICTED_DESC);
        if (topN != null && topN > 0 && predictions.size() > topN) {
            predictions = new ArrayList<>(predictions.subList(0, topN));
        }
        log.info("🔮 {} prédictions générées.", predictions.size());
        return predictions;
    }

    /**
     * Remplace intégralement le jeu de prédictions d'une saison. Le découpage (top N, poste) se fait à la lecture.
     */
    @Transactional
    public int replaceSeason(int season, String modelKey, List<PredictionRecord> predictions) {
        int deleted = repository.deleteBySeason(season);
        if (deleted > 0) log.info("🧹 {} anciennes prédictions supprimées pour la saison {}", deleted, season);
        predictions.forEach(p -> {
            p.setSeason(season);
            p.setModelKey(modelKey);
        });
        repository.saveAll(predictions);
        return predictions.size();
    }

    /**
     * Refuse un modèle entraîné sur un autre contrat de features que le pipeline courant.
     */
    void checkCompatibility(ModelMetadata metadata) {
        FeatureSchema schema = featureBuilder.schema();
        if (!schema.version().equals(metadata.getSchemaVersion()) || !schema.schemaHash().equals(metadata.getSchemaHash())) {
            throw new FeatureSchemaMismatchException("Schéma du modèle " + metadata.getSchemaVersion()
                    + " incompatible avec le pipeline " + schema.version() + ". Ré-entraînez le modèle.");
        }
        if (schema.includesTrend() && metadata.getEpochYear() != properties.getEpochYear()) {
            throw new FeatureSchemaMismatchException("Année de référence du modèle " + metadata.getEpochYear()
                    + " différente de celle du pipeline " + properties.getEpochYear());
        }
    }

    // Multiplicateur uniforme dans [1 - v, 1 + v]
    double varianceMultiplier(Position position) {
        double v = properties.varianceFor(position);
        return (1.0 - v) + 2.0 * v * predictionRandom.nextDouble();
    }

    // Score "cosmétique", indépendant du modèle
    double drawConfidence() {
        double min = properties.getConfidenceMin();
        double max = properties.getConfidenceMax();
        return min + (max - min) * predictionRandom.nextDouble();
    }

    /**
     * Variation en % calculée sur la valeur arrondie publiée. null si les points actuels sont à 0.
     */
    public static Double percentChange(double current, double predicted) {
        if (current == 0.0) return null;
        double pct = (predicted - current) / current * 100.0;
        return Double.isFinite(pct) ? round(pct) : null;
    }

    static double round(double val) {
        return Math.round(val * 10.0) / 10.0;
    }
}
