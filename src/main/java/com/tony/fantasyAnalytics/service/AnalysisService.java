package com.tony.fantasyAnalytics.service;

import com.tony.fantasyAnalytics.config.PipelineProperties;
import com.tony.fantasyAnalytics.model.Position;
import com.tony.fantasyAnalytics.model.PredictionRecord;
import com.tony.fantasyAnalytics.model.SeasonRecord;
import com.tony.fantasyAnalytics.model.dto.HistoricalAnalysis;
import com.tony.fantasyAnalytics.model.dto.PlayerMovement;
import com.tony.fantasyAnalytics.model.dto.PredictionAnalysis;
import com.tony.fantasyAnalytics.model.dto.TopScorer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.DoubleSummaryStatistics;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Agrégations en lecture seule sur un jeu de prédictions et sur l'historique.
 * Aucune interaction avec le modèle ; une entrée vide donne une structure vide.
 */
@Service
@RequiredArgsConstructor
public class AnalysisService {

    private static final int TOP_TEAMS = 10;
    private static final int TOP_SCORERS_PER_YEAR = 5;

    private final PipelineProperties properties;

    public PredictionAnalysis analyzePredictions(List<PredictionRecord> predictions) {
        if (predictions == null || predictions.isEmpty()) return PredictionAnalysis.empty();

        List<PredictionRecord> valid = predictions.stream().filter(Objects::nonNull).toList();

        // Les Percent_Change indéfinis (points actuels à 0) ne participent ni aux moyennes ni aux classements
        List<PredictionRecord> withChange = valid.stream().filter(p -> p.getPercentChange() != null).toList();

        List<PlayerMovement> breakout = withChange.stream()
                .sorted(Comparator.comparing(PredictionRecord::getPercentChange).reversed())
                .limit(properties.getTopMovers())
                .map(PlayerMovement::of)
                .toList();
        List<PlayerMovement> risk = withChange.stream()
                .sorted(Comparator.comparing(PredictionRecord::getPercentChange))
                .limit(properties.getTopMovers())
                .map(PlayerMovement::of)
                .toList();

        PredictionAnalysis.AgeAnalysis age = new PredictionAnalysis.AgeAnalysis(
                meanByPosition(valid, PredictionRecord::getPosition, PredictionRecord::getAge),
                meanByPosition(valid, PredictionRecord::getPosition, PredictionRecord::getExperience),
                mean(valid, PredictionRecord::getAge),
                mean(valid, PredictionRecord::getExperience));

        PredictionAnalysis.ConfidenceAnalysis confidence = new PredictionAnalysis.ConfidenceAnalysis(
                mean(valid, PredictionRecord::getConfidence),
                meanByPosition(valid, PredictionRecord::getPosition, PredictionRecord::getConfidence));

        return PredictionAnalysis.builder()
                .positionBreakdown(countByPosition(valid, PredictionRecord::getPosition))
                .avgPredictedChangeByPosition(meanByPosition(withChange, PredictionRecord::getPosition, PredictionRecord::getPercentChange))
                .breakoutCandidates(new ArrayList<>(breakout))
                .riskCandidates(new ArrayList<>(risk))
                .ageAnalysis(age)
                .confidenceAnalysis(confidence)
                .build();
    }

    public HistoricalAnalysis analyzeHistorical(List<SeasonRecord> history) {
        if (history == null || history.isEmpty()) return HistoricalAnalysis.empty();

        List<SeasonRecord> valid = history.stream().filter(r -> r != null && r.getYear() != null).toList();

        Map<String, Long> teamCounts = valid.stream()
                .filter(r -> r.getTeam() != null && !r.getTeam().isBlank())
                .collect(Collectors.groupingBy(SeasonRecord::getTeam, Collectors.counting()));
        Map<String, Long> topTeams = new LinkedHashMap<>();
        teamCounts.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue().reversed().thenComparing(Map.Entry.comparingByKey()))
                .limit(TOP_TEAMS)
                .forEach(e -> topTeams.put(e.getKey(), e.getValue()));

        Map<Integer, Double> avgByYear = new TreeMap<>(valid.stream()
                .collect(Collectors.groupingBy(SeasonRecord::getYear, Collectors.averagingDouble(SeasonRecord::safePoints))));
        avgByYear.replaceAll((y, v) -> round(v));

        Map<Integer, List<TopScorer>> topScorers = new TreeMap<>();
        valid.stream()
                .collect(Collectors.groupingBy(SeasonRecord::getYear))
                .forEach((year, records) -> topScorers.put(year, records.stream()
                        .sorted(Comparator.comparingDouble(SeasonRecord::safePoints).reversed())
                        .limit(TOP_SCORERS_PER_YEAR)
                        .map(r -> new TopScorer(r.getPlayerName(), r.safePosition(), r.getTeam(), r.safePoints()))
                        .collect(Collectors.toCollection(ArrayList::new))));

        Map<Position, Map<Integer, Double>> trend = new EnumMap<>(Position.class);
        valid.stream()
                .collect(Collectors.groupingBy(SeasonRecord::safePosition))
                .forEach((position, records) -> {
                    Map<Integer, Double> perYear = new TreeMap<>(records.stream()
                            .collect(Collectors.groupingBy(SeasonRecord::getYear, Collectors.averagingDouble(SeasonRecord::safePoints))));
                    perYear.replaceAll((y, v) -> round(v));
                    trend.put(position, perYear);
                });

        return HistoricalAnalysis.builder()
                .totalRecords(valid.size())
                .yearsCovered(new ArrayList<>(avgByYear.keySet()))
                .positions(countByPosition(valid, SeasonRecord::safePosition))
                .teams(topTeams)
                .avgPointsByYear(avgByYear)
                .avgPointsByPosition(meanByPosition(valid, SeasonRecord::safePosition, SeasonRecord::safePoints))
                .topScorersByYear(topScorers)
                .pointsTrendByPosition(trend)
                .build();
    }

    private static <T> Map<Position, Long> countByPosition(List<T> items, Function<T, Position> position) {
        Map<Position, Long> counts = new EnumMap<>(Position.class);
        for (T item : items) {
            Position p = position.apply(item);
            counts.merge(p != null ? p : Position.OTHER, 1L, Long::sum);
        }
        return counts;
    }

    // Moyenne arrondie à 0.1 par poste ; les valeurs nulles sont ignorées
    private static <T, N extends Number> Map<Position, Double> meanByPosition(List<T> items, Function<T, Position> position,
                                                                             Function<T, N> value) {
        Map<Position, List<Double>> buckets = new EnumMap<>(Position.class);
        for (T item : items) {
            N v = value.apply(item);
            if (v == null) continue;
            Position p = position.apply(item);
            buckets.computeIfAbsent(p != null ? p : Position.OTHER, k -> new ArrayList<>()).add(v.doubleValue());
        }
        Map<Position, Double> means = new EnumMap<>(Position.class);
        buckets.forEach((p, values) -> means.put(p, round(values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0))));
        return means;
    }

    private static <T, N extends Number> Double mean(List<T> items, Function<T, N> value) {
        DoubleSummaryStatistics stats = items.stream().map(value).filter(Objects::nonNull)
                .mapToDouble(Number::doubleValue).summaryStatistics();
        return stats.getCount() == 0 ? null : round(stats.getAverage());
    }

    static double round(double val) {
        return Math.round(val * 10.0) / 10.0;
    }
}
