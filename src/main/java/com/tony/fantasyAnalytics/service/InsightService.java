package com.tony.fantasyAnalytics.service;

import com.tony.fantasyAnalytics.config.PipelineProperties;
import com.tony.fantasyAnalytics.model.Position;
import com.tony.fantasyAnalytics.model.PredictionRecord;
import com.tony.fantasyAnalytics.model.SeasonRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.TreeMap;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
public class InsightService {

    private final PipelineProperties properties;

    /**
     * Génère les faits marquants à partir des prédictions et de l'historique. Entrées vides : liste vide.
     */
    public List<String> generateInsights(List<PredictionRecord> predictions, List<SeasonRecord> history) {
        List<String> insights = new ArrayList<>();

        if (predictions != null && !predictions.isEmpty()) {
            insights.add(dominantPosition(predictions));
            insights.add(biggestMover(predictions, true));
            insights.add(biggestMover(predictions, false));
            insights.add(averageAge(predictions));
        }
        if (history != null && !history.isEmpty()) {
            insights.add(recentTrend(history));
        }

        return insights.stream()
                .filter(Objects::nonNull)
                .collect(Collectors.toCollection(ArrayList::new));
    }

    private String dominantPosition(List<PredictionRecord> predictions) {
        Map<Position, Long> counts = new EnumMap<>(Position.class);
        predictions.forEach(p -> counts.merge(p.getPosition() != null ? p.getPosition() : Position.OTHER, 1L, Long::sum));

        // À égalité, l'ordre de l'enum tranche
        Map.Entry<Position, Long> top = null;
        for (Map.Entry<Position, Long> e : counts.entrySet()) {
            if (top == null || e.getValue() > top.getValue()) top = e;
        }
        return "📊 Les meilleures prédictions sont dominées par les " + top.getKey() + " (" + top.getValue() + " joueurs).";
    }

    private String biggestMover(List<PredictionRecord> predictions, boolean gainer) {
        Comparator<PredictionRecord> byChange = Comparator.comparing(PredictionRecord::getPercentChange);
        Optional<PredictionRecord> mover = predictions.stream()
                .filter(p -> p.getPercentChange() != null)
                .max(gainer ? byChange : byChange.reversed());
        if (mover.isEmpty()) return null;

        PredictionRecord p = mover.get();
        String change = String.format(Locale.ROOT, "%+.1f", p.getPercentChange());
        return gainer
                ? "🚀 Plus gros potentiel de progression : " + p.getPlayer() + " (" + p.getPosition() + ") avec " + change + " %."
                : "⚠️ Joueur le plus à risque : " + p.getPlayer() + " (" + p.getPosition() + ") avec " + change + " %.";
    }

    private String averageAge(List<PredictionRecord> predictions) {
        OptionalDouble avg = predictions.stream()
                .map(PredictionRecord::getAge)
                .filter(Objects::nonNull)
                .mapToDouble(Integer::doubleValue)
                .average();
        if (avg.isEmpty()) return null;
        return String.format(Locale.ROOT, "🎂 Âge moyen des joueurs prédits : %.1f ans.", avg.getAsDouble());
    }

    /**
     * Compare la moyenne de points de la première et de la dernière saison de la fenêtre récente.
     */
    private String recentTrend(List<SeasonRecord> history) {
        Map<Integer, Double> avgByYear = new TreeMap<>(history.stream()
                .filter(r -> r.getYear() != null)
                .collect(Collectors.groupingBy(SeasonRecord::getYear, Collectors.averagingDouble(SeasonRecord::safePoints))));
        if (avgByYear.size() < 2) return null;

        List<Integer> years = new ArrayList<>(avgByYear.keySet());
        List<Integer> recent = years.subList(Math.max(0, years.size() - properties.getTrendWindowYears()), years.size());
        double first = avgByYear.get(recent.get(0));
        double last = avgByYear.get(recent.get(recent.size() - 1));

        if (last > first) {
            return "📈 Les points fantasy sont en hausse sur les " + recent.size() + " dernières saisons.";
        } else if (last < first) {
            return "📉 Les points fantasy sont en baisse sur les " + recent.size() + " dernières saisons.";
        }
        return "➖ Les points fantasy sont stables sur les " + recent.size() + " dernières saisons.";
    }
}
