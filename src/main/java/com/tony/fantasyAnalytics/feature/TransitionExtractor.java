package com.tony.fantasyAnalytics.feature;

import com.tony.fantasyAnalytics.model.Position;
import com.tony.fantasyAnalytics.model.SeasonRecord;
import com.tony.fantasyAnalytics.model.TransitionProvenance;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Stream;

/**
 * Parcourt l'historique chronologique de chaque joueur et émet une paire (saison i -> saison i+1)
 * par couple de saisons consécutives.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TransitionExtractor {

    private final FeatureBuilder featureBuilder;

    public List<TrainingExample> extract(Collection<SeasonRecord> records) {
        if (records == null || records.isEmpty()) return List.of();

        // TreeMap : ordre de sortie déterministe (joueurs triés par nom)
        Map<String, List<SeasonRecord>> byPlayer = new TreeMap<>();
        int dropped = 0;
        for (SeasonRecord r : records) {
            if (r == null || r.getPlayerName() == null || r.getPlayerName().isBlank() || r.getYear() == null) {
                dropped++;
                continue;
            }
            byPlayer.computeIfAbsent(r.getPlayerName().trim(), k -> new ArrayList<>()).add(r);
        }
        if (dropped > 0) {
            log.warn("⚠️ {} saisons ignorées (nom ou année manquant).", dropped);
        }

        // Aucune dépendance entre joueurs : parallélisable, l'ordre est conservé par toList()
        List<TrainingExample> examples = byPlayer.entrySet().parallelStream()
                .flatMap(e -> extractPlayer(e.getKey(), e.getValue()))
                .toList();

        log.info("🧩 {} exemples d'entraînement extraits pour {} joueurs.", examples.size(), byPlayer.size());
        return examples;
    }

    private Stream<TrainingExample> extractPlayer(String player, List<SeasonRecord> seasons) {
        List<SeasonRecord> history = dedupeByYear(seasons);
        if (history.size() < 2) return Stream.empty();

        // Poste figé sur la saison la plus récente
        Position position = history.get(history.size() - 1).safePosition();

        List<TrainingExample> out = new ArrayList<>(history.size() - 1);
        for (int i = 0; i < history.size() - 1; i++) {
            SeasonRecord current = history.get(i);
            SeasonRecord next = history.get(i + 1);
            if (next.getYear() != current.getYear() + 1) {
                log.debug("Saison manquante pour {} entre {} et {} : transition ignorée.", player, current.getYear(), next.getYear());
                continue;
            }
            FeatureVector features = featureBuilder.buildForTransition(current, next, position);
            out.add(new TrainingExample(features, next.safePoints(),
                    new TransitionProvenance(player, position, current.getYear(), next.getYear())));
        }
        return out.stream();
    }

    private List<SeasonRecord> dedupeByYear(List<SeasonRecord> seasons) {
        Map<Integer, SeasonRecord> byYear = new TreeMap<>();
        for (SeasonRecord s : seasons) {
            byYear.putIfAbsent(s.getYear(), s);
        }
        return new ArrayList<>(byYear.values());
    }
}
