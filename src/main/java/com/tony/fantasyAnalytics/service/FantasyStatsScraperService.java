package com.tony.fantasyAnalytics.service;

import com.tony.fantasyAnalytics.config.PipelineProperties;
import com.tony.fantasyAnalytics.exception.DataAcquisitionException;
import com.tony.fantasyAnalytics.exception.PipelineStage;
import com.tony.fantasyAnalytics.model.Position;
import com.tony.fantasyAnalytics.model.SeasonRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Récupère les points fantasy d'une saison depuis la table "fantasy" de pro-football-reference.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FantasyStatsScraperService {

    private final PipelineProperties properties;

    public List<SeasonRecord> scrapeSeason(int year) {
        String url = String.format(properties.getScraper().getUrlTemplate(), year);
        Document doc;
        try {
            doc = Jsoup.connect(url)
                    .timeout(properties.getScraper().getTimeoutMs())
                    .userAgent("Mozilla/5.0")
                    .get();
        } catch (IOException e) {
            throw new DataAcquisitionException(PipelineStage.SCRAPE, "Échec du téléchargement de " + url, e);
        }
        List<SeasonRecord> records = parseFantasyTable(doc, year);
        log.info("✅ Saison {} : {} joueurs récupérés.", year, records.size());
        return records;
    }

    /**
     * Les lignes d'en-tête répétées (classe "thead") sont ignorées ; des points illisibles valent 0.
     */
    public List<SeasonRecord> parseFantasyTable(Document doc, int year) {
        Element table = doc.selectFirst("table#fantasy");
        if (table == null) {
            throw new DataAcquisitionException(PipelineStage.SCRAPE,
                    "Table 'fantasy' introuvable pour la saison " + year, null);
        }

        List<SeasonRecord> records = new ArrayList<>();
        Elements rows = table.select("tbody tr");
        for (Element row : rows) {
            if (row.hasClass("thead")) continue;

            Element playerCell = row.selectFirst("td[data-stat=player]");
            if (playerCell == null || playerCell.text().isBlank()) continue;

            String position = textOf(row, "fantasy_pos");
            String team = textOf(row, "team");
            double points = parseDoubleSafe(textOf(row, "fantasy_points"));

            records.add(new SeasonRecord(cleanName(playerCell.text()), Position.fromLabel(position), team, points, year));
        }
        return records;
    }

    private String textOf(Element row, String stat) {
        Element cell = row.selectFirst("td[data-stat=" + stat + "]");
        return cell != null ? cell.text().trim() : "";
    }

    // PFR ajoute "*" (Pro Bowl) et "+" (All-Pro) au nom
    private String cleanName(String raw) {
        return raw.replaceAll("[*+]", "").trim();
    }

    private double parseDoubleSafe(String value) {
        try {
            if (value == null || value.trim().isEmpty()) return 0.0;
            return Double.parseDouble(value.replace(",", "."));
        } catch (NumberFormatException e) {
            return 0.0;
        }
    }
}
