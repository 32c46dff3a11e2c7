package com.tony.fantasyAnalytics.service;

import com.opencsv.bean.CsvBindByName;
import com.opencsv.bean.CsvToBeanBuilder;
import com.tony.fantasyAnalytics.exception.DataAcquisitionException;
import com.tony.fantasyAnalytics.exception.PipelineStage;
import com.tony.fantasyAnalytics.model.Position;
import com.tony.fantasyAnalytics.model.SeasonRecord;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Lecture de fichiers historiques au format Player,Position,Team,Fantasy_Points,Year.
 */
@Service
@Slf4j
public class SeasonCsvImportService {

    public List<SeasonRecord> read(InputStream input) {
        try (Reader reader = new InputStreamReader(input, StandardCharsets.UTF_8)) {
            return read(reader);
        } catch (IOException e) {
            throw new DataAcquisitionException(PipelineStage.IMPORT, "Lecture du fichier CSV impossible", e);
        }
    }

    public List<SeasonRecord> read(Reader reader) {
        List<SeasonCsvRow> rows;
        try {
            rows = new CsvToBeanBuilder<SeasonCsvRow>(reader)
                    .withType(SeasonCsvRow.class).withSeparator(',').withIgnoreLeadingWhiteSpace(true).build().parse();
        } catch (RuntimeException e) {
            throw new DataAcquisitionException(PipelineStage.IMPORT, "CSV illisible : " + e.getMessage(), e);
        }

        List<SeasonRecord> records = new ArrayList<>(rows.size());
        int skipped = 0;
        for (SeasonCsvRow row : rows) {
            Integer year = parseYear(row.getYear());
            if (row.getPlayer() == null || row.getPlayer().isBlank() || year == null) {
                skipped++;
                continue;
            }
            records.add(new SeasonRecord(row.getPlayer().trim(), Position.fromLabel(row.getPosition()),
                    row.getTeam() != null ? row.getTeam().trim() : null, parsePoints(row.getFantasyPoints()), year));
        }
        if (skipped > 0) log.warn("⚠️ Import CSV : {} lignes ignorées (joueur ou année manquant).", skipped);
        log.info("📥 Import CSV : {} lignes lues.", records.size());
        return records;
    }

    private Integer parseYear(String value) {
        if (value == null || value.isBlank()) return null;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private double parsePoints(String value) {
        try {
            if (value == null || value.trim().isEmpty()) return 0.0;
            double points = Double.parseDouble(value.trim().replace(",", "."));
            return Double.isFinite(points) && points >= 0 ? points : 0.0;
        } catch (NumberFormatException e) {
            return 0.0;
        }
    }

    @Data
    public static class SeasonCsvRow {
        @CsvBindByName(column = "Player") private String player;
        @CsvBindByName(column = "Position") private String position;
        @CsvBindByName(column = "Team") private String team;
        @CsvBindByName(column = "Fantasy_Points") private String fantasyPoints;
        @CsvBindByName(column = "Year") private String year;
    }
}
