package com.tony.fantasyAnalytics.service;

import com.tony.fantasyAnalytics.model.Position;
import com.tony.fantasyAnalytics.model.SeasonRecord;
import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.io.StringReader;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SeasonCsvImportServiceTest {

    private final SeasonCsvImportService importService = new SeasonCsvImportService();

    @Test
    void readsHistoricalFeedFormat() {
        String csv = """
                Player,Position,Team,Fantasy_Points,Year
                Tyreek Hill,WR,MIA,376.4,2023
                Travis Kelce,te,KC,,2023
                Harrison Butker,K,KC,150,2023
                ,QB,NYG,10,2023
                Unknown Year,QB,NYG,10,
                Bad Points,RB,DAL,n/a,2022
                """;

        List<SeasonRecord> records = importService.read(new StringReader(csv));

        assertThat(records).extracting(SeasonRecord::getPlayerName)
                .containsExactly("Tyreek Hill", "Travis Kelce", "Harrison Butker", "Bad Points");
        assertThat(records.get(0).getFantasyPoints()).isEqualTo(376.4);
        assertThat(records.get(1).getPosition()).isEqualTo(Position.TE);
        assertThat(records.get(1).getFantasyPoints()).isZero();
        assertThat(records.get(2).getPosition()).isEqualTo(Position.OTHER);
        assertThat(records.get(3).getFantasyPoints()).isZero();
        assertThat(records.get(3).getYear()).isEqualTo(2022);
    }

    @Test
    void embeddedSampleIsReadable() throws Exception {
        try (InputStream input = getClass().getClassLoader().getResourceAsStream("data/sample-seasons.csv")) {
            List<SeasonRecord> records = importService.read(input);

            assertThat(records).hasSize(80);
            assertThat(records).extracting(SeasonRecord::getYear).containsOnly(2021, 2022, 2023, 2024);
        }
    }
}
