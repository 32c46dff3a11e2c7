package com.tony.fantasyAnalytics.repository;

import com.tony.fantasyAnalytics.model.SeasonRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface SeasonRecordRepository extends JpaRepository<SeasonRecord, Long> {

    List<SeasonRecord> findByYear(Integer year);

    List<SeasonRecord> findAllByOrderByPlayerNameAscYearAsc();

    @Query("SELECT MAX(s.year) FROM SeasonRecord s")
    Optional<Integer> findLatestYear();

    // Ré-import d'une saison : on remplace entièrement les lignes existantes
    @Modifying
    @Query("DELETE FROM SeasonRecord s WHERE s.year IN :years")
    int deleteByYearIn(@Param("years") Collection<Integer> years);
}
