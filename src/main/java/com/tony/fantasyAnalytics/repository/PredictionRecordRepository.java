package com.tony.fantasyAnalytics.repository;

import com.tony.fantasyAnalytics.model.PredictionRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface PredictionRecordRepository extends JpaRepository<PredictionRecord, Long> {

    List<PredictionRecord> findBySeasonOrderByPredictedNextYearDesc(Integer season);

    @Query("SELECT MAX(p.season) FROM PredictionRecord p")
    Optional<Integer> findLatestSeason();

    @Modifying
    @Query("DELETE FROM PredictionRecord p WHERE p.season = :season")
    int deleteBySeason(@Param("season") Integer season);
}
