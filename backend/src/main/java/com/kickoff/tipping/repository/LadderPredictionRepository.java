package com.kickoff.tipping.repository;

import com.kickoff.tipping.model.LadderPrediction;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface LadderPredictionRepository extends JpaRepository<LadderPrediction, Long> {

    List<LadderPrediction> findByUserIdAndSeasonYearOrderByPredictedPositionAsc(Long userId, Integer seasonYear);

    List<LadderPrediction> findBySeasonYearOrderByUserIdAscPredictedPositionAsc(Integer seasonYear);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from LadderPrediction p where p.userId = :userId and p.seasonYear = :season")
    int deleteForUserSeason(@Param("userId") Long userId, @Param("season") Integer seasonYear);
}
