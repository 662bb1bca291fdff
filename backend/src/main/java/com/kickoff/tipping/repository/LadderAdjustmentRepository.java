package com.kickoff.tipping.repository;

import com.kickoff.tipping.model.LadderAdjustment;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface LadderAdjustmentRepository extends JpaRepository<LadderAdjustment, Long> {

    boolean existsByUserIdAndSeasonYearAndRoundNumber(Long userId, Integer seasonYear, Integer roundNumber);

    List<LadderAdjustment> findByUserIdAndSeasonYearOrderByRoundNumberAsc(Long userId, Integer seasonYear);
}
