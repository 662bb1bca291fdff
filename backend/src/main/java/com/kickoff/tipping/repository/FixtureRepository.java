package com.kickoff.tipping.repository;

import com.kickoff.tipping.model.Fixture;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface FixtureRepository extends JpaRepository<Fixture, Long> {

    Optional<Fixture> findBySourceEventId(String sourceEventId);

    List<Fixture> findBySourceEventIdIn(Collection<String> sourceEventIds);

    List<Fixture> findBySeasonYearOrderByKickoffAsc(Integer seasonYear);

    // Round assignment walks every season in kickoff order
    List<Fixture> findAllByOrderBySeasonYearAscKickoffAsc();

    List<Fixture> findBySeasonYearAndRoundNumberOrderByKickoffAsc(Integer seasonYear, Integer roundNumber);

    List<Fixture> findByRoundNumberOrderByKickoffAsc(Integer roundNumber);

    // Optional filters: a null season or round matches every fixture
    @Query("select f from Fixture f where (:season is null or f.seasonYear = :season) " +
            "and (:round is null or f.roundNumber = :round) and f.kickoff <= :lockedBefore order by f.kickoff asc")
    List<Fixture> findLockCandidates(@Param("season") Integer seasonYear,
                                     @Param("round") Integer roundNumber,
                                     @Param("lockedBefore") Instant lockedBefore);

    // Kicked off long enough ago but still missing a usable result
    @Query("select f from Fixture f where f.seasonYear = :season and f.kickoff <= :cutoff and (" +
            "f.status <> com.kickoff.tipping.model.FixtureStatus.COMPLETED " +
            "or f.homeScore is null or f.awayScore is null or f.winner is null or f.winner = 'unknown') " +
            "order by f.kickoff asc")
    List<Fixture> findPendingResults(@Param("season") Integer seasonYear, @Param("cutoff") Instant cutoff);

    @Query("select distinct f.roundNumber from Fixture f where f.seasonYear = :season and f.roundNumber is not null order by f.roundNumber asc")
    List<Integer> findDistinctRounds(@Param("season") Integer seasonYear);

    @Query("select distinct f.roundNumber from Fixture f where f.roundNumber is not null order by f.roundNumber asc")
    List<Integer> findDistinctRounds();

    Optional<Fixture> findFirstBySeasonYearAndRoundNumberNotNullAndKickoffGreaterThanEqualOrderByKickoffAsc(Integer seasonYear, Instant from);

    Optional<Fixture> findFirstBySeasonYearAndRoundNumberNotNullOrderByRoundNumberAsc(Integer seasonYear);

    Optional<Fixture> findFirstByRoundNumberNotNullOrderByKickoffAsc();

    // Rounds where every fixture has a final result
    @Query("select f.roundNumber from Fixture f where f.seasonYear = :season and f.roundNumber is not null " +
            "group by f.roundNumber having sum(case when f.status = com.kickoff.tipping.model.FixtureStatus.COMPLETED then 0 else 1 end) = 0 " +
            "order by f.roundNumber asc")
    List<Integer> findCompletedRounds(@Param("season") Integer seasonYear);

    @Query("select count(f) from Fixture f where f.seasonYear <> :season")
    long countOtherSeasons(@Param("season") Integer seasonYear);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from Fixture f where f.seasonYear <> :season")
    int deleteOtherSeasons(@Param("season") Integer seasonYear);
}
