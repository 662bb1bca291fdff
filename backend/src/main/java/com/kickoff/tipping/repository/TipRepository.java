package com.kickoff.tipping.repository;

import com.kickoff.tipping.model.Tip;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface TipRepository extends JpaRepository<Tip, Long> {

    Optional<Tip> findByUser_IdAndFixture_Id(Long userId, Long fixtureId);

    boolean existsByUser_IdAndFixture_Id(Long userId, Long fixtureId);

    List<Tip> findByFixture_IdIn(Collection<Long> fixtureIds);

    @Query("select t from Tip t join fetch t.fixture f where t.user.id = :userId and f.seasonYear = :season and f.roundNumber = :round")
    List<Tip> findUserRoundTips(@Param("userId") Long userId, @Param("season") Integer seasonYear, @Param("round") Integer roundNumber);

    // Tips whose fixture has a final winner recorded
    @Query("select t from Tip t join fetch t.fixture f where f.status = com.kickoff.tipping.model.FixtureStatus.COMPLETED and f.winner is not null")
    List<Tip> findScorable();

    long countByUser_Id(Long userId);

    long countByUser_IdAndPointsAwarded(Long userId, Integer pointsAwarded);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from Tip t where t.fixture.id in (select f.id from Fixture f where f.seasonYear <> :season)")
    int deleteForOtherSeasons(@Param("season") Integer seasonYear);
}
