package com.kickoff.tipping.service;

import com.kickoff.tipping.model.AppUser;
import com.kickoff.tipping.model.Fixture;
import com.kickoff.tipping.model.FixtureStatus;
import com.kickoff.tipping.model.Tip;
import com.kickoff.tipping.repository.AppUserRepository;
import com.kickoff.tipping.repository.FixtureRepository;
import com.kickoff.tipping.repository.TipRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@ActiveProfiles("test")
@Import(TipScoringService.class)
class TipScoringServiceTest {

    private static final Instant T = Instant.parse("2025-03-01T00:00:00Z");

    @Autowired private FixtureRepository fixtureRepository;
    @Autowired private AppUserRepository userRepository;
    @Autowired private TipRepository tipRepository;
    @Autowired private TipScoringService scoringService;

    private Fixture fixture(String id, FixtureStatus status, String winner) {
        Fixture f = new Fixture(id, Instant.parse("2025-03-06T09:00:00Z"), "Storm", "Panthers");
        f.setSeasonYear(2025);
        f.setStatus(status);
        f.setWinner(winner);
        return fixtureRepository.save(f);
    }

    @Test
    void marksCorrectPicksAndLeavesPendingAlone() {
        AppUser u = userRepository.save(new AppUser("u@test", "U", false, T));
        Fixture won = fixture("e1", FixtureStatus.COMPLETED, "Storm");
        Fixture drawn = fixture("e2", FixtureStatus.COMPLETED, Fixture.WINNER_DRAW);
        Fixture unknown = fixture("e3", FixtureStatus.COMPLETED, Fixture.WINNER_UNKNOWN);
        Fixture pending = fixture("e4", FixtureStatus.SCHEDULED, null);
        Tip right = tipRepository.save(new Tip(u, won, "Storm", T));
        Tip onDraw = tipRepository.save(new Tip(u, drawn, "Storm", T));
        Tip onUnknown = tipRepository.save(new Tip(u, unknown, "Panthers", T));
        Tip open = tipRepository.save(new Tip(u, pending, "Storm", T));

        int visited = scoringService.rescoreAll();

        assertThat(visited).isEqualTo(3);
        assertThat(tipRepository.findById(right.getId()).orElseThrow().getPointsAwarded()).isEqualTo(1);
        assertThat(tipRepository.findById(onDraw.getId()).orElseThrow().getPointsAwarded()).isZero();
        assertThat(tipRepository.findById(onUnknown.getId()).orElseThrow().getPointsAwarded()).isZero();
        assertThat(tipRepository.findById(open.getId()).orElseThrow().getPointsAwarded()).isNull();
    }

    @Test
    void correctedResultFlipsPoints() {
        AppUser u = userRepository.save(new AppUser("u@test", "U", false, T));
        Fixture f = fixture("e1", FixtureStatus.COMPLETED, "Storm");
        Tip tip = tipRepository.save(new Tip(u, f, "Panthers", T));
        scoringService.rescoreAll();
        assertThat(tipRepository.findById(tip.getId()).orElseThrow().getPointsAwarded()).isZero();

        f.setWinner("Panthers");
        fixtureRepository.save(f);
        scoringService.rescoreAll();

        assertThat(tipRepository.findById(tip.getId()).orElseThrow().getPointsAwarded()).isEqualTo(1);
    }
}
