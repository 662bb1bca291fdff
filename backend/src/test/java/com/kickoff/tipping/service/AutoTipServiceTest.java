package com.kickoff.tipping.service;

import com.kickoff.tipping.model.AppUser;
import com.kickoff.tipping.model.Fixture;
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
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@ActiveProfiles("test")
@Import(AutoTipService.class)
class AutoTipServiceTest {

    private static final Instant KICKOFF = Instant.parse("2025-03-06T09:00:00Z");
    private static final Instant NOW = Instant.parse("2025-03-06T08:56:00Z");

    @Autowired private FixtureRepository fixtureRepository;
    @Autowired private AppUserRepository userRepository;
    @Autowired private TipRepository tipRepository;
    @Autowired private AutoTipService autoTipService;

    private Fixture fixture(String id, Instant kickoff, Double homePrice, Double awayPrice) {
        Fixture f = new Fixture(id, kickoff, "Melbourne Storm", "Penrith Panthers");
        f.setSeasonYear(2025);
        f.setRoundNumber(1);
        f.setHomePrice(homePrice);
        f.setAwayPrice(awayPrice);
        return fixtureRepository.save(f);
    }

    @Test
    void underdogIsHigherPriceWithTiesAndGapsGoingHome() {
        Fixture f = new Fixture("x", KICKOFF, "Home", "Away");
        f.setHomePrice(1.5);
        f.setAwayPrice(2.6);
        assertThat(AutoTipService.pickUnderdog(f)).isEqualTo("Away");
        f.setAwayPrice(1.5);
        assertThat(AutoTipService.pickUnderdog(f)).isEqualTo("Home");
        f.setHomePrice(null);
        assertThat(AutoTipService.pickUnderdog(f)).isEqualTo("Away");
        f.setAwayPrice(null);
        assertThat(AutoTipService.pickUnderdog(f)).isEqualTo("Home");
    }

    @Test
    void fillsLockedFixturesOnlyForUsersWhoExistedAtLock() {
        Fixture locked = fixture("e1", KICKOFF, 1.40, 3.10);
        fixture("e2", Instant.parse("2025-03-07T09:00:00Z"), 1.40, 3.10);
        AppUser early = userRepository.save(new AppUser("early@test", "Early", false, Instant.parse("2025-01-01T00:00:00Z")));
        AppUser late = userRepository.save(new AppUser("late@test", "Late", false, Instant.parse("2025-03-06T08:55:00.001Z")));
        AppUser admin = userRepository.save(new AppUser("admin@test", "Admin", true, Instant.parse("2025-01-01T00:00:00Z")));

        int added = autoTipService.applyAutomaticTips(2025, null, null, false, NOW);

        assertThat(added).isEqualTo(1);
        Tip tip = tipRepository.findByUser_IdAndFixture_Id(early.getId(), locked.getId()).orElseThrow();
        assertThat(tip.getTipTeam()).isEqualTo("Penrith Panthers");
        assertThat(tipRepository.existsByUser_IdAndFixture_Id(late.getId(), locked.getId())).isFalse();
        assertThat(tipRepository.existsByUser_IdAndFixture_Id(admin.getId(), locked.getId())).isFalse();
    }

    @Test
    void neverOverwritesAndIsIdempotent() {
        Fixture locked = fixture("e1", KICKOFF, 1.40, 3.10);
        AppUser manual = userRepository.save(new AppUser("manual@test", "Manual", false, Instant.parse("2025-01-01T00:00:00Z")));
        AppUser silent = userRepository.save(new AppUser("silent@test", "Silent", false, Instant.parse("2025-01-01T00:00:00Z")));
        tipRepository.save(new Tip(manual, locked, "Melbourne Storm", Instant.parse("2025-03-05T00:00:00Z")));

        assertThat(autoTipService.applyAutomaticTips(2025, 1, null, false, NOW)).isEqualTo(1);
        assertThat(autoTipService.applyAutomaticTips(2025, 1, null, false, NOW)).isZero();

        assertThat(tipRepository.findByUser_IdAndFixture_Id(manual.getId(), locked.getId()).orElseThrow().getTipTeam())
                .isEqualTo("Melbourne Storm");
        assertThat(tipRepository.findByUser_IdAndFixture_Id(silent.getId(), locked.getId()).orElseThrow().getTipTeam())
                .isEqualTo("Penrith Panthers");
    }

    @Test
    void filtersByUserAndOptionallyIncludesAdmins() {
        fixture("e1", KICKOFF, 2.0, 2.0);
        AppUser one = userRepository.save(new AppUser("one@test", "One", false, Instant.parse("2025-01-01T00:00:00Z")));
        userRepository.save(new AppUser("two@test", "Two", false, Instant.parse("2025-01-01T00:00:00Z")));
        userRepository.save(new AppUser("admin@test", "Admin", true, Instant.parse("2025-01-01T00:00:00Z")));

        assertThat(autoTipService.applyAutomaticTips(2025, null, one.getId(), false, NOW)).isEqualTo(1);
        assertThat(autoTipService.applyAutomaticTips(2025, null, null, true, NOW)).isEqualTo(2);
        List<Tip> all = tipRepository.findAll();
        assertThat(all).extracting(Tip::getTipTeam).containsOnly("Melbourne Storm");
    }

    @Test
    void lockBoundaryIsInclusive() {
        fixture("e1", KICKOFF, 1.5, 2.5);
        userRepository.save(new AppUser("u@test", "U", false, Instant.parse("2025-01-01T00:00:00Z")));

        assertThat(autoTipService.applyAutomaticTips(2025, null, null, false, Instant.parse("2025-03-06T08:54:59.999Z"))).isZero();
        assertThat(autoTipService.applyAutomaticTips(2025, null, null, false, Instant.parse("2025-03-06T08:55:00Z"))).isEqualTo(1);
    }
}
