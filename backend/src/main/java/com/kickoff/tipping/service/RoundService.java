package com.kickoff.tipping.service;

import com.kickoff.tipping.model.AppUser;
import com.kickoff.tipping.model.Fixture;
import com.kickoff.tipping.model.Tip;
import com.kickoff.tipping.repository.AppUserRepository;
import com.kickoff.tipping.repository.FixtureRepository;
import com.kickoff.tipping.repository.TipRepository;
import com.kickoff.tipping.util.TipLocks;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Service
@Transactional(readOnly = true)
public class RoundService {

    private final FixtureRepository fixtureRepository;
    private final TipRepository tipRepository;
    private final AppUserRepository userRepository;
    private final SeasonClock clock;
    private final int lockMinutes;

    public RoundService(FixtureRepository fixtureRepository,
                        TipRepository tipRepository,
                        AppUserRepository userRepository,
                        SeasonClock clock,
                        @Value("${tipping.lock-minutes:5}") int lockMinutes) {
        this.fixtureRepository = fixtureRepository;
        this.tipRepository = tipRepository;
        this.userRepository = userRepository;
        this.clock = clock;
        this.lockMinutes = lockMinutes;
    }

    public record Participant(Long userId, String displayName, boolean admin, int tipsSubmitted, boolean hasSubmitted) {}

    public record TipView(String tipTeam, Integer pointsAwarded) {}

    public record RoundTipsheet(int seasonYear,
                                int roundNumber,
                                List<Fixture> fixtures,
                                List<Participant> participants,
                                Map<Long, Map<Long, TipView>> tipsByUserFixture,
                                boolean allSubmitted,
                                int totalRequired,
                                boolean roundLocked) {}

    /** Rounds of the season in ascending order; every round on record when {@code seasonYear} is null. */
    public List<Integer> roundNumbers(Integer seasonYear) {
        return seasonYear == null ? fixtureRepository.findDistinctRounds() : fixtureRepository.findDistinctRounds(seasonYear);
    }

    /**
     * Round of the next fixture kicking off at or after now; otherwise the season's lowest round;
     * otherwise the round of the earliest fixture on record. Null when no fixture has a round.
     */
    public Integer currentRound(Integer seasonYear) {
        int season = clock.resolveSeason(seasonYear);
        return fixtureRepository.findFirstBySeasonYearAndRoundNumberNotNullAndKickoffGreaterThanEqualOrderByKickoffAsc(season, clock.now())
                .or(() -> fixtureRepository.findFirstBySeasonYearAndRoundNumberNotNullOrderByRoundNumberAsc(season))
                .or(fixtureRepository::findFirstByRoundNumberNotNullOrderByKickoffAsc)
                .map(Fixture::getRoundNumber)
                .orElse(null);
    }

    public List<Fixture> roundFixtures(int roundNumber, Integer seasonYear) {
        return seasonYear == null
                ? fixtureRepository.findByRoundNumberOrderByKickoffAsc(roundNumber)
                : fixtureRepository.findBySeasonYearAndRoundNumberOrderByKickoffAsc(seasonYear, roundNumber);
    }

    /** Derived view: a round is locked once its earliest fixture is. Per-fixture locks still decide tip acceptance. */
    public boolean isRoundLocked(List<Fixture> fixtures, Instant now) {
        Instant earliest = fixtures.stream().map(Fixture::getKickoff).min(Instant::compareTo).orElse(null);
        return earliest != null && TipLocks.isLocked(earliest, now, lockMinutes);
    }

    public boolean isFixtureLocked(Fixture fixture, Instant now) {
        return TipLocks.isLocked(fixture.getKickoff(), now, lockMinutes);
    }

    public RoundTipsheet tipsheet(int seasonYear, int roundNumber, boolean includeAdmin) {
        List<Fixture> fixtures = roundFixtures(roundNumber, seasonYear);
        if (fixtures.isEmpty()) {
            return new RoundTipsheet(seasonYear, roundNumber, fixtures, List.of(), Map.of(), false, 0, false);
        }
        List<Long> fixtureIds = fixtures.stream().map(Fixture::getId).collect(Collectors.toList());
        Map<Long, Map<Long, TipView>> tips = new HashMap<>();
        for (Tip t : tipRepository.findByFixture_IdIn(fixtureIds)) {
            tips.computeIfAbsent(t.getUser().getId(), k -> new LinkedHashMap<>())
                    .put(t.getFixture().getId(), new TipView(t.getTipTeam(), t.getPointsAwarded()));
        }

        List<AppUser> users = includeAdmin ? userRepository.findAllByOrderByDisplayNameAsc() : userRepository.findByAdminFalseOrderByDisplayNameAsc();
        if (users.isEmpty() && !includeAdmin) {
            // nobody but admins registered yet
            users = userRepository.findAllByOrderByDisplayNameAsc();
        }
        int required = fixtures.size();
        List<Participant> participants = new ArrayList<>();
        for (AppUser u : users) {
            int submitted = tips.getOrDefault(u.getId(), Map.of()).size();
            participants.add(new Participant(u.getId(), u.getDisplayName(), u.isAdmin(), submitted, submitted >= required));
        }
        boolean allSubmitted = !participants.isEmpty() && participants.stream().allMatch(Participant::hasSubmitted);
        return new RoundTipsheet(seasonYear, roundNumber, fixtures, participants, tips, allSubmitted, required,
                isRoundLocked(fixtures, clock.now()));
    }
}
