package com.kickoff.tipping.service;

import com.kickoff.tipping.model.Fixture;
import com.kickoff.tipping.repository.FixtureRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Gives every stored fixture a round. Within a season, fixtures are walked in kickoff order and a
 * gap of at least {@code tipping.round-gap-hours} since the previous kickoff opens the next round.
 * Rounds already set (e.g. from the official draw) are kept and push the counter forward.
 */
@Service
public class RoundAssigner {
    private static final Logger log = LoggerFactory.getLogger(RoundAssigner.class);

    private final FixtureRepository fixtureRepository;
    private final long roundGapHours;

    public RoundAssigner(FixtureRepository fixtureRepository,
                         @Value("${tipping.round-gap-hours:60}") long roundGapHours) {
        this.fixtureRepository = fixtureRepository;
        this.roundGapHours = roundGapHours;
    }

    @Transactional
    public int assignRounds() {
        List<Fixture> all = fixtureRepository.findAllByOrderBySeasonYearAscKickoffAsc();
        int changed = assign(all, roundGapHours);
        if (changed > 0) {
            fixtureRepository.saveAll(all);
            log.info("[SYNC] round assignment updated {} fixtures", changed);
        }
        return changed;
    }

    /**
     * Assigns in place. {@code fixtures} must be ordered by season then kickoff.
     * @return number of fixtures whose season or round changed
     */
    static int assign(List<Fixture> fixtures, long gapHours) {
        Map<Integer, Instant> lastKickoff = new HashMap<>();
        Map<Integer, Integer> roundTracker = new HashMap<>();
        Duration gap = Duration.ofHours(gapHours);
        int changed = 0;
        for (Fixture f : fixtures) {
            Integer season = f.getSeasonYear() != null ? f.getSeasonYear() : f.getKickoff().atZone(ZoneOffset.UTC).getYear();
            Integer round;
            if (f.getRoundNumber() != null) {
                round = f.getRoundNumber();
                roundTracker.put(season, Math.max(roundTracker.getOrDefault(season, 1), round));
            } else {
                round = roundTracker.getOrDefault(season, 1);
                Instant prior = lastKickoff.get(season);
                if (prior != null && Duration.between(prior, f.getKickoff()).compareTo(gap) >= 0) {
                    round = round + 1;
                }
                roundTracker.put(season, round);
            }
            lastKickoff.put(season, f.getKickoff());
            if (!Objects.equals(season, f.getSeasonYear()) || !Objects.equals(round, f.getRoundNumber())) {
                f.setSeasonYear(season);
                f.setRoundNumber(round);
                changed++;
            }
        }
        return changed;
    }
}
