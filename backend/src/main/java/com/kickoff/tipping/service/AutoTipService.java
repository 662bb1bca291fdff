package com.kickoff.tipping.service;

import com.kickoff.tipping.model.AppUser;
import com.kickoff.tipping.model.Fixture;
import com.kickoff.tipping.model.Tip;
import com.kickoff.tipping.repository.AppUserRepository;
import com.kickoff.tipping.repository.FixtureRepository;
import com.kickoff.tipping.repository.TipRepository;
import com.kickoff.tipping.util.TipLocks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Fills in a tip on the underdog for every eligible user who let a fixture lock without picking.
 * Running it again inserts nothing new.
 */
@Service
public class AutoTipService {
    private static final Logger log = LoggerFactory.getLogger(AutoTipService.class);

    private final FixtureRepository fixtureRepository;
    private final AppUserRepository userRepository;
    private final TipRepository tipRepository;
    private final int lockMinutes;

    public AutoTipService(FixtureRepository fixtureRepository,
                          AppUserRepository userRepository,
                          TipRepository tipRepository,
                          @Value("${tipping.lock-minutes:5}") int lockMinutes) {
        this.fixtureRepository = fixtureRepository;
        this.userRepository = userRepository;
        this.tipRepository = tipRepository;
        this.lockMinutes = lockMinutes;
    }

    /**
     * Higher decimal price is the underdog; ties go home. With one price known, that side is picked;
     * with none, home.
     */
    public static String pickUnderdog(Fixture f) {
        Double home = f.getHomePrice();
        Double away = f.getAwayPrice();
        if (home != null && away != null) {
            return away > home ? f.getAwayTeam() : f.getHomeTeam();
        }
        if (home != null) return f.getHomeTeam();
        if (away != null) return f.getAwayTeam();
        return f.getHomeTeam();
    }

    /**
     * @param seasonYear  null for every season
     * @param roundNumber null for every round
     * @param userId      null for every eligible user
     * @return number of tips inserted
     */
    @Transactional
    public int applyAutomaticTips(Integer seasonYear, Integer roundNumber, Long userId, boolean includeAdmin, Instant now) {
        Instant lockedBefore = now.plus(Duration.ofMinutes(Math.max(0, lockMinutes)));
        List<Fixture> candidates = fixtureRepository.findLockCandidates(seasonYear, roundNumber, lockedBefore);
        List<Tip> toInsert = new ArrayList<>();
        for (Fixture fixture : candidates) {
            if (!TipLocks.isLocked(fixture.getKickoff(), now, lockMinutes)) continue;
            Instant deadline = TipLocks.lockDeadline(fixture.getKickoff(), lockMinutes);
            String underdog = pickUnderdog(fixture);
            for (AppUser user : userRepository.findAutoTipEligible(deadline, includeAdmin, userId)) {
                if (tipRepository.existsByUser_IdAndFixture_Id(user.getId(), fixture.getId())) continue;
                toInsert.add(new Tip(user, fixture, underdog, now));
            }
        }
        if (!toInsert.isEmpty()) {
            tipRepository.saveAll(toInsert);
            log.info("[AUTO_TIP] inserted {} underdog tips (season={}, round={}, user={})", toInsert.size(), seasonYear, roundNumber, userId);
        }
        return toInsert.size();
    }
}
