package com.kickoff.tipping.service;

import com.kickoff.tipping.model.AppUser;
import com.kickoff.tipping.model.Fixture;
import com.kickoff.tipping.model.Tip;
import com.kickoff.tipping.repository.AppUserRepository;
import com.kickoff.tipping.repository.TipRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Service
public class TipService {
    private static final Logger log = LoggerFactory.getLogger(TipService.class);

    private final TipRepository tipRepository;
    private final AppUserRepository userRepository;
    private final RoundService roundService;
    private final AutoTipService autoTipService;

    public TipService(TipRepository tipRepository,
                      AppUserRepository userRepository,
                      RoundService roundService,
                      AutoTipService autoTipService) {
        this.tipRepository = tipRepository;
        this.userRepository = userRepository;
        this.roundService = roundService;
        this.autoTipService = autoTipService;
    }

    public record SubmitResult(int saved, int autoFilled, int blocked) {}

    /**
     * Saves a user's picks for one round. Picks naming neither team, or a fixture outside the round,
     * are ignored; picks on locked fixtures are counted as blocked. Locked fixtures the user never
     * tipped are then auto-filled for that user.
     *
     * @param picks fixture id to picked team name
     */
    @Transactional
    public SubmitResult submitTips(Long userId, int seasonYear, int roundNumber, Map<Long, String> picks, Instant now) {
        AppUser user = userRepository.findById(userId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown user " + userId));
        List<Fixture> fixtures = roundService.roundFixtures(roundNumber, seasonYear);
        int saved = 0;
        int blocked = 0;
        for (Fixture fixture : fixtures) {
            String pick = picks.get(fixture.getId());
            if (pick == null) continue;
            if (!pick.equals(fixture.getHomeTeam()) && !pick.equals(fixture.getAwayTeam())) continue;
            if (roundService.isFixtureLocked(fixture, now)) {
                blocked++;
                continue;
            }
            Tip tip = tipRepository.findByUser_IdAndFixture_Id(userId, fixture.getId())
                    .orElseGet(() -> new Tip(user, fixture, pick, now));
            tip.setTipTeam(pick);
            tip.setUpdatedAt(now);
            tipRepository.save(tip);
            saved++;
        }
        int autoFilled = autoTipService.applyAutomaticTips(seasonYear, roundNumber, userId, false, now);
        if (blocked > 0) {
            log.info("User {} round {}: {} pick(s) rejected after lock", userId, roundNumber, blocked);
        }
        return new SubmitResult(saved, autoFilled, blocked);
    }

    @Transactional(readOnly = true)
    public Map<Long, String> userRoundPicks(Long userId, int seasonYear, int roundNumber) {
        Map<Long, String> out = new java.util.LinkedHashMap<>();
        for (Tip t : tipRepository.findUserRoundTips(userId, seasonYear, roundNumber)) {
            out.put(t.getFixture().getId(), t.getTipTeam());
        }
        return out;
    }
}
