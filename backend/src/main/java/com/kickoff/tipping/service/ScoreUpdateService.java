package com.kickoff.tipping.service;

import com.kickoff.tipping.dto.FixtureCandidate;
import com.kickoff.tipping.model.Fixture;
import com.kickoff.tipping.model.FixtureStatus;
import com.kickoff.tipping.repository.FixtureRepository;
import com.kickoff.tipping.service.source.OddsApiClient;
import com.kickoff.tipping.service.source.ScoresSource;
import com.kickoff.tipping.service.source.SourcePull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Catch-up pass for results: finds fixtures that should have finished by now but have no usable
 * result, asks only the scores feed for them, then auto-tips and rescores when anything moved.
 */
@Service
public class ScoreUpdateService {
    private static final Logger log = LoggerFactory.getLogger(ScoreUpdateService.class);

    static final int FALLBACK_DAYS_BACK = 14;

    private final OddsApiClient oddsApiClient;
    private final ScoresSource scoresSource;
    private final FixtureRepository fixtureRepository;
    private final FixtureMerger merger;
    private final AutoTipService autoTipService;
    private final TipScoringService scoringService;
    private final SeasonClock clock;
    private final SyncRunGuard guard;
    private final TransactionTemplate tx;
    private final double defaultMinAgeHours;

    public ScoreUpdateService(OddsApiClient oddsApiClient,
                              ScoresSource scoresSource,
                              FixtureRepository fixtureRepository,
                              FixtureMerger merger,
                              AutoTipService autoTipService,
                              TipScoringService scoringService,
                              SeasonClock clock,
                              SyncRunGuard guard,
                              PlatformTransactionManager transactionManager,
                              @Value("${tipping.scores.auto-update.min-age-hours:2.0}") double defaultMinAgeHours) {
        this.oddsApiClient = oddsApiClient;
        this.scoresSource = scoresSource;
        this.fixtureRepository = fixtureRepository;
        this.merger = merger;
        this.autoTipService = autoTipService;
        this.scoringService = scoringService;
        this.clock = clock;
        this.guard = guard;
        this.tx = new TransactionTemplate(transactionManager);
        this.defaultMinAgeHours = defaultMinAgeHours;
    }

    public record ScoreUpdateSummary(int seasonYear,
                                     int pendingDueFixtures,
                                     int apiCompletedEvents,
                                     int fixturesUpdated,
                                     int autoUnderdogTipsAdded,
                                     int tipsRescored,
                                     int daysBackRequested,
                                     Map<String, Object> sourceDetails,
                                     boolean skipped) {
        static ScoreUpdateSummary nothingDue(int season) {
            return new ScoreUpdateSummary(season, 0, 0, 0, 0, 0, 0, Map.of(), false);
        }

        static ScoreUpdateSummary busy(int season) {
            return new ScoreUpdateSummary(season, 0, 0, 0, 0, 0, 0, Map.of(), true);
        }
    }

    /**
     * @param seasonYear  null for the current local season
     * @param minAgeHours null for {@code tipping.scores.auto-update.min-age-hours}
     * @param daysBack    lower bound for the scores window, null for 1
     * @return a skipped summary when a full sync or another pass is in progress
     */
    public ScoreUpdateSummary runCatchUp(Integer seasonYear, Double minAgeHours, Integer daysBack) {
        oddsApiClient.requireApiKey();
        int season = clock.resolveSeason(seasonYear);
        double minAge = Math.max(0.0, minAgeHours != null ? minAgeHours : defaultMinAgeHours);
        return guard.tryRun("score-catch-up", () -> doCatchUp(season, minAge, daysBack))
                .orElseGet(() -> {
                    log.info("[SCORES] catch-up skipped, {} in progress", guard.getCurrentRun());
                    return ScoreUpdateSummary.busy(season);
                });
    }

    private ScoreUpdateSummary doCatchUp(int season, double minAgeHours, Integer daysBack) {
        Instant now = clock.now();
        Instant cutoff = now.minusMillis(Math.round(minAgeHours * 3_600_000d));
        List<Fixture> pending = fixtureRepository.findPendingResults(season, cutoff);
        if (pending.isEmpty()) return ScoreUpdateSummary.nothingDue(season);

        int requested = Math.max(inferDaysBack(pending.get(0).getKickoff(), now), daysBack == null ? 1 : daysBack);
        SourcePull pull = scoresSource.fetch(requested);

        Map<String, FixtureCandidate> completed = new HashMap<>();
        for (FixtureCandidate c : pull.fixtures()) {
            if (c.getSeasonYear() == null || c.getSeasonYear() != season) continue;
            if (!c.isCompleted()) continue;
            if (c.getWinner() == null || Fixture.WINNER_UNKNOWN.equals(c.getWinner())) continue;
            completed.put(c.getSourceEventId(), merger.merge(completed.get(c.getSourceEventId()), c));
        }

        int[] counts = tx.execute(status -> {
            int updates = 0;
            for (Fixture f : pending) {
                FixtureCandidate result = completed.get(f.getSourceEventId());
                if (result == null) continue;
                f.setStatus(FixtureStatus.COMPLETED);
                f.setHomeScore(result.getHomeScore());
                f.setAwayScore(result.getAwayScore());
                f.setWinner(result.getWinner());
                f.setUpdatedAt(now);
                updates++;
            }
            if (updates > 0) fixtureRepository.saveAll(pending);
            int autoTips = autoTipService.applyAutomaticTips(season, null, null, false, now);
            int rescored = (updates > 0 || autoTips > 0) ? scoringService.rescoreAll() : 0;
            return new int[]{updates, autoTips, rescored};
        });

        return new ScoreUpdateSummary(season, pending.size(), completed.size(), counts[0], counts[1], counts[2],
                requested, pull.details(), false);
    }

    /** Whole days since the oldest pending kickoff, plus two days of slack. */
    static int inferDaysBack(Instant oldestKickoff, Instant now) {
        if (oldestKickoff == null) return FALLBACK_DAYS_BACK;
        long days = Duration.between(oldestKickoff, now).toDays();
        return (int) Math.max(1, days + 2);
    }
}
