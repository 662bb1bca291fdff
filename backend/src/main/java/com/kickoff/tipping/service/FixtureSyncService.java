package com.kickoff.tipping.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kickoff.tipping.dto.FixtureCandidate;
import com.kickoff.tipping.model.Fixture;
import com.kickoff.tipping.repository.FixtureRepository;
import com.kickoff.tipping.repository.TipRepository;
import com.kickoff.tipping.service.source.HistoricalOddsSource;
import com.kickoff.tipping.service.source.OddsApiClient;
import com.kickoff.tipping.service.source.ScoresSource;
import com.kickoff.tipping.service.source.SourcePull;
import com.kickoff.tipping.service.source.UpcomingOddsSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Full season sync: pull every source, reconcile into one fixture per match, write the result, then
 * assign rounds, auto-tip locked fixtures and rescore. Only the upcoming-odds and history feeds are
 * required; the run fails when both of them fail.
 */
@Service
public class FixtureSyncService {
    private static final Logger log = LoggerFactory.getLogger(FixtureSyncService.class);

    private final OddsApiClient oddsApiClient;
    private final UpcomingOddsSource upcomingSource;
    private final ScoresSource scoresSource;
    private final HistoricalOddsSource historicalSource;
    private final DrawReconciler drawReconciler;
    private final FixtureMerger merger;
    private final FixtureRepository fixtureRepository;
    private final TipRepository tipRepository;
    private final RoundAssigner roundAssigner;
    private final AutoTipService autoTipService;
    private final TipScoringService scoringService;
    private final SyncArchiveService archiveService;
    private final SettingsService settingsService;
    private final SeasonClock clock;
    private final ObjectMapper objectMapper;
    private final TransactionTemplate tx;
    private final SyncRunGuard guard;
    private final Executor fetchExecutor;
    private final int defaultDaysBack;
    private final boolean defaultPrune;

    public FixtureSyncService(OddsApiClient oddsApiClient,
                              UpcomingOddsSource upcomingSource,
                              ScoresSource scoresSource,
                              HistoricalOddsSource historicalSource,
                              DrawReconciler drawReconciler,
                              FixtureMerger merger,
                              FixtureRepository fixtureRepository,
                              TipRepository tipRepository,
                              RoundAssigner roundAssigner,
                              AutoTipService autoTipService,
                              TipScoringService scoringService,
                              SyncArchiveService archiveService,
                              SettingsService settingsService,
                              SeasonClock clock,
                              ObjectMapper objectMapper,
                              PlatformTransactionManager transactionManager,
                              SyncRunGuard guard,
                              @Qualifier("sourceFetchExecutor") Executor fetchExecutor,
                              @Value("${tipping.sync.default-days-back:30}") int defaultDaysBack,
                              @Value("${tipping.sync.prune-other-seasons:true}") boolean defaultPrune) {
        this.oddsApiClient = oddsApiClient;
        this.upcomingSource = upcomingSource;
        this.scoresSource = scoresSource;
        this.historicalSource = historicalSource;
        this.drawReconciler = drawReconciler;
        this.merger = merger;
        this.fixtureRepository = fixtureRepository;
        this.tipRepository = tipRepository;
        this.roundAssigner = roundAssigner;
        this.autoTipService = autoTipService;
        this.scoringService = scoringService;
        this.archiveService = archiveService;
        this.settingsService = settingsService;
        this.clock = clock;
        this.objectMapper = objectMapper;
        this.tx = new TransactionTemplate(transactionManager);
        this.guard = guard;
        this.fetchExecutor = fetchExecutor;
        this.defaultDaysBack = defaultDaysBack;
        this.defaultPrune = defaultPrune;
    }

    public record SyncSummary(int seasonYear,
                              int inserted,
                              int updated,
                              int totalMerged,
                              int prunedOtherSeasonFixtures,
                              int roundsAssigned,
                              int autoUnderdogTipsAdded,
                              int tipsRescored,
                              String rawDownloadFile,
                              Map<String, Integer> bySourceCounts,
                              DrawReconciler.DrawEnrichment drawEnrichment,
                              Map<String, String> sourceErrors) {}

    private record UpsertResult(int inserted, int updated, int pruned, int rounds, int autoTips, int rescored) {}

    /**
     * @param seasonYear null for the current local season
     * @param daysBack   null for {@code tipping.sync.default-days-back}
     * @param prune      null for {@code tipping.sync.prune-other-seasons}
     * @throws SyncConfigurationException when no API key is configured
     * @throws SyncBusyException          when another sync or catch-up is running
     * @throws IllegalStateException      when every required source failed
     */
    public SyncSummary runFullSync(Integer seasonYear, Integer daysBack, Boolean prune) {
        oddsApiClient.requireApiKey();
        return guard.tryRun("full-sync", () -> doSync(clock.resolveSeason(seasonYear),
                        daysBack != null ? daysBack : defaultDaysBack,
                        prune != null ? prune : defaultPrune))
                .orElseThrow(() -> new SyncBusyException(guard.getCurrentRun()));
    }

    private SyncSummary doSync(int season, int daysBack, boolean prune) {
        log.info("[SYNC] full sync starting season={} daysBack={} prune={}", season, daysBack, prune);
        CompletableFuture<SourcePull> upcoming = pullAsync(UpcomingOddsSource.SOURCE, upcomingSource::fetch);
        CompletableFuture<SourcePull> scores = pullAsync(ScoresSource.SOURCE, () -> scoresSource.fetch(daysBack));
        CompletableFuture<SourcePull> history = pullAsync(HistoricalOddsSource.SOURCE, () -> historicalSource.fetch(season));
        List<SourcePull> pulls = List.of(upcoming.join(), scores.join(), history.join());

        Map<String, String> errors = new LinkedHashMap<>();
        for (SourcePull p : pulls) {
            if (p.isFailed()) errors.put(p.source(), String.valueOf(p.details().get("error")));
        }
        if (upcoming.join().isFailed() && history.join().isFailed()) {
            throw new IllegalStateException("Sync failed, no required source succeeded: " + errors);
        }

        Map<String, Integer> bySource = new LinkedHashMap<>();
        for (SourcePull p : pulls) bySource.put(p.source(), p.events().size());

        Map<String, FixtureCandidate> merged = merger.mergeAll(pulls);
        DrawReconciler.DrawEnrichment draw = drawReconciler.reconcile(merged, season);

        Instant now = clock.now();
        UpsertResult r = tx.execute(status -> persist(merged, season, prune, now));

        Path archive = archiveService.write(season, oddsApiClient.getSportKey(), clock.localNowIso(), pulls, merged.size());
        SyncSummary summary = new SyncSummary(season, r.inserted(), r.updated(), merged.size(), r.pruned(), r.rounds(),
                r.autoTips(), r.rescored(), archive == null ? null : archive.toString(), bySource, draw, errors);
        recordLastSync(summary, now);
        log.info("[SYNC] season={} inserted={} updated={} merged={} pruned={} rounds={} autoTips={} rescored={}",
                season, r.inserted(), r.updated(), merged.size(), r.pruned(), r.rounds(), r.autoTips(), r.rescored());
        return summary;
    }

    private UpsertResult persist(Map<String, FixtureCandidate> merged, int season, boolean prune, Instant now) {
        Map<String, Fixture> stored = new HashMap<>();
        if (!merged.isEmpty()) {
            for (Fixture f : fixtureRepository.findBySourceEventIdIn(merged.keySet())) stored.put(f.getSourceEventId(), f);
        }
        int inserted = 0;
        int updated = 0;
        List<Fixture> toSave = new ArrayList<>();
        for (FixtureCandidate candidate : merged.values()) {
            Fixture existing = stored.get(candidate.getSourceEventId());
            if (existing == null) {
                Fixture f = new Fixture();
                merger.applyTo(f, candidate, now);
                toSave.add(f);
                inserted++;
            } else {
                merger.applyTo(existing, merger.merge(merger.toCandidate(existing), candidate), now);
                toSave.add(existing);
                updated++;
            }
        }
        fixtureRepository.saveAll(toSave);

        int pruned = 0;
        if (prune) {
            tipRepository.deleteForOtherSeasons(season);
            pruned = fixtureRepository.deleteOtherSeasons(season);
        }
        int rounds = roundAssigner.assignRounds();
        int autoTips = autoTipService.applyAutomaticTips(season, null, null, false, now);
        int rescored = scoringService.rescoreAll();
        return new UpsertResult(inserted, updated, pruned, rounds, autoTips, rescored);
    }

    private CompletableFuture<SourcePull> pullAsync(String source, Supplier<SourcePull> fetch) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return fetch.get();
            } catch (RuntimeException ex) {
                log.warn("[SYNC] source {} failed: {}", source, ex.getMessage());
                return SourcePull.failed(source, ex.getMessage());
            }
        }, fetchExecutor);
    }

    private void recordLastSync(SyncSummary summary, Instant now) {
        settingsService.put(SettingsService.LAST_SYNC_AT, clock.localNowIso(), now);
        try {
            settingsService.put(SettingsService.LAST_SYNC_SUMMARY, objectMapper.writeValueAsString(summary), now);
        } catch (JsonProcessingException ex) {
            log.warn("[SYNC] could not serialize sync summary: {}", ex.getMessage());
        }
    }
}
