package com.kickoff.tipping.controller;

import com.kickoff.tipping.service.AutoTipService;
import com.kickoff.tipping.service.FixtureSyncService;
import com.kickoff.tipping.service.RoundAssigner;
import com.kickoff.tipping.service.ScoreUpdateService;
import com.kickoff.tipping.service.SeasonClock;
import com.kickoff.tipping.service.SettingsService;
import com.kickoff.tipping.service.SyncBusyException;
import com.kickoff.tipping.service.SyncConfigurationException;
import com.kickoff.tipping.service.TipScoringService;
import com.kickoff.tipping.service.source.SourceFetchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/admin")
@CrossOrigin(origins = "*")
public class AdminSyncController {
    private static final Logger log = LoggerFactory.getLogger(AdminSyncController.class);

    private final FixtureSyncService syncService;
    private final ScoreUpdateService scoreUpdateService;
    private final AutoTipService autoTipService;
    private final TipScoringService scoringService;
    private final RoundAssigner roundAssigner;
    private final SettingsService settingsService;
    private final SeasonClock clock;

    public AdminSyncController(FixtureSyncService syncService,
                               ScoreUpdateService scoreUpdateService,
                               AutoTipService autoTipService,
                               TipScoringService scoringService,
                               RoundAssigner roundAssigner,
                               SettingsService settingsService,
                               SeasonClock clock) {
        this.syncService = syncService;
        this.scoreUpdateService = scoreUpdateService;
        this.autoTipService = autoTipService;
        this.scoringService = scoringService;
        this.roundAssigner = roundAssigner;
        this.settingsService = settingsService;
        this.clock = clock;
    }

    @PostMapping("/sync")
    public ResponseEntity<?> fullSync(@RequestParam(name = "season", required = false) Integer season,
                                      @RequestParam(name = "daysBack", required = false) Integer daysBack,
                                      @RequestParam(name = "prune", required = false) Boolean prune) {
        var summary = syncService.runFullSync(season, daysBack, prune);
        return ResponseEntity.ok(Map.of("success", true, "summary", summary));
    }

    @PostMapping("/scores/catch-up")
    public ResponseEntity<?> catchUp(@RequestParam(name = "season", required = false) Integer season,
                                     @RequestParam(name = "minAgeHours", required = false) Double minAgeHours,
                                     @RequestParam(name = "daysBack", required = false) Integer daysBack) {
        var summary = scoreUpdateService.runCatchUp(season, minAgeHours, daysBack);
        return ResponseEntity.ok(Map.of("success", true, "summary", summary));
    }

    @PostMapping("/auto-tips")
    public ResponseEntity<?> autoTips(@RequestParam(name = "season", required = false) Integer season,
                                      @RequestParam(name = "round", required = false) Integer round,
                                      @RequestParam(name = "userId", required = false) Long userId,
                                      @RequestParam(name = "includeAdmin", defaultValue = "false") boolean includeAdmin) {
        int added = autoTipService.applyAutomaticTips(clock.resolveSeason(season), round, userId, includeAdmin, clock.now());
        int rescored = added > 0 ? scoringService.rescoreAll() : 0;
        return ResponseEntity.ok(Map.of("success", true, "autoUnderdogTipsAdded", added, "tipsRescored", rescored));
    }

    @PostMapping("/rescore")
    public ResponseEntity<?> rescore() {
        return ResponseEntity.ok(Map.of("success", true, "tipsRescored", scoringService.rescoreAll()));
    }

    @PostMapping("/rounds/assign")
    public ResponseEntity<?> assignRounds() {
        return ResponseEntity.ok(Map.of("success", true, "roundsAssigned", roundAssigner.assignRounds()));
    }

    @GetMapping("/sync/last")
    public Map<String, Object> lastSync() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("lastSyncAt", settingsService.get(SettingsService.LAST_SYNC_AT).orElse(null));
        out.put("lastSyncSummary", settingsService.get(SettingsService.LAST_SYNC_SUMMARY).orElse(null));
        return out;
    }

    @ExceptionHandler({IllegalArgumentException.class, SyncConfigurationException.class})
    public ResponseEntity<Map<String, Object>> badRequest(RuntimeException ex) {
        return error(HttpStatus.BAD_REQUEST, ex);
    }

    @ExceptionHandler(SyncBusyException.class)
    public ResponseEntity<Map<String, Object>> busy(SyncBusyException ex) {
        return error(HttpStatus.CONFLICT, ex);
    }

    // Every required source failed, or a source failed where the pass cannot continue
    @ExceptionHandler({SourceFetchException.class, IllegalStateException.class})
    public ResponseEntity<Map<String, Object>> upstreamFailure(RuntimeException ex) {
        log.warn("[SYNC] admin request failed: {}", ex.getMessage());
        return error(HttpStatus.BAD_GATEWAY, ex);
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, RuntimeException ex) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("error", ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage());
        return ResponseEntity.status(status).body(body);
    }
}
