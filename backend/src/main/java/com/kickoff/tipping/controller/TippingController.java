package com.kickoff.tipping.controller;

import com.kickoff.tipping.dto.FixtureDTO;
import com.kickoff.tipping.model.Fixture;
import com.kickoff.tipping.model.LadderAdjustment;
import com.kickoff.tipping.service.LadderPredictionService;
import com.kickoff.tipping.service.RoundService;
import com.kickoff.tipping.service.SeasonClock;
import com.kickoff.tipping.service.TipService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/tipping")
@CrossOrigin(origins = "*")
public class TippingController {

    private final RoundService roundService;
    private final TipService tipService;
    private final LadderPredictionService predictionService;
    private final SeasonClock clock;

    public TippingController(RoundService roundService,
                             TipService tipService,
                             LadderPredictionService predictionService,
                             SeasonClock clock) {
        this.roundService = roundService;
        this.tipService = tipService;
        this.predictionService = predictionService;
        this.clock = clock;
    }

    public record PredictionRequest(List<String> teams) {}

    public record AdjustmentRequest(Integer round, String team, String direction) {}

    @GetMapping("/rounds")
    public Map<String, Object> rounds(@RequestParam(name = "season", required = false) Integer season) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("rounds", roundService.roundNumbers(season));
        out.put("currentRound", roundService.currentRound(season));
        return out;
    }

    @GetMapping("/rounds/{round}/fixtures")
    public Map<String, Object> roundFixtures(@PathVariable("round") int round,
                                             @RequestParam(name = "season", required = false) Integer season) {
        Instant now = clock.now();
        List<Fixture> fixtures = roundService.roundFixtures(round, clock.resolveSeason(season));
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("roundNumber", round);
        out.put("roundLocked", roundService.isRoundLocked(fixtures, now));
        out.put("fixtures", toDtos(fixtures, now));
        return out;
    }

    @GetMapping("/rounds/{round}/tipsheet")
    public Map<String, Object> tipsheet(@PathVariable("round") int round,
                                        @RequestParam(name = "season", required = false) Integer season,
                                        @RequestParam(name = "includeAdmin", defaultValue = "false") boolean includeAdmin) {
        RoundService.RoundTipsheet sheet = roundService.tipsheet(clock.resolveSeason(season), round, includeAdmin);
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("seasonYear", sheet.seasonYear());
        out.put("roundNumber", sheet.roundNumber());
        out.put("roundLocked", sheet.roundLocked());
        out.put("fixtures", toDtos(sheet.fixtures(), clock.now()));
        out.put("participants", sheet.participants());
        out.put("tips", sheet.tipsByUserFixture());
        out.put("allSubmitted", sheet.allSubmitted());
        out.put("totalRequired", sheet.totalRequired());
        return out;
    }

    @GetMapping("/users/{userId}/rounds/{round}/tips")
    public Map<Long, String> userTips(@PathVariable("userId") Long userId,
                                      @PathVariable("round") int round,
                                      @RequestParam(name = "season", required = false) Integer season) {
        return tipService.userRoundPicks(userId, clock.resolveSeason(season), round);
    }

    @PostMapping("/users/{userId}/rounds/{round}/tips")
    public TipService.SubmitResult submitTips(@PathVariable("userId") Long userId,
                                              @PathVariable("round") int round,
                                              @RequestParam(name = "season", required = false) Integer season,
                                              @RequestBody Map<Long, String> picks) {
        return tipService.submitTips(userId, clock.resolveSeason(season), round, picks == null ? Map.of() : picks, clock.now());
    }

    @GetMapping("/users/{userId}/ladder-prediction")
    public Map<String, Object> prediction(@PathVariable("userId") Long userId,
                                          @RequestParam(name = "season", required = false) Integer season) {
        int year = clock.resolveSeason(season);
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("seasonYear", year);
        out.put("open", predictionService.isOpen(year, clock.now()));
        out.put("deadline", clock.predictionDeadline(year));
        out.put("teams", predictionService.getPrediction(userId, year));
        out.put("availableAdjustmentRounds", predictionService.availableAdjustmentRounds(userId, year));
        return out;
    }

    @PutMapping("/users/{userId}/ladder-prediction")
    public Map<String, Object> savePrediction(@PathVariable("userId") Long userId,
                                              @RequestParam(name = "season", required = false) Integer season,
                                              @RequestBody PredictionRequest req) {
        int year = clock.resolveSeason(season);
        int saved = predictionService.savePrediction(userId, year, req == null ? null : req.teams(), clock.now());
        return Map.of("success", true, "saved", saved);
    }

    @PostMapping("/users/{userId}/ladder-prediction/adjustments")
    public Map<String, Object> adjust(@PathVariable("userId") Long userId,
                                      @RequestParam(name = "season", required = false) Integer season,
                                      @RequestBody AdjustmentRequest req) {
        if (req == null || req.round() == null || req.team() == null || req.direction() == null) {
            throw new IllegalArgumentException("round, team and direction are required");
        }
        LadderAdjustment.Direction direction;
        try {
            direction = LadderAdjustment.Direction.valueOf(req.direction().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("direction must be up or down");
        }
        List<String> teams = predictionService.adjust(userId, clock.resolveSeason(season), req.round(), req.team(), direction, clock.now());
        return Map.of("success", true, "teams", teams);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> badRequest(IllegalArgumentException ex) {
        return ResponseEntity.badRequest().body(Map.of("success", false, "error", String.valueOf(ex.getMessage())));
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<Map<String, Object>> conflict(IllegalStateException ex) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("success", false, "error", String.valueOf(ex.getMessage())));
    }

    private List<FixtureDTO> toDtos(List<Fixture> fixtures, Instant now) {
        return fixtures.stream()
                .map(f -> FixtureDTO.from(f, roundService.isFixtureLocked(f, now)))
                .collect(Collectors.toList());
    }
}
