package com.kickoff.tipping.controller;

import com.kickoff.tipping.dto.LadderStandingDTO;
import com.kickoff.tipping.dto.LeaderboardEntryDTO;
import com.kickoff.tipping.service.LadderPredictionService;
import com.kickoff.tipping.service.LadderService;
import com.kickoff.tipping.service.LeaderboardService;
import com.kickoff.tipping.service.SeasonClock;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/standings")
@CrossOrigin(origins = "*")
public class StandingsController {

    private final LadderService ladderService;
    private final LeaderboardService leaderboardService;
    private final LadderPredictionService predictionService;
    private final SeasonClock clock;

    public StandingsController(LadderService ladderService,
                               LeaderboardService leaderboardService,
                               LadderPredictionService predictionService,
                               SeasonClock clock) {
        this.ladderService = ladderService;
        this.leaderboardService = leaderboardService;
        this.predictionService = predictionService;
        this.clock = clock;
    }

    @GetMapping("/ladder")
    public List<LadderStandingDTO> ladder(@RequestParam(name = "season", required = false) Integer season) {
        return ladderService.computeLadder(clock.resolveSeason(season));
    }

    @GetMapping("/leaderboard")
    public List<LeaderboardEntryDTO> leaderboard(@RequestParam(name = "season", required = false) Integer season) {
        return leaderboardService.seasonLeaderboard(clock.resolveSeason(season));
    }

    @GetMapping("/leaderboard/rounds/{round}")
    public List<LeaderboardEntryDTO> roundLeaderboard(@PathVariable("round") int round,
                                                      @RequestParam(name = "season", required = false) Integer season) {
        return leaderboardService.roundLeaderboard(clock.resolveSeason(season), round);
    }

    @GetMapping("/ladder-predictions")
    public List<LadderPredictionService.PredictionScore> predictionLeaderboard(@RequestParam(name = "season", required = false) Integer season) {
        return predictionService.leaderboard(clock.resolveSeason(season));
    }

    @GetMapping("/dashboard/{userId}")
    public LeaderboardService.DashboardCounts dashboard(@PathVariable("userId") Long userId) {
        return leaderboardService.dashboardCounts(userId);
    }
}
