package com.kickoff.tipping.service;

import com.kickoff.tipping.dto.LadderStandingDTO;
import com.kickoff.tipping.model.AppUser;
import com.kickoff.tipping.model.LadderAdjustment;
import com.kickoff.tipping.model.LadderPrediction;
import com.kickoff.tipping.repository.AppUserRepository;
import com.kickoff.tipping.repository.FixtureRepository;
import com.kickoff.tipping.repository.LadderAdjustmentRepository;
import com.kickoff.tipping.repository.LadderPredictionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Pre-season ladder prediction game. A prediction is a full team order saved before the deadline;
 * after each completed round a user may move one team one place (swapping with its neighbour).
 * Score is the summed positional distance from the actual ladder, lower is better.
 */
@Service
public class LadderPredictionService {
    private static final Logger log = LoggerFactory.getLogger(LadderPredictionService.class);

    private final LadderPredictionRepository predictionRepository;
    private final LadderAdjustmentRepository adjustmentRepository;
    private final FixtureRepository fixtureRepository;
    private final AppUserRepository userRepository;
    private final LadderService ladderService;
    private final SeasonClock clock;

    public LadderPredictionService(LadderPredictionRepository predictionRepository,
                                   LadderAdjustmentRepository adjustmentRepository,
                                   FixtureRepository fixtureRepository,
                                   AppUserRepository userRepository,
                                   LadderService ladderService,
                                   SeasonClock clock) {
        this.predictionRepository = predictionRepository;
        this.adjustmentRepository = adjustmentRepository;
        this.fixtureRepository = fixtureRepository;
        this.userRepository = userRepository;
        this.ladderService = ladderService;
        this.clock = clock;
    }

    public record PredictionScore(Long userId, String displayName, int score) {}

    public boolean isOpen(int seasonYear, Instant now) {
        return now.isBefore(clock.predictionDeadline(seasonYear));
    }

    /**
     * Replaces the user's prediction for the season with {@code orderedTeams} (position 1 first).
     * @return number of teams saved
     */
    @Transactional
    public int savePrediction(Long userId, int seasonYear, List<String> orderedTeams, Instant now) {
        if (!isOpen(seasonYear, now)) {
            throw new IllegalStateException("Ladder predictions for " + seasonYear + " are closed");
        }
        if (orderedTeams == null || orderedTeams.isEmpty()) {
            throw new IllegalArgumentException("Prediction must list at least one team");
        }
        Set<String> seen = new HashSet<>();
        List<LadderPrediction> rows = new ArrayList<>();
        int pos = 1;
        for (String raw : orderedTeams) {
            String team = raw == null ? "" : raw.trim();
            if (team.isEmpty()) throw new IllegalArgumentException("Blank team name at position " + pos);
            if (!seen.add(team)) throw new IllegalArgumentException("Team listed twice: " + team);
            rows.add(new LadderPrediction(userId, seasonYear, team, pos++, now));
        }
        predictionRepository.deleteForUserSeason(userId, seasonYear);
        predictionRepository.saveAll(rows);
        log.info("User {} saved ladder prediction for {} ({} teams)", userId, seasonYear, rows.size());
        return rows.size();
    }

    @Transactional(readOnly = true)
    public List<String> getPrediction(Long userId, int seasonYear) {
        return predictionRepository.findByUserIdAndSeasonYearOrderByPredictedPositionAsc(userId, seasonYear)
                .stream().map(LadderPrediction::getTeamName).collect(Collectors.toList());
    }

    /** Completed rounds the user has not yet spent an adjustment on. */
    @Transactional(readOnly = true)
    public List<Integer> availableAdjustmentRounds(Long userId, int seasonYear) {
        Set<Integer> used = adjustmentRepository.findByUserIdAndSeasonYearOrderByRoundNumberAsc(userId, seasonYear)
                .stream().map(LadderAdjustment::getRoundNumber).collect(Collectors.toSet());
        return fixtureRepository.findCompletedRounds(seasonYear).stream()
                .filter(r -> !used.contains(r))
                .collect(Collectors.toList());
    }

    /**
     * Moves {@code team} one place up or down in the user's prediction, using up the adjustment for
     * {@code roundNumber}.
     * @return the prediction after the move
     */
    @Transactional
    public List<String> adjust(Long userId, int seasonYear, int roundNumber, String team,
                               LadderAdjustment.Direction direction, Instant now) {
        if (!fixtureRepository.findCompletedRounds(seasonYear).contains(roundNumber)) {
            throw new IllegalArgumentException("Round " + roundNumber + " is not completed");
        }
        if (adjustmentRepository.existsByUserIdAndSeasonYearAndRoundNumber(userId, seasonYear, roundNumber)) {
            throw new IllegalStateException("Adjustment for round " + roundNumber + " already used");
        }
        List<LadderPrediction> rows = predictionRepository.findByUserIdAndSeasonYearOrderByPredictedPositionAsc(userId, seasonYear);
        if (rows.isEmpty()) throw new IllegalStateException("No prediction saved for " + seasonYear);

        int idx = -1;
        for (int i = 0; i < rows.size(); i++) {
            if (rows.get(i).getTeamName().equals(team)) {
                idx = i;
                break;
            }
        }
        if (idx < 0) throw new IllegalArgumentException("Team not in prediction: " + team);
        int target = direction == LadderAdjustment.Direction.UP ? idx - 1 : idx + 1;
        if (target < 0 || target >= rows.size()) {
            throw new IllegalArgumentException("Cannot move " + team + " " + direction.name().toLowerCase() + " from position " + (idx + 1));
        }

        LadderPrediction moving = rows.get(idx);
        LadderPrediction neighbour = rows.get(target);
        int movingPos = moving.getPredictedPosition();
        moving.setPredictedPosition(neighbour.getPredictedPosition());
        neighbour.setPredictedPosition(movingPos);
        moving.setUpdatedAt(now);
        neighbour.setUpdatedAt(now);
        predictionRepository.saveAll(List.of(moving, neighbour));
        adjustmentRepository.save(new LadderAdjustment(userId, seasonYear, roundNumber, team, direction, now));

        rows.sort(Comparator.comparing(LadderPrediction::getPredictedPosition));
        return rows.stream().map(LadderPrediction::getTeamName).collect(Collectors.toList());
    }

    /** Sum of |predicted - actual| positions; teams missing from the actual ladder are skipped. */
    public static int score(List<String> predicted, List<String> actual) {
        Map<String, Integer> actualPos = new HashMap<>();
        for (int i = 0; i < actual.size(); i++) actualPos.put(actual.get(i), i + 1);
        int total = 0;
        for (int i = 0; i < predicted.size(); i++) {
            Integer a = actualPos.get(predicted.get(i));
            if (a == null) continue;
            total += Math.abs((i + 1) - a);
        }
        return total;
    }

    /** Everyone with a saved prediction, best (lowest) score first. */
    @Transactional(readOnly = true)
    public List<PredictionScore> leaderboard(int seasonYear) {
        List<String> actual = ladderService.computeLadder(seasonYear).stream()
                .map(LadderStandingDTO::getTeam).collect(Collectors.toList());
        Map<Long, List<String>> byUser = new LinkedHashMap<>();
        for (LadderPrediction p : predictionRepository.findBySeasonYearOrderByUserIdAscPredictedPositionAsc(seasonYear)) {
            byUser.computeIfAbsent(p.getUserId(), k -> new ArrayList<>()).add(p.getTeamName());
        }
        Map<Long, String> names = userRepository.findAllById(byUser.keySet()).stream()
                .collect(Collectors.toMap(AppUser::getId, AppUser::getDisplayName));
        List<PredictionScore> out = new ArrayList<>();
        byUser.forEach((userId, teams) -> out.add(new PredictionScore(userId, names.getOrDefault(userId, "?"), score(teams, actual))));
        out.sort(Comparator.comparingInt(PredictionScore::score).thenComparing(PredictionScore::displayName));
        return out;
    }
}
