package com.kickoff.tipping.service;

import com.kickoff.tipping.dto.LeaderboardEntryDTO;
import com.kickoff.tipping.repository.AppUserRepository;
import com.kickoff.tipping.repository.FixtureRepository;
import com.kickoff.tipping.repository.TipRepository;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.Query;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
@Transactional(readOnly = true)
public class LeaderboardService {

    private final AppUserRepository userRepository;
    private final FixtureRepository fixtureRepository;
    private final TipRepository tipRepository;

    @PersistenceContext
    private EntityManager em;

    @Autowired
    public LeaderboardService(AppUserRepository userRepository, FixtureRepository fixtureRepository, TipRepository tipRepository) {
        this.userRepository = userRepository;
        this.fixtureRepository = fixtureRepository;
        this.tipRepository = tipRepository;
    }

    // Additional constructor for tests or manual wiring
    public LeaderboardService(AppUserRepository userRepository, FixtureRepository fixtureRepository, TipRepository tipRepository, EntityManager em) {
        this(userRepository, fixtureRepository, tipRepository);
        this.em = em;
    }

    public record DashboardCounts(long users, long fixtures, long tips, long correctTips) {}

    /**
     * Season leaderboard: every user with tips made, correct tips and total points in the season,
     * plus points per round (0 where the user scored nothing or did not tip).
     */
    public List<LeaderboardEntryDTO> seasonLeaderboard(int seasonYear) {
        List<LeaderboardEntryDTO> entries = totals(seasonYear, null);
        List<Integer> rounds = fixtureRepository.findDistinctRounds(seasonYear);
        Map<Long, Map<Integer, Integer>> byUser = roundPoints(seasonYear);
        for (LeaderboardEntryDTO e : entries) {
            Map<Integer, Integer> mine = byUser.getOrDefault(e.getUserId(), Map.of());
            Map<Integer, Integer> points = new LinkedHashMap<>();
            for (Integer r : rounds) points.put(r, mine.getOrDefault(r, 0));
            e.setRoundPoints(points);
        }
        return entries;
    }

    /** Same ordering as the season board, counting only tips on fixtures of one round. */
    public List<LeaderboardEntryDTO> roundLeaderboard(int seasonYear, int roundNumber) {
        return totals(seasonYear, roundNumber);
    }

    public DashboardCounts dashboardCounts(Long userId) {
        return new DashboardCounts(userRepository.count(), fixtureRepository.count(),
                tipRepository.countByUser_Id(userId), tipRepository.countByUser_IdAndPointsAwarded(userId, 1));
    }

    private List<LeaderboardEntryDTO> totals(int seasonYear, Integer roundNumber) {
        String roundFilter = roundNumber == null ? "" : " AND f.round_number = ?2";
        String sql =
                "SELECT u.id, u.display_name, COUNT(t.id) AS tips_made, " +
                "       COALESCE(SUM(CASE WHEN t.points_awarded = 1 THEN 1 ELSE 0 END), 0) AS correct_tips, " +
                "       COALESCE(SUM(t.points_awarded), 0) AS total_points " +
                "FROM users u " +
                "LEFT JOIN (SELECT tt.id, tt.user_id, tt.points_awarded FROM tips tt " +
                "           JOIN fixtures f ON f.id = tt.fixture_id " +
                "           WHERE f.season_year = ?1" + roundFilter + ") t ON t.user_id = u.id " +
                "GROUP BY u.id, u.display_name " +
                "ORDER BY total_points DESC, correct_tips DESC, tips_made DESC, u.display_name ASC";
        Query q = em.createNativeQuery(sql).setParameter(1, seasonYear);
        if (roundNumber != null) q.setParameter(2, roundNumber);
        @SuppressWarnings("unchecked")
        List<Object[]> rows = q.getResultList();
        List<LeaderboardEntryDTO> out = new ArrayList<>();
        for (Object[] r : rows) {
            out.add(new LeaderboardEntryDTO(((Number) r[0]).longValue(), (String) r[1],
                    ((Number) r[2]).intValue(), ((Number) r[3]).intValue(), ((Number) r[4]).intValue()));
        }
        return out;
    }

    private Map<Long, Map<Integer, Integer>> roundPoints(int seasonYear) {
        @SuppressWarnings("unchecked")
        List<Object[]> rows = em.createNativeQuery(
                "SELECT t.user_id, f.round_number, COALESCE(SUM(t.points_awarded), 0) " +
                "FROM tips t JOIN fixtures f ON f.id = t.fixture_id " +
                "WHERE f.season_year = ?1 AND f.round_number IS NOT NULL " +
                "GROUP BY t.user_id, f.round_number")
            .setParameter(1, seasonYear)
            .getResultList();
        Map<Long, Map<Integer, Integer>> out = new HashMap<>();
        for (Object[] r : rows) {
            out.computeIfAbsent(((Number) r[0]).longValue(), k -> new HashMap<>())
                    .put(((Number) r[1]).intValue(), ((Number) r[2]).intValue());
        }
        return out;
    }
}
