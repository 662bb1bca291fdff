package com.kickoff.tipping.service;

import com.kickoff.tipping.dto.LadderStandingDTO;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Competition ladder, always recomputed from completed fixtures. Each match contributes one row
 * per side (home and away perspective) which are then summed per team.
 */
@Service
@Transactional(readOnly = true)
public class LadderService {

    private static final String COMPLETED_WITH_SCORES =
            "f.status = 'COMPLETED' AND f.season_year = ?1 AND f.home_score IS NOT NULL AND f.away_score IS NOT NULL ";

    @PersistenceContext
    private EntityManager em;

    public LadderService() {}

    // Additional constructor for tests or manual wiring
    public LadderService(EntityManager em) {
        this.em = em;
    }

    public List<LadderStandingDTO> computeLadder(Integer seasonYear) {
        if (seasonYear == null) throw new IllegalArgumentException("seasonYear is required");
        String sql =
                "SELECT s.team, COUNT(*) AS played, SUM(s.w) AS won, SUM(s.d) AS drawn, SUM(s.l) AS lost, " +
                "       SUM(s.pf) AS points_for, SUM(s.pa) AS points_against, SUM(s.pf) - SUM(s.pa) AS point_diff, " +
                "       SUM(s.pts) AS comp_points " +
                "FROM ( " +
                "  SELECT f.home_team AS team, f.home_score AS pf, f.away_score AS pa, " +
                "         CASE WHEN f.home_score > f.away_score THEN 1 ELSE 0 END AS w, " +
                "         CASE WHEN f.home_score = f.away_score THEN 1 ELSE 0 END AS d, " +
                "         CASE WHEN f.home_score < f.away_score THEN 1 ELSE 0 END AS l, " +
                "         CASE WHEN f.home_score > f.away_score THEN 2 WHEN f.home_score = f.away_score THEN 1 ELSE 0 END AS pts " +
                "  FROM fixtures f WHERE " + COMPLETED_WITH_SCORES +
                "  UNION ALL " +
                "  SELECT f.away_team AS team, f.away_score AS pf, f.home_score AS pa, " +
                "         CASE WHEN f.away_score > f.home_score THEN 1 ELSE 0 END AS w, " +
                "         CASE WHEN f.away_score = f.home_score THEN 1 ELSE 0 END AS d, " +
                "         CASE WHEN f.away_score < f.home_score THEN 1 ELSE 0 END AS l, " +
                "         CASE WHEN f.away_score > f.home_score THEN 2 WHEN f.away_score = f.home_score THEN 1 ELSE 0 END AS pts " +
                "  FROM fixtures f WHERE " + COMPLETED_WITH_SCORES +
                ") s " +
                "GROUP BY s.team " +
                "ORDER BY comp_points DESC, point_diff DESC, points_for DESC, s.team ASC";

        @SuppressWarnings("unchecked")
        List<Object[]> rows = em.createNativeQuery(sql).setParameter(1, seasonYear).getResultList();
        Map<String, String> logos = latestLogos(seasonYear);

        List<LadderStandingDTO> result = new ArrayList<>();
        int pos = 1;
        for (Object[] r : rows) {
            String team = (String) r[0];
            result.add(new LadderStandingDTO(pos++, team,
                    ((Number) r[1]).intValue(),
                    ((Number) r[2]).intValue(),
                    ((Number) r[3]).intValue(),
                    ((Number) r[4]).intValue(),
                    ((Number) r[5]).intValue(),
                    ((Number) r[6]).intValue(),
                    ((Number) r[7]).intValue(),
                    ((Number) r[8]).intValue(),
                    logos.get(team)));
        }
        return result;
    }

    // Most recent non-null crest per team across both sides of completed fixtures
    private Map<String, String> latestLogos(Integer seasonYear) {
        String sql =
                "SELECT x.team, x.logo FROM ( " +
                "  SELECT f.home_team AS team, f.home_logo_url AS logo, f.kickoff_utc AS ko FROM fixtures f " +
                "  WHERE " + COMPLETED_WITH_SCORES + "AND f.home_logo_url IS NOT NULL " +
                "  UNION ALL " +
                "  SELECT f.away_team AS team, f.away_logo_url AS logo, f.kickoff_utc AS ko FROM fixtures f " +
                "  WHERE " + COMPLETED_WITH_SCORES + "AND f.away_logo_url IS NOT NULL " +
                ") x ORDER BY x.ko DESC";
        @SuppressWarnings("unchecked")
        List<Object[]> rows = em.createNativeQuery(sql).setParameter(1, seasonYear).getResultList();
        Map<String, String> out = new HashMap<>();
        for (Object[] r : rows) {
            out.putIfAbsent((String) r[0], (String) r[1]);
        }
        return out;
    }
}
