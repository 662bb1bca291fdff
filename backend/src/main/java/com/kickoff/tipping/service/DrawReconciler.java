package com.kickoff.tipping.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.kickoff.tipping.dto.FixtureCandidate;
import com.kickoff.tipping.model.FixtureStatus;
import com.kickoff.tipping.service.source.DrawFixture;
import com.kickoff.tipping.service.source.OfficialDrawSource;
import com.kickoff.tipping.util.TeamNameNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Cross-checks odds-feed fixtures against the official draw. Matched fixtures take the draw's round,
 * venue and crests; season fixtures with no draw counterpart are dropped; draw matches the odds feed
 * never mentioned are added under a derived id.
 */
@Service
public class DrawReconciler {
    private static final Logger log = LoggerFactory.getLogger(DrawReconciler.class);

    public static final String SOURCE = "official_draw";

    private final OfficialDrawSource drawSource;
    private final ObjectMapper objectMapper;
    private final long matchWindowSeconds;

    public DrawReconciler(OfficialDrawSource drawSource,
                          ObjectMapper objectMapper,
                          @Value("${tipping.draw.match-window-hours:36}") long matchWindowHours) {
        this.drawSource = drawSource;
        this.objectMapper = objectMapper;
        this.matchWindowSeconds = Duration.ofHours(matchWindowHours).getSeconds();
    }

    public record DrawEnrichment(int drawFixturesLoaded, int fixturesEnriched, int fixturesFilteredOut,
                                 int drawFixturesAdded, String error) {
        static DrawEnrichment unavailable(String error) {
            return new DrawEnrichment(0, 0, 0, 0, error);
        }
    }

    /** Mutates {@code fixtures} in place. A draw fetch failure or an empty draw leaves it untouched. */
    public DrawEnrichment reconcile(Map<String, FixtureCandidate> fixtures, int seasonYear) {
        List<DrawFixture> draws;
        try {
            draws = new ArrayList<>();
            for (DrawFixture d : drawSource.fetchSeason(seasonYear)) {
                if (d.roundNumber() >= 1 && d.roundNumber() <= drawSource.getMaxRound()) draws.add(d);
            }
        } catch (RuntimeException ex) {
            log.warn("[DRAW] draw unavailable for season {}, skipping enrichment: {}", seasonYear, ex.getMessage());
            return DrawEnrichment.unavailable(ex.getMessage());
        }
        // a page without a usable draw blob must not filter out the odds fixtures
        if (draws.isEmpty()) {
            log.warn("[DRAW] draw for season {} listed no matches, skipping enrichment", seasonYear);
            return DrawEnrichment.unavailable("draw listed no matches for season " + seasonYear);
        }
        return apply(fixtures, draws, seasonYear);
    }

    DrawEnrichment apply(Map<String, FixtureCandidate> fixtures, List<DrawFixture> draws, int seasonYear) {
        int enriched = 0;
        int filteredOut = 0;
        Set<Integer> matched = new HashSet<>();

        Iterator<Map.Entry<String, FixtureCandidate>> it = fixtures.entrySet().iterator();
        while (it.hasNext()) {
            FixtureCandidate fixture = it.next().getValue();
            if (fixture.getSeasonYear() == null || fixture.getSeasonYear() != seasonYear) continue;
            int bestIdx = bestMatch(fixture, draws);
            if (bestIdx < 0) {
                it.remove();
                filteredOut++;
                continue;
            }
            DrawFixture d = draws.get(bestIdx);
            fixture.setRoundNumber(d.roundNumber());
            fixture.setDrawConfirmed(true);
            if (d.venueName() != null) fixture.setVenueName(d.venueName());
            if (d.venueCity() != null) fixture.setVenueCity(d.venueCity());
            if (d.homeLogoUrl() != null) fixture.setHomeLogoUrl(d.homeLogoUrl());
            if (d.awayLogoUrl() != null) fixture.setAwayLogoUrl(d.awayLogoUrl());
            matched.add(bestIdx);
            enriched++;
        }

        int added = 0;
        for (int i = 0; i < draws.size(); i++) {
            if (matched.contains(i)) continue;
            DrawFixture d = draws.get(i);
            if (d.homeName().isBlank() || d.awayName().isBlank()) continue;
            String id = drawEventId(seasonYear, d);
            if (fixtures.containsKey(id)) continue;
            fixtures.put(id, fromDraw(id, seasonYear, d));
            added++;
        }
        log.info("[DRAW] season={} loaded={} enriched={} filteredOut={} added={}", seasonYear, draws.size(), enriched, filteredOut, added);
        return new DrawEnrichment(draws.size(), enriched, filteredOut, added, null);
    }

    // Smallest kickoff delta among draw entries matching both teams inside the window; -1 if none
    private int bestMatch(FixtureCandidate fixture, List<DrawFixture> draws) {
        int bestIdx = -1;
        long bestDelta = Long.MAX_VALUE;
        for (int i = 0; i < draws.size(); i++) {
            DrawFixture d = draws.get(i);
            if (!TeamNameNormalizer.matches(fixture.getHomeTeam(), d.homeName())) continue;
            if (!TeamNameNormalizer.matches(fixture.getAwayTeam(), d.awayName())) continue;
            long delta = Math.abs(Duration.between(fixture.getKickoff(), d.kickoff()).getSeconds());
            if (delta > matchWindowSeconds) continue;
            if (delta < bestDelta) {
                bestDelta = delta;
                bestIdx = i;
            }
        }
        return bestIdx;
    }

    public static String drawEventId(int seasonYear, DrawFixture d) {
        String home = TeamNameNormalizer.token(d.homeName());
        String away = TeamNameNormalizer.token(d.awayName());
        String kickoffToken = d.kickoffText() == null ? "" : d.kickoffText().replaceAll("[^0-9TZ:+-]", "");
        return "draw:" + seasonYear + ":r" + d.roundNumber() + ":" + (home.isEmpty() ? "home" : home)
                + ":vs:" + (away.isEmpty() ? "away" : away) + ":" + kickoffToken;
    }

    private FixtureCandidate fromDraw(String id, int seasonYear, DrawFixture d) {
        FixtureCandidate c = new FixtureCandidate(id, SOURCE, d.kickoff(), d.homeName().trim(), d.awayName().trim());
        c.setSeasonYear(seasonYear);
        c.setRoundNumber(d.roundNumber());
        c.setDrawConfirmed(true);
        c.setVenueName(d.venueName());
        c.setVenueCity(d.venueCity());
        c.setHomeLogoUrl(d.homeLogoUrl());
        c.setAwayLogoUrl(d.awayLogoUrl());
        c.setStatus(FixtureStatus.SCHEDULED);
        ObjectNode raw = objectMapper.createObjectNode();
        raw.put("source", SOURCE);
        ObjectNode draw = raw.putObject("draw_fixture");
        draw.put("round_number", d.roundNumber());
        draw.put("home_name", d.homeName());
        draw.put("away_name", d.awayName());
        draw.put("kickoff_utc", d.kickoffText());
        draw.put("stadium_name", d.venueName());
        draw.put("stadium_city", d.venueCity());
        draw.put("home_logo_url", d.homeLogoUrl());
        draw.put("away_logo_url", d.awayLogoUrl());
        draw.put("match_centre_url", d.matchCentreUrl());
        c.setRawPayload(raw.toString());
        return c;
    }
}
