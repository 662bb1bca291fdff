package com.kickoff.tipping.service;

import com.kickoff.tipping.dto.FixtureCandidate;
import com.kickoff.tipping.model.Fixture;
import com.kickoff.tipping.model.FixtureStatus;
import com.kickoff.tipping.service.source.SourcePull;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Field-level conflict rules for combining two reports of the same match. {@link #merge} never
 * mutates its arguments, so the same rules apply between sources and against stored rows.
 */
@Component
public class FixtureMerger {

    public FixtureCandidate merge(FixtureCandidate existing, FixtureCandidate incoming) {
        if (existing == null) return incoming.copy();
        FixtureCandidate m = existing.copy();

        m.setKickoff(earliest(existing.getKickoff(), incoming.getKickoff()));

        if (notBlank(incoming.getHomeTeam())) m.setHomeTeam(incoming.getHomeTeam());
        if (notBlank(incoming.getAwayTeam())) m.setAwayTeam(incoming.getAwayTeam());
        if (notBlank(incoming.getVenueName())) m.setVenueName(incoming.getVenueName());
        if (notBlank(incoming.getVenueCity())) m.setVenueCity(incoming.getVenueCity());
        if (incoming.getSeasonYear() != null) m.setSeasonYear(incoming.getSeasonYear());

        if (incoming.isDrawConfirmed() && incoming.getRoundNumber() != null) {
            // the official draw overrides rounds and crests from any other source
            m.setRoundNumber(incoming.getRoundNumber());
            if (incoming.getHomeLogoUrl() != null) m.setHomeLogoUrl(incoming.getHomeLogoUrl());
            if (incoming.getAwayLogoUrl() != null) m.setAwayLogoUrl(incoming.getAwayLogoUrl());
            m.setDrawConfirmed(true);
        }

        // first writer wins
        if (m.getHomeLogoUrl() == null) m.setHomeLogoUrl(incoming.getHomeLogoUrl());
        if (m.getAwayLogoUrl() == null) m.setAwayLogoUrl(incoming.getAwayLogoUrl());
        if (m.getRoundNumber() == null) m.setRoundNumber(incoming.getRoundNumber());
        if (m.getHomePrice() == null) m.setHomePrice(incoming.getHomePrice());
        if (m.getAwayPrice() == null) m.setAwayPrice(incoming.getAwayPrice());

        if (incoming.isCompleted()) m.setStatus(FixtureStatus.COMPLETED);
        else if (m.getStatus() == null) m.setStatus(incoming.getStatus());

        if (incoming.getHomeScore() != null) m.setHomeScore(incoming.getHomeScore());
        if (incoming.getAwayScore() != null) m.setAwayScore(incoming.getAwayScore());
        if (incoming.getWinner() != null && !Fixture.WINNER_UNKNOWN.equals(incoming.getWinner())) {
            m.setWinner(incoming.getWinner());
        }
        if (m.isCompleted() && m.getWinner() == null) m.setWinner(Fixture.WINNER_UNKNOWN);

        if (incoming.getRawPayload() != null) m.setRawPayload(incoming.getRawPayload());
        if (incoming.getSource() != null) m.setSource(incoming.getSource());
        return m;
    }

    /** Folds every normalized fixture of every pull into one candidate per event id, in pull order. */
    public Map<String, FixtureCandidate> mergeAll(List<SourcePull> pulls) {
        Map<String, FixtureCandidate> merged = new LinkedHashMap<>();
        for (SourcePull pull : pulls) {
            for (FixtureCandidate c : pull.fixtures()) {
                merged.put(c.getSourceEventId(), merge(merged.get(c.getSourceEventId()), c));
            }
        }
        return merged;
    }

    public FixtureCandidate toCandidate(Fixture f) {
        FixtureCandidate c = new FixtureCandidate(f.getSourceEventId(), f.getSource(), f.getKickoff(), f.getHomeTeam(), f.getAwayTeam());
        c.setSeasonYear(f.getSeasonYear());
        c.setVenueName(f.getVenueName());
        c.setVenueCity(f.getVenueCity());
        c.setHomeLogoUrl(f.getHomeLogoUrl());
        c.setAwayLogoUrl(f.getAwayLogoUrl());
        c.setRoundNumber(f.getRoundNumber());
        c.setStatus(f.getStatus());
        c.setHomeScore(f.getHomeScore());
        c.setAwayScore(f.getAwayScore());
        c.setWinner(f.getWinner());
        c.setHomePrice(f.getHomePrice());
        c.setAwayPrice(f.getAwayPrice());
        c.setRawPayload(f.getRawPayload());
        return c;
    }

    public void applyTo(Fixture f, FixtureCandidate c, Instant now) {
        f.setSourceEventId(c.getSourceEventId());
        f.setKickoff(c.getKickoff());
        f.setHomeTeam(c.getHomeTeam());
        f.setAwayTeam(c.getAwayTeam());
        f.setVenueName(c.getVenueName());
        f.setVenueCity(c.getVenueCity());
        f.setHomeLogoUrl(c.getHomeLogoUrl());
        f.setAwayLogoUrl(c.getAwayLogoUrl());
        f.setSeasonYear(c.getSeasonYear());
        f.setRoundNumber(c.getRoundNumber());
        f.setStatus(c.getStatus() == null ? FixtureStatus.SCHEDULED : c.getStatus());
        f.setHomeScore(c.getHomeScore());
        f.setAwayScore(c.getAwayScore());
        f.setWinner(c.getWinner());
        f.setHomePrice(c.getHomePrice());
        f.setAwayPrice(c.getAwayPrice());
        f.setRawPayload(c.getRawPayload());
        f.setSource(c.getSource());
        f.setUpdatedAt(now);
    }

    private static Instant earliest(Instant a, Instant b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.isBefore(b) ? a : b;
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }
}
