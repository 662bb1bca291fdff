package com.kickoff.tipping.service;

import com.kickoff.tipping.dto.FixtureCandidate;
import com.kickoff.tipping.model.Fixture;
import com.kickoff.tipping.model.FixtureStatus;
import com.kickoff.tipping.service.source.SourcePull;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class FixtureMergerTest {

    private final FixtureMerger merger = new FixtureMerger();

    private static FixtureCandidate candidate(String source, String kickoff) {
        FixtureCandidate c = new FixtureCandidate("evt-1", source, Instant.parse(kickoff), "Melbourne Storm", "Penrith Panthers");
        c.setSeasonYear(2025);
        return c;
    }

    @Test
    void keepsEarliestKickoffAndFirstPrices() {
        FixtureCandidate a = candidate("upcoming_odds", "2025-03-08T09:00:00Z");
        a.setHomePrice(1.80);
        a.setAwayPrice(2.05);
        FixtureCandidate b = candidate("historical_odds", "2025-03-08T08:00:00Z");
        b.setHomePrice(1.50);
        b.setAwayPrice(2.60);

        FixtureCandidate m = merger.merge(a, b);

        assertThat(m.getKickoff()).isEqualTo(Instant.parse("2025-03-08T08:00:00Z"));
        assertThat(m.getHomePrice()).isEqualTo(1.80);
        assertThat(m.getAwayPrice()).isEqualTo(2.05);
        assertThat(m.getSource()).isEqualTo("historical_odds");
    }

    @Test
    void completionIsStickyAndScoresArrive() {
        FixtureCandidate done = candidate("scores", "2025-03-08T09:00:00Z");
        done.setStatus(FixtureStatus.COMPLETED);
        done.setHomeScore(24);
        done.setAwayScore(12);
        done.setWinner("Melbourne Storm");
        FixtureCandidate stale = candidate("upcoming_odds", "2025-03-08T09:00:00Z");

        FixtureCandidate m = merger.merge(done, stale);

        assertThat(m.isCompleted()).isTrue();
        assertThat(m.getHomeScore()).isEqualTo(24);
        assertThat(m.getWinner()).isEqualTo("Melbourne Storm");
    }

    @Test
    void unknownWinnerNeverOverwritesAKnownOne() {
        FixtureCandidate known = candidate("scores", "2025-03-08T09:00:00Z");
        known.setStatus(FixtureStatus.COMPLETED);
        known.setWinner(Fixture.WINNER_DRAW);
        FixtureCandidate unknown = candidate("historical_odds", "2025-03-08T09:00:00Z");
        unknown.setStatus(FixtureStatus.COMPLETED);
        unknown.setWinner(Fixture.WINNER_UNKNOWN);

        assertThat(merger.merge(known, unknown).getWinner()).isEqualTo(Fixture.WINNER_DRAW);
    }

    @Test
    void completedWithoutWinnerBecomesUnknown() {
        FixtureCandidate scheduled = candidate("upcoming_odds", "2025-03-08T09:00:00Z");
        FixtureCandidate completed = candidate("scores", "2025-03-08T09:00:00Z");
        completed.setStatus(FixtureStatus.COMPLETED);

        FixtureCandidate m = merger.merge(scheduled, completed);

        assertThat(m.isCompleted()).isTrue();
        assertThat(m.getWinner()).isEqualTo(Fixture.WINNER_UNKNOWN);
    }

    @Test
    void mergeDoesNotMutateInputs() {
        FixtureCandidate a = candidate("upcoming_odds", "2025-03-08T09:00:00Z");
        FixtureCandidate b = candidate("scores", "2025-03-08T07:00:00Z");
        b.setVenueName("AAMI Park");

        merger.merge(a, b);

        assertThat(a.getKickoff()).isEqualTo(Instant.parse("2025-03-08T09:00:00Z"));
        assertThat(a.getVenueName()).isNull();
    }

    @Test
    void blankIncomingNamesKeepExistingOnes() {
        FixtureCandidate a = candidate("upcoming_odds", "2025-03-08T09:00:00Z");
        a.setVenueName("AAMI Park");
        FixtureCandidate b = new FixtureCandidate("evt-1", "scores", Instant.parse("2025-03-08T09:00:00Z"), " ", "");
        b.setVenueName("  ");

        FixtureCandidate m = merger.merge(a, b);

        assertThat(m.getHomeTeam()).isEqualTo("Melbourne Storm");
        assertThat(m.getAwayTeam()).isEqualTo("Penrith Panthers");
        assertThat(m.getVenueName()).isEqualTo("AAMI Park");
    }

    @Test
    void mergeAllFoldsByEventIdInPullOrder() {
        FixtureCandidate a = candidate("upcoming_odds", "2025-03-08T09:00:00Z");
        FixtureCandidate other = new FixtureCandidate("evt-2", "upcoming_odds", Instant.parse("2025-03-09T06:00:00Z"), "Broncos", "Eels");
        FixtureCandidate b = candidate("scores", "2025-03-08T09:00:00Z");
        b.setStatus(FixtureStatus.COMPLETED);
        b.setHomeScore(10);
        b.setAwayScore(10);
        b.setWinner(Fixture.WINNER_DRAW);

        Map<String, FixtureCandidate> merged = merger.mergeAll(List.of(
                new SourcePull("upcoming_odds", List.of(), List.of(a, other), Map.of()),
                new SourcePull("scores", List.of(), List.of(b), Map.of())));

        assertThat(merged).containsOnlyKeys("evt-1", "evt-2");
        assertThat(merged.get("evt-1").getWinner()).isEqualTo(Fixture.WINNER_DRAW);
        assertThat(merged.get("evt-2").isCompleted()).isFalse();
    }

    @Test
    void storedRowRoundTripsThroughCandidate() {
        Fixture stored = new Fixture("evt-1", Instant.parse("2025-03-08T09:00:00Z"), "Melbourne Storm", "Penrith Panthers");
        stored.setRoundNumber(3);
        stored.setSeasonYear(2025);
        FixtureCandidate incoming = candidate("upcoming_odds", "2025-03-08T09:30:00Z");
        incoming.setRoundNumber(7);

        FixtureCandidate m = merger.merge(merger.toCandidate(stored), incoming);
        Instant now = Instant.parse("2025-03-01T00:00:00Z");
        merger.applyTo(stored, m, now);

        assertThat(stored.getRoundNumber()).isEqualTo(3);
        assertThat(stored.getKickoff()).isEqualTo(Instant.parse("2025-03-08T09:00:00Z"));
        assertThat(stored.getUpdatedAt()).isEqualTo(now);
    }

    @Test
    void drawRoundReplacesAStoredGapRound() {
        Fixture stored = new Fixture("evt-1", Instant.parse("2025-03-08T09:00:00Z"), "Melbourne Storm", "Penrith Panthers");
        stored.setRoundNumber(1);
        stored.setHomeLogoUrl("https://old/storm");
        stored.setSeasonYear(2025);
        FixtureCandidate incoming = candidate("upcoming_odds", "2025-03-08T09:00:00Z");
        incoming.setRoundNumber(5);
        incoming.setHomeLogoUrl("https://logo/storm");
        incoming.setDrawConfirmed(true);

        FixtureCandidate m = merger.merge(merger.toCandidate(stored), incoming);

        assertThat(m.getRoundNumber()).isEqualTo(5);
        assertThat(m.getHomeLogoUrl()).isEqualTo("https://logo/storm");
        assertThat(m.isDrawConfirmed()).isTrue();
    }
}
