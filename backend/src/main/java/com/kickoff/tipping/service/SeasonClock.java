package com.kickoff.tipping.service;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;

/** Current time in UTC plus the few local-time questions the engine asks (season year, prediction deadline). */
@Component
public class SeasonClock {

    private final Clock clock;
    private final ZoneId zone;
    private final int deadlineMonth;
    private final int deadlineDay;
    private final int deadlineHour;

    @Autowired
    public SeasonClock(Clock clock, ZoneId tippingZone,
                       @Value("${tipping.prediction.deadline-month:3}") int deadlineMonth,
                       @Value("${tipping.prediction.deadline-day:12}") int deadlineDay,
                       @Value("${tipping.prediction.deadline-hour:20}") int deadlineHour) {
        this.clock = clock;
        this.zone = tippingZone;
        this.deadlineMonth = deadlineMonth;
        this.deadlineDay = deadlineDay;
        this.deadlineHour = deadlineHour;
    }

    public SeasonClock(Clock clock, ZoneId zone) {
        this(clock, zone, 3, 12, 20);
    }

    public Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    public ZoneId zone() { return zone; }

    /** The season defaults to the local calendar year. */
    public int currentSeasonYear() {
        return ZonedDateTime.ofInstant(now(), zone).getYear();
    }

    public int resolveSeason(Integer seasonYear) {
        return seasonYear != null ? seasonYear : currentSeasonYear();
    }

    public String localNowIso() {
        return OffsetDateTime.ofInstant(now(), zone).toString();
    }

    /** Ladder predictions close at this instant. */
    public Instant predictionDeadline(int seasonYear) {
        return ZonedDateTime.of(seasonYear, deadlineMonth, deadlineDay, deadlineHour, 0, 0, 0, zone).toInstant();
    }
}
