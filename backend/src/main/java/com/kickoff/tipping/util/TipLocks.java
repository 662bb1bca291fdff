package com.kickoff.tipping.util;

import java.time.Duration;
import java.time.Instant;

/**
 * Per-fixture tipping lock arithmetic. All instants are UTC.
 */
public final class TipLocks {

    private TipLocks() {}

    public static Instant lockDeadline(Instant kickoff, int lockMinutes) {
        if (kickoff == null) throw new IllegalArgumentException("kickoff is required");
        return kickoff.minus(Duration.ofMinutes(Math.max(0, lockMinutes)));
    }

    // Inclusive: a tip is locked exactly at the deadline.
    public static boolean isLocked(Instant kickoff, Instant now, int lockMinutes) {
        return !now.isBefore(lockDeadline(kickoff, lockMinutes));
    }
}
