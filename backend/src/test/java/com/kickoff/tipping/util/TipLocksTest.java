package com.kickoff.tipping.util;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TipLocksTest {

    private static final Instant KICKOFF = Instant.parse("2025-03-06T09:00:00Z");

    @Test
    void deadlineIsKickoffMinusLockMinutes() {
        assertThat(TipLocks.lockDeadline(KICKOFF, 5)).isEqualTo(Instant.parse("2025-03-06T08:55:00Z"));
    }

    @Test
    void lockIsInclusiveAtTheDeadline() {
        assertThat(TipLocks.isLocked(KICKOFF, Instant.parse("2025-03-06T08:54:59.999Z"), 5)).isFalse();
        assertThat(TipLocks.isLocked(KICKOFF, Instant.parse("2025-03-06T08:55:00Z"), 5)).isTrue();
        assertThat(TipLocks.isLocked(KICKOFF, Instant.parse("2025-03-06T10:00:00Z"), 5)).isTrue();
    }

    @Test
    void negativeLockMinutesAreTreatedAsZero() {
        assertThat(TipLocks.lockDeadline(KICKOFF, -10)).isEqualTo(KICKOFF);
        assertThat(TipLocks.isLocked(KICKOFF, KICKOFF.minusMillis(1), -10)).isFalse();
    }

    @Test
    void missingKickoffIsRejected() {
        assertThatThrownBy(() -> TipLocks.lockDeadline(null, 5)).isInstanceOf(IllegalArgumentException.class);
    }
}
