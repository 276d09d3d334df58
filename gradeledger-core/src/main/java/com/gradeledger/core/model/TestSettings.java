package com.gradeledger.core.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Attempt rules of a test source.
 * 
 * Invariants:
 * - 1 <= attemptsAllowed <= 10
 * - scheduled tests have a window and 0 < durationMinutes <= 1440
 */
public record TestSettings(
    TestMode mode,
    int attemptsAllowed,
    int durationMinutes,
    Instant windowStart,
    Instant windowEnd
) {
    public static final int MAX_ATTEMPTS = 10;
    public static final int MAX_DURATION_MINUTES = 24 * 60;
    public static final Duration PRACTICE_ATTEMPT_LIFETIME = Duration.ofDays(7);

    public static TestSettings practice(int attemptsAllowed) {
        return new TestSettings(TestMode.PRACTICE, attemptsAllowed, 0, null, null);
    }

    public static TestSettings scheduled(int attemptsAllowed, int durationMinutes,
                                         Instant windowStart, Instant windowEnd) {
        return new TestSettings(TestMode.SCHEDULED, attemptsAllowed, durationMinutes, windowStart, windowEnd);
    }

    public boolean isScheduled() {
        return mode == TestMode.SCHEDULED;
    }

    public boolean isWindowOpen(Instant now) {
        if (!isScheduled()) {
            return true;
        }
        return !now.isBefore(windowStart) && !now.isAfter(windowEnd);
    }

    /**
     * When an attempt started at the given instant stops accepting submissions.
     */
    public Instant attemptExpiry(Instant startedAt) {
        return isScheduled()
            ? startedAt.plus(Duration.ofMinutes(durationMinutes))
            : startedAt.plus(PRACTICE_ATTEMPT_LIFETIME);
    }
}
