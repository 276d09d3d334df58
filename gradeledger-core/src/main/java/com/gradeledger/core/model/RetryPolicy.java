package com.gradeledger.core.model;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

/**
 * How a conflicting transaction is re-run: how often, how long to wait in
 * between, and which error codes count as a conflict worth another attempt.
 *
 * Invariants:
 * - maxAttempts >= 1
 * - initialBackoff <= maxBackoff
 * - backoffMultiplier >= 1.0
 * - jitterFactor in [0.0, 1.0]
 */
public record RetryPolicy(
    int maxAttempts,
    Duration initialBackoff,
    Duration maxBackoff,
    double backoffMultiplier,
    double jitterFactor,
    Set<String> retryOn
) {
    public static final String LOCK_CONFLICT = "OPTIMISTIC_LOCK_CONFLICT";

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (initialBackoff == null || maxBackoff == null) {
            throw new IllegalArgumentException("backoff durations are required");
        }
        if (initialBackoff.isNegative() || maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("need 0 <= initialBackoff <= maxBackoff");
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1.0");
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitterFactor must be in [0, 1]");
        }
        retryOn = retryOn == null ? Set.of() : Set.copyOf(retryOn);
    }

    /**
     * Five attempts, 20ms doubling up to 1s, retrying lock conflicts only.
     */
    public static RetryPolicy transactions() {
        return builder().build();
    }

    /**
     * One attempt; the first conflict surfaces as contention.
     */
    public static RetryPolicy singleAttempt() {
        return builder()
            .maxAttempts(1)
            .initialBackoff(Duration.ZERO)
            .maxBackoff(Duration.ZERO)
            .backoffMultiplier(1.0)
            .jitterFactor(0.0)
            .build();
    }

    /**
     * Whether a failure with this error code is a conflict to re-run.
     */
    public boolean retries(String errorCode) {
        return errorCode != null && retryOn.contains(errorCode);
    }

    /**
     * @param attemptsMade attempts already run, counting from 1
     */
    public boolean allowsAnotherAttempt(int attemptsMade) {
        return attemptsMade < maxAttempts;
    }

    /**
     * Wait after the given failed attempt: initialBackoff grown by the multiplier
     * per earlier attempt, capped at maxBackoff, then spread by +/- jitterFactor.
     */
    public Duration backoffAfter(int failedAttempt) {
        if (failedAttempt < 1) {
            throw new IllegalArgumentException("failedAttempt must be >= 1, got " + failedAttempt);
        }
        double grown = initialBackoff.toMillis() * Math.pow(backoffMultiplier, failedAttempt - 1);
        double capped = Math.min(grown, maxBackoff.toMillis());
        if (jitterFactor == 0.0 || capped == 0.0) {
            return Duration.ofMillis((long) capped);
        }
        double spread = (ThreadLocalRandom.current().nextDouble() * 2 - 1) * jitterFactor;
        return Duration.ofMillis((long) (capped * (1 + spread)));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int maxAttempts = 5;
        private Duration initialBackoff = Duration.ofMillis(20);
        private Duration maxBackoff = Duration.ofSeconds(1);
        private double backoffMultiplier = 2.0;
        private double jitterFactor = 0.2;
        private Set<String> retryOn = Set.of(LOCK_CONFLICT);

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder initialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
            return this;
        }

        public Builder maxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
            return this;
        }

        public Builder backoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
            return this;
        }

        public Builder jitterFactor(double jitterFactor) {
            this.jitterFactor = jitterFactor;
            return this;
        }

        public Builder retryOn(Set<String> retryOn) {
            this.retryOn = retryOn;
            return this;
        }

        public RetryPolicy build() {
            return new RetryPolicy(maxAttempts, initialBackoff, maxBackoff, backoffMultiplier, jitterFactor, retryOn);
        }
    }
}
