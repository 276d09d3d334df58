package com.gradeledger.engine.test;

import com.gradeledger.core.exception.OptimisticLockException;
import com.gradeledger.core.repository.TransactionWork;
import com.gradeledger.core.repository.TransactionalStore;

import java.util.Random;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Store decorator that makes attempts fail as if another writer won the race.
 * 
 * <p>Example usage:</p>
 * <pre>{@code
 * ConflictInjector injector = ConflictInjector.builder()
 *     .failFirst(2)          // first two attempts conflict
 *     .withConflictRate(0.3) // then 30% of attempts conflict
 *     .build();
 * TransactionalStore flaky = injector.wrap(store);
 * }</pre>
 */
public class ConflictInjector {

    private final int failFirst;
    private final double conflictRate;
    private final Random random;
    private final AtomicBoolean enabled = new AtomicBoolean(true);
    private final AtomicInteger attempts = new AtomicInteger();
    private final AtomicInteger injected = new AtomicInteger();

    private ConflictInjector(Builder builder) {
        this.failFirst = builder.failFirst;
        this.conflictRate = builder.conflictRate;
        this.random = new Random(builder.seed);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ConflictInjector alwaysConflict() {
        return builder().withConflictRate(1.0).build();
    }

    public TransactionalStore wrap(TransactionalStore delegate) {
        return new TransactionalStore() {
            @Override
            public <T> T execute(TransactionWork<T> work) {
                int attempt = attempts.incrementAndGet();
                if (enabled.get() && (attempt <= failFirst || shouldConflict())) {
                    injected.incrementAndGet();
                    throw new OptimisticLockException("Injected conflict on attempt " + attempt);
                }
                return delegate.execute(work);
            }
        };
    }

    public void disable() {
        enabled.set(false);
    }

    public int getAttemptCount() {
        return attempts.get();
    }

    public int getInjectedCount() {
        return injected.get();
    }

    private synchronized boolean shouldConflict() {
        return conflictRate > 0 && random.nextDouble() < conflictRate;
    }

    public static class Builder {
        private int failFirst = 0;
        private double conflictRate = 0.0;
        private long seed = 42L;

        public Builder failFirst(int count) {
            this.failFirst = count;
            return this;
        }

        public Builder withConflictRate(double rate) {
            if (rate < 0 || rate > 1) {
                throw new IllegalArgumentException("Conflict rate must be between 0 and 1");
            }
            this.conflictRate = rate;
            return this;
        }

        public Builder withSeed(long seed) {
            this.seed = seed;
            return this;
        }

        public ConflictInjector build() {
            return new ConflictInjector(this);
        }
    }
}
