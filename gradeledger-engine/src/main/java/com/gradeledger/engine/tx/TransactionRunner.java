package com.gradeledger.engine.tx;

import com.gradeledger.core.exception.GradeLedgerException;
import com.gradeledger.core.exception.TransactionContentionException;
import com.gradeledger.core.model.RetryPolicy;
import com.gradeledger.core.repository.TransactionWork;
import com.gradeledger.core.repository.TransactionalStore;
import com.gradeledger.engine.metrics.LedgerMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Runs transaction bodies against the store, re-running the whole body with
 * fresh reads when the store reports a conflict.
 * 
 * <p>Only errors the retry policy names are retried. Validation, not-found and
 * conflict errors raised by the body abort immediately with nothing committed.</p>
 */
public class TransactionRunner {

    private static final Logger log = LoggerFactory.getLogger(TransactionRunner.class);

    private final TransactionalStore store;
    private final RetryPolicy retryPolicy;
    private final LedgerMetrics metrics;

    public TransactionRunner(TransactionalStore store, RetryPolicy retryPolicy, LedgerMetrics metrics) {
        this.store = store;
        this.retryPolicy = retryPolicy;
        this.metrics = metrics;
    }

    /**
     * Execute the work, retrying on optimistic lock conflicts.
     * 
     * @param operation Name used in logs and metrics
     * @param work The transaction body
     * @return The committed result
     * @throws TransactionContentionException if every attempt conflicted
     */
    public <T> T execute(String operation, TransactionWork<T> work) {
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                T result = store.execute(work);
                if (attempt > 1) {
                    log.debug("Transaction {} committed on attempt {}", operation, attempt);
                }
                return result;
            } catch (GradeLedgerException e) {
                if (!retryPolicy.retries(e.getErrorCode())) {
                    throw e;
                }
                metrics.transactionConflict(operation, attempt);

                if (!retryPolicy.allowsAnotherAttempt(attempt)) {
                    metrics.transactionExhausted(operation);
                    log.warn("Transaction {} gave up after {} attempts: {}", operation, attempt, e.getMessage());
                    throw new TransactionContentionException(operation, attempt, e);
                }

                Duration backoff = retryPolicy.backoffAfter(attempt);
                log.debug("Transaction {} conflicted on attempt {}, retrying in {}ms: {}",
                    operation, attempt, backoff.toMillis(), e.getMessage());
                sleep(operation, attempt, backoff, e);
            }
        }
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    private void sleep(String operation, int attempt, Duration backoff, GradeLedgerException cause) {
        if (backoff.isZero()) {
            return;
        }
        try {
            Thread.sleep(backoff.toMillis());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new TransactionContentionException(operation, attempt, cause);
        }
    }
}
