package com.gradeledger.engine.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

/**
 * Micrometer counters for the ledger and the gradebook aggregator.
 * 
 * Metrics exposed:
 * - Events emitted and duplicate emits by type
 * - Grade mutations by source type
 * - Transaction conflicts and exhausted retries by operation
 * - Gradebook drift found by recompute
 * - Audit write failures
 */
public class LedgerMetrics {

    // Metric names
    public static final String EVENTS_EMITTED = "gradeledger.events.emitted";
    public static final String EVENTS_DUPLICATE = "gradeledger.events.duplicate";
    public static final String GRADE_MUTATIONS = "gradeledger.grades.mutated";
    public static final String TX_CONFLICTS = "gradeledger.transactions.conflicts";
    public static final String TX_EXHAUSTED = "gradeledger.transactions.exhausted";
    public static final String GRADEBOOK_RECOMPUTES = "gradeledger.gradebook.recomputes";
    public static final String GRADEBOOK_DRIFT = "gradeledger.gradebook.drift";
    public static final String AUDIT_FAILURES = "gradeledger.audit.failures";

    private final MeterRegistry registry;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Metrics backed by a private registry, for tests and the dev harness.
     */
    public static LedgerMetrics detached() {
        return new LedgerMetrics(new SimpleMeterRegistry());
    }

    public MeterRegistry registry() {
        return registry;
    }

    // ========== Ledger ==========

    public void eventEmitted(String type) {
        Counter.builder(EVENTS_EMITTED)
            .tag("type", type)
            .description("Domain events written to the ledger")
            .register(registry)
            .increment();
    }

    public void eventDuplicate(String type) {
        Counter.builder(EVENTS_DUPLICATE)
            .tag("type", type)
            .description("Emits answered with an already stored event")
            .register(registry)
            .increment();
    }

    // ========== Gradebook ==========

    public void gradeMutated(String sourceType, boolean firstGrade) {
        Counter.builder(GRADE_MUTATIONS)
            .tag("source_type", sourceType)
            .tag("first_grade", String.valueOf(firstGrade))
            .description("Committed grade writes")
            .register(registry)
            .increment();
    }

    public void gradebookRecomputed(boolean reconcile) {
        Counter.builder(GRADEBOOK_RECOMPUTES)
            .tag("reconcile", String.valueOf(reconcile))
            .description("Full gradebook recomputes")
            .register(registry)
            .increment();
    }

    public void gradebookDrift(String courseId) {
        Counter.builder(GRADEBOOK_DRIFT)
            .tag("course", courseId)
            .description("Recomputes that found live totals out of line with grade records")
            .register(registry)
            .increment();
    }

    // ========== Transactions ==========

    public void transactionConflict(String operation, int attempt) {
        Counter.builder(TX_CONFLICTS)
            .tag("operation", operation)
            .tag("attempt", String.valueOf(attempt))
            .description("Optimistic transaction attempts aborted by a concurrent writer")
            .register(registry)
            .increment();
    }

    public void transactionExhausted(String operation) {
        Counter.builder(TX_EXHAUSTED)
            .tag("operation", operation)
            .description("Transactions that ran out of retries")
            .register(registry)
            .increment();
    }

    // ========== Audit ==========

    public void auditFailed(String action) {
        Counter.builder(AUDIT_FAILURES)
            .tag("action", action)
            .description("Audit entries that could not be written")
            .register(registry)
            .increment();
    }

    /**
     * Sum of every counter with this name and these tag key/value pairs.
     */
    public double count(String name, String... tags) {
        return registry.find(name).tags(tags).counters().stream()
            .mapToDouble(Counter::count)
            .sum();
    }
}
