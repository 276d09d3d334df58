package com.gradeledger.engine.test;

import com.gradeledger.core.model.Actor;
import com.gradeledger.core.model.GradeSource;
import com.gradeledger.core.model.RetryPolicy;
import com.gradeledger.core.model.SourceType;
import com.gradeledger.core.model.TestMode;
import com.gradeledger.core.repository.TransactionalStore;
import com.gradeledger.core.time.TimeController;
import com.gradeledger.engine.audit.AuditLogWriter;
import com.gradeledger.engine.coordinator.CatalogCoordinator;
import com.gradeledger.engine.coordinator.GradebookCoordinator;
import com.gradeledger.engine.coordinator.SubmissionCoordinator;
import com.gradeledger.engine.coordinator.TestAttemptCoordinator;
import com.gradeledger.engine.ledger.DomainEventWriter;
import com.gradeledger.engine.metrics.LedgerMetrics;
import com.gradeledger.engine.persistence.memory.InMemoryAuditLogRepository;
import com.gradeledger.engine.persistence.memory.InMemoryCatalogRepository;
import com.gradeledger.engine.persistence.memory.InMemoryDomainEventRepository;
import com.gradeledger.engine.persistence.memory.InMemoryGradeRepository;
import com.gradeledger.engine.persistence.memory.InMemoryGradebookRepository;
import com.gradeledger.engine.persistence.memory.InMemoryTransactionalStore;
import com.gradeledger.engine.persistence.memory.VersionedDocumentStore;
import com.gradeledger.engine.service.CatalogService.PublishAssignmentRequest;
import com.gradeledger.engine.service.CatalogService.PublishTestRequest;
import com.gradeledger.engine.service.GradebookService.GradeMutation;
import com.gradeledger.engine.service.GradebookService.SetGradeRequest;
import com.gradeledger.engine.tx.TransactionRunner;

import java.time.Duration;
import java.time.Instant;
import java.util.function.UnaryOperator;

/**
 * Fully wired in-memory ledger on a frozen clock.
 */
public final class LedgerFixture {

    public static final Instant START = Instant.parse("2026-01-12T09:00:00Z");
    public static final String COURSE = "course_cs101";
    public static final Actor INSTRUCTOR = Actor.instructor("u_instructor");

    public final TimeController clock = TimeController.frozenAt(START);
    public final VersionedDocumentStore documents = new VersionedDocumentStore();
    public final InMemoryTransactionalStore memoryStore = new InMemoryTransactionalStore(documents);
    public final LedgerMetrics metrics = LedgerMetrics.detached();
    public final InMemoryDomainEventRepository events = new InMemoryDomainEventRepository(documents);
    public final InMemoryGradeRepository grades = new InMemoryGradeRepository(documents);
    public final InMemoryGradebookRepository gradebooks = new InMemoryGradebookRepository(documents);
    public final InMemoryCatalogRepository catalogRepository = new InMemoryCatalogRepository(documents);
    public final InMemoryAuditLogRepository auditEntries = new InMemoryAuditLogRepository();

    public final TransactionRunner runner;
    public final DomainEventWriter eventWriter;
    public final AuditLogWriter auditLog;
    public final CatalogCoordinator catalog;
    public final SubmissionCoordinator submissions;
    public final GradebookCoordinator gradebook;
    public final TestAttemptCoordinator attempts;

    private LedgerFixture(UnaryOperator<TransactionalStore> storeDecorator, RetryPolicy retryPolicy) {
        this.runner = new TransactionRunner(storeDecorator.apply(memoryStore), retryPolicy, metrics);
        this.eventWriter = new DomainEventWriter(clock, metrics);
        this.auditLog = new AuditLogWriter(auditEntries, clock, metrics);
        this.catalog = new CatalogCoordinator(runner, eventWriter, catalogRepository, auditLog, clock);
        this.submissions = new SubmissionCoordinator(runner, eventWriter, auditLog, clock);
        this.gradebook = new GradebookCoordinator(runner, eventWriter, grades, gradebooks, auditLog, metrics, clock);
        this.attempts = new TestAttemptCoordinator(runner, eventWriter, auditLog, metrics, clock);
    }

    public static LedgerFixture create() {
        return new LedgerFixture(UnaryOperator.identity(), fastRetries());
    }

    public static LedgerFixture create(UnaryOperator<TransactionalStore> storeDecorator, RetryPolicy retryPolicy) {
        return new LedgerFixture(storeDecorator, retryPolicy);
    }

    /** Many attempts with millisecond backoff, for contention tests. */
    public static RetryPolicy fastRetries() {
        return RetryPolicy.builder()
            .maxAttempts(50)
            .initialBackoff(Duration.ofMillis(1))
            .maxBackoff(Duration.ofMillis(5))
            .jitterFactor(0.5)
            .build();
    }

    // ========== Shortcuts ==========

    public GradeSource publishAssignment(String assignmentId, double points, Instant dueAt, boolean allowLate) {
        return catalog.publishAssignment(new PublishAssignmentRequest(
            COURSE, assignmentId, "Assignment " + assignmentId, points, dueAt, allowLate, INSTRUCTOR, null));
    }

    /** Ten-point practice test with one attempt. */
    public GradeSource publishTest(String testId) {
        return publishPracticeTest(testId, 10, 1);
    }

    public GradeSource publishPracticeTest(String testId, double points, int attemptsAllowed) {
        return catalog.publishTest(new PublishTestRequest(
            COURSE, testId, "Practice " + testId, points, TestMode.PRACTICE, attemptsAllowed, 0,
            null, null, INSTRUCTOR, null));
    }

    public GradeSource publishScheduledTest(String testId, double points, int attemptsAllowed,
                                            int durationMinutes, Instant windowStart, Instant windowEnd) {
        return catalog.publishTest(new PublishTestRequest(
            COURSE, testId, "Exam " + testId, points, TestMode.SCHEDULED, attemptsAllowed, durationMinutes,
            windowStart, windowEnd, INSTRUCTOR, null));
    }

    public void submit(String assignmentId, String studentId) {
        submissions.submit(COURSE, assignmentId, Actor.student(studentId), null);
    }

    public GradeMutation gradeAssignment(String assignmentId, String studentId, double score, double points) {
        return gradebook.setGrade(new SetGradeRequest(
            COURSE, SourceType.ASSIGNMENT, assignmentId, studentId, score, points, null, INSTRUCTOR, null));
    }

    public GradeMutation gradeTest(String testId, String studentId, double score, double points) {
        return gradebook.setGrade(new SetGradeRequest(
            COURSE, SourceType.TEST, testId, studentId, score, points, null, INSTRUCTOR, null));
    }
}
