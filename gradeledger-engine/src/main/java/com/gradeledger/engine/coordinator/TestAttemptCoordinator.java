package com.gradeledger.engine.coordinator;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gradeledger.core.exception.ConflictException;
import com.gradeledger.core.exception.NotFoundException;
import com.gradeledger.core.exception.ValidationException;
import com.gradeledger.core.model.Actor;
import com.gradeledger.core.model.AggregateKind;
import com.gradeledger.core.model.AttemptStatus;
import com.gradeledger.core.model.AuditEntry;
import com.gradeledger.core.model.EventAggregate;
import com.gradeledger.core.model.EventType;
import com.gradeledger.core.model.GradeSource;
import com.gradeledger.core.model.SourceType;
import com.gradeledger.core.model.TestAttempt;
import com.gradeledger.core.model.TestSettings;
import com.gradeledger.core.repository.LedgerTransaction;
import com.gradeledger.engine.audit.AuditLogWriter;
import com.gradeledger.engine.coordinator.GradeApplier.AppliedGrade;
import com.gradeledger.engine.coordinator.GradeApplier.PendingGrade;
import com.gradeledger.engine.ledger.DomainEventWriter;
import com.gradeledger.engine.ledger.DomainEventWriter.EmitRequest;
import com.gradeledger.engine.ledger.DomainEventWriter.Emission;
import com.gradeledger.engine.logging.LoggingContext;
import com.gradeledger.engine.metrics.LedgerMetrics;
import com.gradeledger.engine.service.GradebookService.GradeMutation;
import com.gradeledger.engine.service.TestAttemptService;
import com.gradeledger.engine.tx.TransactionRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Test attempt lifecycle. Submitting an attempt of a scheduled test grades it
 * through the gradebook in the same transaction.
 */
public class TestAttemptCoordinator implements TestAttemptService {

    private static final Logger log = LoggerFactory.getLogger(TestAttemptCoordinator.class);

    private final TransactionRunner transactionRunner;
    private final DomainEventWriter eventWriter;
    private final AuditLogWriter auditLog;
    private final LedgerMetrics metrics;
    private final Clock clock;
    private final GradeApplier gradeApplier;

    public TestAttemptCoordinator(
            TransactionRunner transactionRunner,
            DomainEventWriter eventWriter,
            AuditLogWriter auditLog,
            LedgerMetrics metrics,
            Clock clock) {
        this.transactionRunner = transactionRunner;
        this.eventWriter = eventWriter;
        this.auditLog = auditLog;
        this.metrics = metrics;
        this.clock = clock;
        this.gradeApplier = new GradeApplier(eventWriter, clock);
    }

    @Override
    public AttemptStarted startAttempt(String courseId, String testId, Actor student, String requestId) {
        String course = InputSanitizer.requireId("courseId", courseId);
        String test = InputSanitizer.requireId("testId", testId);
        GradebookCoordinator.requireActor(student);

        try (var ctx = LoggingContext.forStudent(course, student.uid(), requestId)) {
            Started started = transactionRunner.execute("startAttempt", tx -> {
                Instant now = clock.instant();
                GradeSource source = readTest(tx, course, test);
                TestSettings settings = source.testSettings();

                if (!settings.isWindowOpen(now)) {
                    throw new ConflictException("Test window is not open for " + test);
                }

                List<TestAttempt> used = tx.readAttemptsForStudent(course, test, student.uid());
                if (used.size() >= settings.attemptsAllowed()) {
                    throw new ConflictException("No remaining attempts for " + test
                        + " (" + used.size() + " of " + settings.attemptsAllowed() + " used)");
                }

                int attemptNo = used.size() + 1;
                String attemptId = TestAttempt.idFor(student.uid(), attemptNo);
                if (tx.readAttempt(course, test, attemptId).isPresent()) {
                    throw new ConflictException("Attempt " + attemptId + " already exists");
                }

                TestAttempt attempt = TestAttempt.start(course, test, student.uid(), attemptNo,
                    source.version(), now, settings.attemptExpiry(now));
                tx.putAttempt(attempt);

                ObjectNode payload = JsonNodeFactory.instance.objectNode();
                payload.put("courseId", course);
                payload.put("testId", test);
                payload.put("attemptId", attemptId);
                payload.put("studentId", student.uid());
                payload.put("attemptNo", attemptNo);
                payload.put("testVersion", source.version());
                payload.put("mode", settings.mode().name().toLowerCase());
                payload.put("durationMinutes", settings.durationMinutes());
                payload.put("expiresAt", attempt.expiresAt().toString());

                Emission emission = eventWriter.append(tx, new EmitRequest(
                    EventType.TEST_ATTEMPT_STARTED.wireName(),
                    course,
                    student,
                    EventAggregate.of(AggregateKind.ATTEMPT, attemptId, source.version()),
                    payload,
                    String.join(":", EventType.TEST_ATTEMPT_STARTED.wireName(), course, test, attemptId,
                        "v" + source.version()),
                    requestId
                ));
                return new Started(attempt, emission);
            });

            eventWriter.recordCommitted(started.emission());
            TestAttempt attempt = started.attempt();
            log.info("Started attempt {} of test {} (expires {})", attempt.attemptId(), test, attempt.expiresAt());

            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("courseId", course);
            metadata.put("testId", test);
            metadata.put("attemptId", attempt.attemptId());
            metadata.put("testVersion", attempt.testVersion());
            auditLog.record(AuditEntry.TEST_ATTEMPT_START, student, student.uid(), requestId, metadata);

            return new AttemptStarted(attempt, started.emission().event());
        }
    }

    @Override
    public AttemptSubmitted submitAttempt(SubmitAttemptRequest request) {
        if (request == null) {
            throw new ValidationException("request", "cannot be null");
        }
        String course = InputSanitizer.requireId("courseId", request.courseId());
        String test = InputSanitizer.requireId("testId", request.testId());
        String attemptId = InputSanitizer.requireId("attemptId", request.attemptId());
        double score = InputSanitizer.requirePoints("score", request.score());
        Actor student = request.student();
        GradebookCoordinator.requireActor(student);

        try (var ctx = LoggingContext.forStudent(course, student.uid(), request.requestId())) {
            Submitted submitted = transactionRunner.execute("submitAttempt", tx -> {
                Instant now = clock.instant();
                GradeSource source = readTest(tx, course, test);
                TestAttempt attempt = tx.readAttempt(course, test, attemptId)
                    .filter(a -> a.studentId().equals(student.uid()))
                    .orElseThrow(() -> new NotFoundException("TestAttempt", attemptId));

                if (attempt.status() != AttemptStatus.STARTED) {
                    throw new ConflictException("Attempt " + attemptId + " is not active");
                }
                if (attempt.isExpired(now)) {
                    throw new ConflictException("Attempt " + attemptId + " expired at " + attempt.expiresAt());
                }
                if (score > source.pointsPossible()) {
                    throw new ValidationException("score", "cannot exceed pointsPossible (" + source.pointsPossible() + ")");
                }

                PendingGrade pending = null;
                if (source.testSettings().isScheduled()) {
                    pending = gradeApplier.prepare(tx, source, attempt.testVersion(), student.uid(),
                        score, null, Actor.AUTO_GRADER, request.requestId());
                }

                TestAttempt done = attempt.submitted(score, now);
                tx.putAttempt(done);

                ObjectNode payload = JsonNodeFactory.instance.objectNode();
                payload.put("courseId", course);
                payload.put("testId", test);
                payload.put("attemptId", attemptId);
                payload.put("studentId", student.uid());
                payload.put("attemptNo", done.attemptNo());
                payload.put("testVersion", done.testVersion());
                payload.put("score", score);
                payload.put("pointsPossible", source.pointsPossible());
                payload.put("assessed", pending != null);

                Emission emission = eventWriter.append(tx, new EmitRequest(
                    EventType.TEST_ATTEMPT_SUBMITTED.wireName(),
                    course,
                    student,
                    EventAggregate.of(AggregateKind.ATTEMPT, attemptId, done.testVersion()),
                    payload,
                    String.join(":", EventType.TEST_ATTEMPT_SUBMITTED.wireName(), course, test, attemptId,
                        "v" + done.testVersion()),
                    request.requestId()
                ));

                AppliedGrade grade = pending != null ? gradeApplier.write(tx, pending) : null;
                return new Submitted(done, emission, grade);
            });

            eventWriter.recordCommitted(submitted.emission());
            GradeMutation mutation = null;
            if (submitted.grade() != null) {
                eventWriter.recordCommitted(submitted.grade().emission());
                metrics.gradeMutated(SourceType.TEST.wireName(), submitted.grade().firstGrade());
                mutation = submitted.grade().mutation();
            }

            TestAttempt attempt = submitted.attempt();
            log.info("Submitted attempt {} of test {} with score {}{}", attemptId, test, score,
                mutation != null ? " (grade revision " + mutation.after().gradeRevision() + ")" : "");

            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("courseId", course);
            metadata.put("testId", test);
            metadata.put("attemptId", attemptId);
            metadata.put("score", score);
            metadata.put("assessed", mutation != null);
            auditLog.record(AuditEntry.TEST_ATTEMPT_SUBMIT, student, student.uid(), request.requestId(), metadata);

            return new AttemptSubmitted(attempt, mutation, submitted.emission().event());
        }
    }

    private static GradeSource readTest(LedgerTransaction tx, String courseId, String testId) {
        GradeSource source = tx.readSource(courseId, SourceType.TEST, testId)
            .orElseThrow(() -> new NotFoundException("Test", testId));
        if (source.testSettings() == null) {
            throw new ConflictException("Test " + testId + " has no attempt settings");
        }
        return source;
    }

    private record Started(TestAttempt attempt, Emission emission) {}

    private record Submitted(TestAttempt attempt, Emission emission, AppliedGrade grade) {}
}
