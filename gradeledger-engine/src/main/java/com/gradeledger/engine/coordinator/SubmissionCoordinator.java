package com.gradeledger.engine.coordinator;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gradeledger.core.exception.ConflictException;
import com.gradeledger.core.exception.NotFoundException;
import com.gradeledger.core.model.Actor;
import com.gradeledger.core.model.AggregateKind;
import com.gradeledger.core.model.AuditEntry;
import com.gradeledger.core.model.DomainEvent;
import com.gradeledger.core.model.EventAggregate;
import com.gradeledger.core.model.EventType;
import com.gradeledger.core.model.GradeSource;
import com.gradeledger.core.model.SourceType;
import com.gradeledger.core.model.Submission;
import com.gradeledger.engine.audit.AuditLogWriter;
import com.gradeledger.engine.ledger.DomainEventWriter;
import com.gradeledger.engine.ledger.DomainEventWriter.EmitRequest;
import com.gradeledger.engine.ledger.DomainEventWriter.Emission;
import com.gradeledger.engine.logging.LoggingContext;
import com.gradeledger.engine.service.SubmissionService;
import com.gradeledger.engine.tx.TransactionRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Records assignment submissions and flags late ones in the ledger.
 */
public class SubmissionCoordinator implements SubmissionService {

    private static final Logger log = LoggerFactory.getLogger(SubmissionCoordinator.class);

    private final TransactionRunner transactionRunner;
    private final DomainEventWriter eventWriter;
    private final AuditLogWriter auditLog;
    private final Clock clock;

    public SubmissionCoordinator(
            TransactionRunner transactionRunner,
            DomainEventWriter eventWriter,
            AuditLogWriter auditLog,
            Clock clock) {
        this.transactionRunner = transactionRunner;
        this.eventWriter = eventWriter;
        this.auditLog = auditLog;
        this.clock = clock;
    }

    @Override
    public SubmissionResult submit(String courseId, String assignmentId, Actor student, String requestId) {
        String course = InputSanitizer.requireId("courseId", courseId);
        String assignment = InputSanitizer.requireId("assignmentId", assignmentId);
        GradebookCoordinator.requireActor(student);

        try (var ctx = LoggingContext.forStudent(course, student.uid(), requestId)) {
            Outcome outcome = transactionRunner.execute("submitAssignment", tx -> {
                Instant now = clock.instant();
                GradeSource source = tx.readSource(course, SourceType.ASSIGNMENT, assignment)
                    .orElseThrow(() -> new NotFoundException("Assignment", assignment));

                boolean late = source.isLate(now);
                if (late && !source.allowLate()) {
                    throw new ConflictException("Late submissions are not allowed for " + assignment);
                }

                Submission submission = tx.readSubmission(course, assignment, student.uid())
                    .map(existing -> existing.resubmitted(source.version(), now, late))
                    .orElse(Submission.first(course, assignment, student.uid(), source.version(), now, late));
                tx.putSubmission(submission);

                EventAggregate aggregate = EventAggregate.of(
                    AggregateKind.SUBMISSION, assignment + ":" + student.uid(), source.version());
                String keySuffix = course + ":" + assignment + ":" + student.uid() + ":v" + source.version();

                ObjectNode payload = JsonNodeFactory.instance.objectNode();
                payload.put("courseId", course);
                payload.put("assignmentId", assignment);
                payload.put("studentId", student.uid());
                payload.put("assignmentVersion", source.version());
                payload.put("status", submission.status().name().toLowerCase());
                payload.put("late", late);

                Emission submitted = eventWriter.append(tx, new EmitRequest(
                    EventType.SUBMISSION_SUBMITTED.wireName(),
                    course,
                    student,
                    aggregate,
                    payload,
                    EventType.SUBMISSION_SUBMITTED.wireName() + ":" + keySuffix,
                    requestId
                ));

                Emission lateEmission = null;
                if (late) {
                    ObjectNode latePayload = JsonNodeFactory.instance.objectNode();
                    latePayload.put("courseId", course);
                    latePayload.put("assignmentId", assignment);
                    latePayload.put("studentId", student.uid());
                    latePayload.put("dueAt", source.dueAt().toString());
                    latePayload.put("submittedAt", now.toString());
                    latePayload.put("lateByHours", lateByHours(source.dueAt(), now));

                    lateEmission = eventWriter.append(tx, new EmitRequest(
                        EventType.SUBMISSION_LATE.wireName(),
                        course,
                        student,
                        aggregate,
                        latePayload,
                        EventType.SUBMISSION_LATE.wireName() + ":" + keySuffix,
                        requestId
                    ));
                }
                return new Outcome(submission, submitted, lateEmission);
            });

            eventWriter.recordCommitted(outcome.submitted());
            DomainEvent lateEvent = null;
            if (outcome.late() != null) {
                eventWriter.recordCommitted(outcome.late());
                lateEvent = outcome.late().event();
            }

            Submission submission = outcome.submission();
            log.info("Submission for {} is {}{}", assignment,
                submission.status().name().toLowerCase(), submission.late() ? " (late)" : "");

            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("courseId", course);
            metadata.put("assignmentId", assignment);
            metadata.put("status", submission.status().name().toLowerCase());
            metadata.put("late", submission.late());
            metadata.put("assignmentVersion", submission.assignmentVersion());
            auditLog.record(AuditEntry.SUBMISSION_SUBMIT, student, student.uid(), requestId, metadata);

            return new SubmissionResult(submission, outcome.submitted().event(), lateEvent);
        }
    }

    static double lateByHours(Instant dueAt, Instant submittedAt) {
        long minutes = Duration.between(dueAt, submittedAt).toMinutes();
        return Math.round(minutes / 60.0 * 100.0) / 100.0;
    }

    private record Outcome(Submission submission, Emission submitted, Emission late) {}
}
