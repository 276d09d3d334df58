package com.gradeledger.engine.coordinator;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gradeledger.core.exception.ConflictException;
import com.gradeledger.core.exception.NotFoundException;
import com.gradeledger.core.exception.ValidationException;
import com.gradeledger.core.model.Actor;
import com.gradeledger.core.model.AggregateKind;
import com.gradeledger.core.model.AuditEntry;
import com.gradeledger.core.model.EventAggregate;
import com.gradeledger.core.model.EventType;
import com.gradeledger.core.model.GradeRecord;
import com.gradeledger.core.model.GradeSource;
import com.gradeledger.core.model.GradebookEntry;
import com.gradeledger.core.model.SourceType;
import com.gradeledger.core.model.Submission;
import com.gradeledger.core.repository.GradeRepository;
import com.gradeledger.core.repository.GradebookRepository;
import com.gradeledger.engine.audit.AuditLogWriter;
import com.gradeledger.engine.coordinator.GradeApplier.AppliedGrade;
import com.gradeledger.engine.coordinator.GradeApplier.PendingGrade;
import com.gradeledger.engine.ledger.DomainEventWriter;
import com.gradeledger.engine.ledger.DomainEventWriter.EmitRequest;
import com.gradeledger.engine.ledger.DomainEventWriter.Emission;
import com.gradeledger.engine.logging.LoggingContext;
import com.gradeledger.engine.metrics.LedgerMetrics;
import com.gradeledger.engine.service.GradebookService;
import com.gradeledger.engine.tx.TransactionRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keeps each student's gradebook totals in lockstep with their grade records.
 * 
 * <p>Every grade write reads prior state, computes deltas from it, writes the
 * grade record and the gradebook entry and emits exactly one event in a single
 * optimistic transaction. Conflicting writers are re-run with fresh reads.</p>
 */
public class GradebookCoordinator implements GradebookService {

    private static final Logger log = LoggerFactory.getLogger(GradebookCoordinator.class);

    static final double DRIFT_EPSILON = 1e-9;

    private final TransactionRunner transactionRunner;
    private final DomainEventWriter eventWriter;
    private final GradeRepository gradeRepository;
    private final GradebookRepository gradebookRepository;
    private final AuditLogWriter auditLog;
    private final LedgerMetrics metrics;
    private final Clock clock;
    private final GradeApplier gradeApplier;

    public GradebookCoordinator(
            TransactionRunner transactionRunner,
            DomainEventWriter eventWriter,
            GradeRepository gradeRepository,
            GradebookRepository gradebookRepository,
            AuditLogWriter auditLog,
            LedgerMetrics metrics,
            Clock clock) {
        this.transactionRunner = transactionRunner;
        this.eventWriter = eventWriter;
        this.gradeRepository = gradeRepository;
        this.gradebookRepository = gradebookRepository;
        this.auditLog = auditLog;
        this.metrics = metrics;
        this.clock = clock;
        this.gradeApplier = new GradeApplier(eventWriter, clock);
    }

    @Override
    public GradeMutation setGrade(SetGradeRequest request) {
        ValidatedGrade input = validateSetGrade(request);
        String gradeId = GradeRecord.idFor(input.sourceType(), input.sourceId(), input.studentId());

        try (var ctx = LoggingContext.forGrade(input.courseId(), input.studentId(), gradeId, request.requestId())) {
            log.info("Setting grade {} to {}/{}", gradeId, input.score(), input.pointsPossible());

            AppliedGrade applied = transactionRunner.execute("setGrade", tx -> {
                GradeSource source = tx.readSource(input.courseId(), input.sourceType(), input.sourceId())
                    .orElseThrow(() -> new NotFoundException("GradeSource",
                        input.sourceType().wireName() + ":" + input.sourceId()));
                if (Math.abs(source.pointsPossible() - input.pointsPossible()) > DRIFT_EPSILON) {
                    throw new ValidationException("pointsPossible",
                        "does not match the source (" + source.pointsPossible() + ")");
                }

                Submission submission = null;
                int sourceVersion = source.version();
                if (input.sourceType() == SourceType.ASSIGNMENT) {
                    submission = tx.readSubmission(input.courseId(), input.sourceId(), input.studentId())
                        .orElseThrow(() -> new NotFoundException("Submission",
                            input.sourceId() + ":" + input.studentId()));
                    sourceVersion = submission.assignmentVersion();
                }

                PendingGrade pending = gradeApplier.prepare(tx, source, sourceVersion, input.studentId(),
                    input.score(), input.feedback(), request.actor(), request.requestId());

                if (submission != null) {
                    tx.putSubmission(submission.graded(input.score(), pending.revision(), clock.instant()));
                }
                return gradeApplier.write(tx, pending);
            });

            GradeMutation mutation = applied.mutation();
            eventWriter.recordCommitted(applied.emission());
            metrics.gradeMutated(input.sourceType().wireName(), applied.firstGrade());

            log.info("Grade {} now at revision {} (totals {}/{})",
                gradeId, mutation.after().gradeRevision(),
                mutation.gradebook().totalScore(), mutation.gradebook().totalPossible());

            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("courseId", input.courseId());
            metadata.put("sourceType", input.sourceType().wireName());
            metadata.put("sourceId", input.sourceId());
            metadata.put("score", input.score());
            metadata.put("gradeRevision", mutation.after().gradeRevision());
            metadata.put("eventId", mutation.event().eventId());
            auditLog.record(AuditEntry.GRADE_SET, request.actor(), input.studentId(), request.requestId(), metadata);

            return mutation;
        }
    }

    @Override
    public GradebookRecomputation recomputeStudent(RecomputeRequest request) {
        if (request == null) {
            throw new ValidationException("request", "cannot be null");
        }
        String courseId = InputSanitizer.requireId("courseId", request.courseId());
        String studentId = InputSanitizer.requireId("studentId", request.studentId());
        requireActor(request.actor());
        String reason = InputSanitizer.sanitizeReason(request.reason());

        try (var ctx = LoggingContext.forStudent(courseId, studentId, request.requestId())) {
            log.info("Recomputing gradebook (reconcile={}, reason={})", request.reconcile(), reason);

            RecomputeOutcome outcome = transactionRunner.execute("recomputeStudent", tx -> {
                List<GradeRecord> grades = tx.readGradesForStudent(courseId, studentId, MAX_RECOMPUTE_GRADES + 1);
                if (grades.size() > MAX_RECOMPUTE_GRADES) {
                    throw new ConflictException(
                        "Too many grade records to recompute for " + studentId + " (limit " + MAX_RECOMPUTE_GRADES + ")");
                }

                double totalScore = 0.0;
                double totalPossible = 0.0;
                for (GradeRecord grade : grades) {
                    totalScore += grade.score();
                    totalPossible += grade.pointsPossible();
                }

                GradebookEntry live = tx.readGradebook(courseId, studentId)
                    .orElse(GradebookEntry.empty(courseId, studentId));
                double deltaScore = totalScore - live.totalScore();
                double deltaPossible = totalPossible - live.totalPossible();
                boolean drift = Math.abs(deltaScore) > DRIFT_EPSILON || Math.abs(deltaPossible) > DRIFT_EPSILON;

                if (request.reconcile()) {
                    tx.putGradebook(live.withTotals(totalScore, totalPossible, clock.instant()));
                }

                ObjectNode payload = JsonNodeFactory.instance.objectNode();
                payload.put("courseId", courseId);
                payload.put("studentId", studentId);
                payload.put("gradeCount", grades.size());
                payload.put("totalScore", totalScore);
                payload.put("totalPossible", totalPossible);
                payload.put("liveTotalScore", live.totalScore());
                payload.put("liveTotalPossible", live.totalPossible());
                payload.put("deltaTotalScore", deltaScore);
                payload.put("deltaTotalPossible", deltaPossible);
                payload.put("driftFlagged", drift);
                payload.put("reconciled", request.reconcile());
                if (reason != null) {
                    payload.put("reason", reason);
                } else {
                    payload.putNull("reason");
                }

                // Reports carry the UTC day so drift that persists is reported again each day.
                String idempotencyKey = String.join(":",
                    EventType.GRADEBOOK_STUDENT_RECOMPUTED.wireName(),
                    courseId,
                    studentId,
                    "s" + plain(totalScore),
                    "p" + plain(totalPossible),
                    "ls" + plain(live.totalScore()),
                    "lp" + plain(live.totalPossible()),
                    request.reconcile()
                        ? "reconcile"
                        : "report:d" + LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC));

                Emission emission = eventWriter.append(tx, new EmitRequest(
                    EventType.GRADEBOOK_STUDENT_RECOMPUTED.wireName(),
                    courseId,
                    request.actor(),
                    EventAggregate.unversioned(AggregateKind.GRADEBOOK, studentId),
                    payload,
                    idempotencyKey,
                    request.requestId()
                ));

                GradebookRecomputation result = new GradebookRecomputation(
                    courseId, studentId, grades.size(),
                    totalScore, totalPossible,
                    live.totalScore(), live.totalPossible(),
                    deltaScore, deltaPossible,
                    drift, request.reconcile(),
                    emission.event());
                return new RecomputeOutcome(result, emission);
            });

            GradebookRecomputation result = outcome.result();
            eventWriter.recordCommitted(outcome.emission());
            metrics.gradebookRecomputed(request.reconcile());
            if (result.driftFlagged()) {
                metrics.gradebookDrift(courseId);
                log.warn("Gradebook drift for {}: score {} (live {}), possible {} (live {}){}",
                    studentId, result.totalScore(), result.liveTotalScore(),
                    result.totalPossible(), result.liveTotalPossible(),
                    result.reconciled() ? ", reconciled" : ", left for review");
            }

            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("courseId", courseId);
            metadata.put("studentId", studentId);
            metadata.put("before", Map.of(
                "totalScore", result.liveTotalScore(), "totalPossible", result.liveTotalPossible()));
            metadata.put("after", Map.of(
                "totalScore", result.totalScore(), "totalPossible", result.totalPossible()));
            metadata.put("driftFlagged", result.driftFlagged());
            metadata.put("reconciled", result.reconciled());
            metadata.put("reason", reason);
            auditLog.record(AuditEntry.GRADEBOOK_RECOMPUTE, request.actor(), studentId, request.requestId(), metadata);

            return result;
        }
    }

    @Override
    public GradebookEntry getGradebook(String courseId, String studentId) {
        String course = InputSanitizer.requireId("courseId", courseId);
        String student = InputSanitizer.requireId("studentId", studentId);
        return gradebookRepository.find(course, student)
            .orElse(GradebookEntry.empty(course, student));
    }

    @Override
    public List<GradeRecord> getGrades(String courseId, String studentId) {
        return gradeRepository.findByStudent(
            InputSanitizer.requireId("courseId", courseId),
            InputSanitizer.requireId("studentId", studentId));
    }

    // ========== Internal Methods ==========

    private ValidatedGrade validateSetGrade(SetGradeRequest request) {
        if (request == null) {
            throw new ValidationException("request", "cannot be null");
        }
        String courseId = InputSanitizer.requireId("courseId", request.courseId());
        if (request.sourceType() == null) {
            throw new ValidationException("sourceType", "must be assignment or test");
        }
        String sourceId = InputSanitizer.requireId("sourceId", request.sourceId());
        String studentId = InputSanitizer.requireId("studentId", request.studentId());
        double pointsPossible = InputSanitizer.requirePoints("pointsPossible", request.pointsPossible());
        double score = InputSanitizer.requirePoints("score", request.score());
        if (score > pointsPossible) {
            throw new ValidationException("score", "cannot exceed pointsPossible (" + pointsPossible + ")");
        }
        requireActor(request.actor());
        String feedback = InputSanitizer.sanitizeFeedback(request.feedback());
        return new ValidatedGrade(courseId, request.sourceType(), sourceId, studentId, score, pointsPossible, feedback);
    }

    static void requireActor(Actor actor) {
        if (actor == null || actor.isBlank()) {
            throw new ValidationException("actor", "uid and role are required");
        }
    }

    private static String plain(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    private record ValidatedGrade(
        String courseId,
        SourceType sourceType,
        String sourceId,
        String studentId,
        double score,
        double pointsPossible,
        String feedback
    ) {}

    private record RecomputeOutcome(GradebookRecomputation result, Emission emission) {}
}
