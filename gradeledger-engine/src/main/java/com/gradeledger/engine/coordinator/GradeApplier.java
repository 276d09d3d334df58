package com.gradeledger.engine.coordinator;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gradeledger.core.model.Actor;
import com.gradeledger.core.model.AggregateKind;
import com.gradeledger.core.model.EventAggregate;
import com.gradeledger.core.model.EventType;
import com.gradeledger.core.model.GradeRecord;
import com.gradeledger.core.model.GradeSnapshot;
import com.gradeledger.core.model.GradeSource;
import com.gradeledger.core.model.GradebookEntry;
import com.gradeledger.core.repository.LedgerTransaction;
import com.gradeledger.engine.ledger.DomainEventWriter;
import com.gradeledger.engine.ledger.DomainEventWriter.EmitRequest;
import com.gradeledger.engine.ledger.DomainEventWriter.Emission;
import com.gradeledger.engine.service.GradebookService.GradeMutation;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * The grade step shared by direct grading and test attempt submission.
 * 
 * <p>Split in two so callers can finish all their reads before any write:
 * {@link #prepare} reads the grade record and gradebook entry and computes the
 * deltas, {@link #write} stores both and emits {@code grade.mutated}.</p>
 */
class GradeApplier {

    private final DomainEventWriter eventWriter;
    private final Clock clock;

    GradeApplier(DomainEventWriter eventWriter, Clock clock) {
        this.eventWriter = eventWriter;
        this.clock = clock;
    }

    PendingGrade prepare(LedgerTransaction tx, GradeSource source, int sourceVersion, String studentId,
                         double score, String feedback, Actor grader, String requestId) {
        String gradeId = GradeRecord.idFor(source.sourceType(), source.sourceId(), studentId);
        Optional<GradeRecord> prior = tx.readGrade(source.courseId(), gradeId);
        GradebookEntry entry = tx.readGradebook(source.courseId(), studentId)
            .orElse(GradebookEntry.empty(source.courseId(), studentId));

        GradeSnapshot before = prior.map(GradeRecord::snapshot).orElse(GradeSnapshot.UNGRADED);
        double deltaScore = score - (before.isGraded() ? before.score() : 0.0);
        // possible points count once per source, on its first grade
        double deltaPossible = prior.isPresent() ? 0.0 : source.pointsPossible();

        Instant now = clock.instant();
        GradeRecord updated = new GradeRecord(
            source.courseId(),
            studentId,
            source.sourceType(),
            source.sourceId(),
            sourceVersion,
            score,
            source.pointsPossible(),
            feedback,
            grader.uid(),
            before.gradeRevision() + 1,
            now
        );
        return new PendingGrade(updated, before, entry.applyDelta(deltaScore, deltaPossible, now),
            deltaScore, deltaPossible, grader, requestId);
    }

    AppliedGrade write(LedgerTransaction tx, PendingGrade pending) {
        GradeRecord grade = pending.grade();
        tx.putGrade(grade);
        tx.putGradebook(pending.gradebook());

        ObjectNode payload = JsonNodeFactory.instance.objectNode();
        payload.put("courseId", grade.courseId());
        payload.put("sourceType", grade.sourceType().wireName());
        payload.put("sourceId", grade.sourceId());
        payload.put("studentId", grade.studentId());
        payload.put("sourceVersion", grade.sourceVersion());
        payload.put("pointsPossible", grade.pointsPossible());
        ObjectNode before = payload.putObject("before");
        if (pending.before().isGraded()) {
            before.put("score", pending.before().score());
        } else {
            before.putNull("score");
        }
        before.put("gradeRevision", pending.before().gradeRevision());
        ObjectNode after = payload.putObject("after");
        after.put("score", grade.score());
        after.put("gradeRevision", grade.gradeRevision());
        payload.put("deltaScore", pending.deltaScore());
        payload.put("deltaPossible", pending.deltaPossible());

        String idempotencyKey = String.format("%s:%s:%s:%s:%s:r%d",
            EventType.GRADE_MUTATED.wireName(),
            grade.sourceType().wireName(),
            grade.courseId(),
            grade.sourceId(),
            grade.studentId(),
            grade.gradeRevision());

        Emission emission = eventWriter.append(tx, new EmitRequest(
            EventType.GRADE_MUTATED.wireName(),
            grade.courseId(),
            pending.grader(),
            EventAggregate.of(AggregateKind.GRADE, grade.gradeId(), grade.gradeRevision()),
            payload,
            idempotencyKey,
            pending.requestId()
        ));

        GradeMutation mutation = new GradeMutation(
            grade, pending.before(), grade.snapshot(), pending.gradebook(), emission.event());
        return new AppliedGrade(mutation, emission, !pending.before().isGraded());
    }

    record PendingGrade(
        GradeRecord grade,
        GradeSnapshot before,
        GradebookEntry gradebook,
        double deltaScore,
        double deltaPossible,
        Actor grader,
        String requestId
    ) {
        int revision() {
            return grade.gradeRevision();
        }
    }

    record AppliedGrade(GradeMutation mutation, Emission emission, boolean firstGrade) {}
}
