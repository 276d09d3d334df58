package com.gradeledger.insights;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gradeledger.core.model.ActorRole;
import com.gradeledger.core.model.AggregateKind;
import com.gradeledger.core.model.DomainEvent;
import com.gradeledger.core.model.EventAggregate;
import com.gradeledger.core.model.EventIds;
import com.gradeledger.core.model.EventType;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Builds ledger events for analyzer tests.
 */
public final class TestEvents {

    public static final Instant NOW = Instant.parse("2026-03-02T12:00:00Z");

    private TestEvents() {
    }

    public static DomainEvent event(EventType type, String courseId, Instant at, String key,
                                    Consumer<ObjectNode> payloadWriter) {
        ObjectNode payload = JsonNodeFactory.instance.objectNode();
        payloadWriter.accept(payload);
        String idempotencyKey = type.wireName() + ":" + courseId + ":" + key;
        return new DomainEvent(
            EventIds.fromIdempotencyKey(idempotencyKey),
            type.wireName(),
            courseId,
            "u_actor",
            ActorRole.SYSTEM,
            EventAggregate.unversioned(AggregateKind.COURSE, courseId),
            payload,
            idempotencyKey,
            null,
            at);
    }

    public static DomainEvent attemptStarted(String courseId, String studentId, int attemptNo, Instant at,
                                             int durationMinutes) {
        String attemptId = studentId + "__" + attemptNo;
        return event(EventType.TEST_ATTEMPT_STARTED, courseId, at, "t1:" + attemptId, p -> {
            p.put("testId", "t1");
            p.put("attemptId", attemptId);
            p.put("studentId", studentId);
            p.put("durationMinutes", durationMinutes);
        });
    }

    public static DomainEvent attemptStarted(String courseId, String studentId, int attemptNo, Instant at,
                                             int durationMinutes, Instant expiresAt) {
        String attemptId = studentId + "__" + attemptNo;
        return event(EventType.TEST_ATTEMPT_STARTED, courseId, at, "t1:" + attemptId, p -> {
            p.put("testId", "t1");
            p.put("attemptId", attemptId);
            p.put("studentId", studentId);
            p.put("durationMinutes", durationMinutes);
            p.put("expiresAt", expiresAt.toString());
        });
    }

    public static DomainEvent attemptSubmitted(String courseId, String studentId, int attemptNo, Instant at) {
        String attemptId = studentId + "__" + attemptNo;
        return event(EventType.TEST_ATTEMPT_SUBMITTED, courseId, at, "t1:" + attemptId, p -> {
            p.put("testId", "t1");
            p.put("attemptId", attemptId);
            p.put("studentId", studentId);
        });
    }

    public static DomainEvent late(String courseId, String studentId, String assignmentId, Instant at,
                                   double lateByHours) {
        return event(EventType.SUBMISSION_LATE, courseId, at, assignmentId + ":" + studentId, p -> {
            p.put("studentId", studentId);
            p.put("assignmentId", assignmentId);
            p.put("lateByHours", lateByHours);
        });
    }

    public static DomainEvent recompute(String courseId, String studentId, Instant at, double deltaScore,
                                        double deltaPossible) {
        return event(EventType.GRADEBOOK_STUDENT_RECOMPUTED, courseId, at,
            studentId + ":" + deltaScore + ":" + deltaPossible + ":" + at, p -> {
                p.put("studentId", studentId);
                p.put("deltaTotalScore", deltaScore);
                p.put("deltaTotalPossible", deltaPossible);
                p.put("driftFlagged", Math.abs(deltaScore) > 1e-9 || Math.abs(deltaPossible) > 1e-9);
            });
    }

    public static AnalysisWindow window(List<DomainEvent> events) {
        return window(events, AnalyzerThresholds.defaults());
    }

    public static AnalysisWindow window(List<DomainEvent> events, AnalyzerThresholds thresholds) {
        List<DomainEvent> sorted = new ArrayList<>(events);
        sorted.sort(InsightAnalyzer.LEDGER_ORDER);
        return new AnalysisWindow(sorted, NOW, thresholds);
    }
}
