package com.gradeledger.engine.coordinator;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gradeledger.core.exception.ValidationException;
import com.gradeledger.core.model.Actor;
import com.gradeledger.core.model.AggregateKind;
import com.gradeledger.core.model.AuditEntry;
import com.gradeledger.core.model.EventAggregate;
import com.gradeledger.core.model.EventType;
import com.gradeledger.core.model.GradeSource;
import com.gradeledger.core.model.SourceType;
import com.gradeledger.core.model.TestMode;
import com.gradeledger.core.model.TestSettings;
import com.gradeledger.core.repository.CatalogRepository;
import com.gradeledger.engine.audit.AuditLogWriter;
import com.gradeledger.engine.ledger.DomainEventWriter;
import com.gradeledger.engine.ledger.DomainEventWriter.EmitRequest;
import com.gradeledger.engine.ledger.DomainEventWriter.Emission;
import com.gradeledger.engine.logging.LoggingContext;
import com.gradeledger.engine.service.CatalogService;
import com.gradeledger.engine.tx.TransactionRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Publishes assignments and tests as versioned grade sources.
 */
public class CatalogCoordinator implements CatalogService {

    private static final Logger log = LoggerFactory.getLogger(CatalogCoordinator.class);

    static final int MAX_TITLE_LENGTH = 200;

    private final TransactionRunner transactionRunner;
    private final DomainEventWriter eventWriter;
    private final CatalogRepository catalogRepository;
    private final AuditLogWriter auditLog;
    private final Clock clock;

    public CatalogCoordinator(
            TransactionRunner transactionRunner,
            DomainEventWriter eventWriter,
            CatalogRepository catalogRepository,
            AuditLogWriter auditLog,
            Clock clock) {
        this.transactionRunner = transactionRunner;
        this.eventWriter = eventWriter;
        this.catalogRepository = catalogRepository;
        this.auditLog = auditLog;
        this.clock = clock;
    }

    @Override
    public GradeSource publishAssignment(PublishAssignmentRequest request) {
        if (request == null) {
            throw new ValidationException("request", "cannot be null");
        }
        String courseId = InputSanitizer.requireId("courseId", request.courseId());
        String assignmentId = InputSanitizer.requireId("assignmentId", request.assignmentId());
        String title = validateTitle(request.title());
        double pointsPossible = InputSanitizer.requirePoints("pointsPossible", request.pointsPossible());
        GradebookCoordinator.requireActor(request.actor());

        try (var ctx = LoggingContext.forCourse(courseId, request.requestId())) {
            Published published = transactionRunner.execute("publishAssignment", tx -> {
                Instant now = clock.instant();
                Optional<GradeSource> existing = tx.readSource(courseId, SourceType.ASSIGNMENT, assignmentId);
                GradeSource source = existing
                    .map(s -> s.republished(title, pointsPossible, request.dueAt(), request.allowLate(), null, now))
                    .orElse(new GradeSource(courseId, SourceType.ASSIGNMENT, assignmentId, title, pointsPossible,
                        1, request.dueAt(), request.allowLate(), null, now));
                tx.putSource(source);

                ObjectNode payload = basePayload(source);
                payload.put("assignmentId", assignmentId);
                putInstant(payload, "dueAt", source.dueAt());
                payload.put("allowLate", source.allowLate());

                Emission emission = eventWriter.append(tx, new EmitRequest(
                    EventType.ASSIGNMENT_PUBLISHED.wireName(),
                    courseId,
                    request.actor(),
                    EventAggregate.of(AggregateKind.ASSIGNMENT, assignmentId, source.version()),
                    payload,
                    EventType.ASSIGNMENT_PUBLISHED.wireName() + ":" + courseId + ":" + assignmentId + ":v" + source.version(),
                    request.requestId()
                ));
                return new Published(source, emission);
            });

            return afterPublish(published, request.actor(), request.requestId());
        }
    }

    @Override
    public GradeSource publishTest(PublishTestRequest request) {
        if (request == null) {
            throw new ValidationException("request", "cannot be null");
        }
        String courseId = InputSanitizer.requireId("courseId", request.courseId());
        String testId = InputSanitizer.requireId("testId", request.testId());
        String title = validateTitle(request.title());
        double pointsPossible = InputSanitizer.requirePoints("pointsPossible", request.pointsPossible());
        TestSettings settings = validateTestSettings(request);
        GradebookCoordinator.requireActor(request.actor());
        Instant dueAt = settings.isScheduled() ? settings.windowEnd() : null;

        try (var ctx = LoggingContext.forCourse(courseId, request.requestId())) {
            Published published = transactionRunner.execute("publishTest", tx -> {
                Instant now = clock.instant();
                Optional<GradeSource> existing = tx.readSource(courseId, SourceType.TEST, testId);
                GradeSource source = existing
                    .map(s -> s.republished(title, pointsPossible, dueAt, false, settings, now))
                    .orElse(new GradeSource(courseId, SourceType.TEST, testId, title, pointsPossible,
                        1, dueAt, false, settings, now));
                tx.putSource(source);

                ObjectNode payload = basePayload(source);
                payload.put("testId", testId);
                payload.put("mode", settings.mode().name().toLowerCase());
                payload.put("attemptsAllowed", settings.attemptsAllowed());
                payload.put("durationMinutes", settings.durationMinutes());
                putInstant(payload, "windowStart", settings.windowStart());
                putInstant(payload, "windowEnd", settings.windowEnd());

                Emission emission = eventWriter.append(tx, new EmitRequest(
                    EventType.TEST_PUBLISHED.wireName(),
                    courseId,
                    request.actor(),
                    EventAggregate.of(AggregateKind.TEST, testId, source.version()),
                    payload,
                    EventType.TEST_PUBLISHED.wireName() + ":" + courseId + ":" + testId + ":v" + source.version(),
                    request.requestId()
                ));
                return new Published(source, emission);
            });

            return afterPublish(published, request.actor(), request.requestId());
        }
    }

    @Override
    public List<GradeSource> listSources(String courseId) {
        return catalogRepository.findSources(InputSanitizer.requireId("courseId", courseId));
    }

    // ========== Internal Methods ==========

    private GradeSource afterPublish(Published published, Actor actor, String requestId) {
        GradeSource source = published.source();
        eventWriter.recordCommitted(published.emission());
        log.info("Published {} {} at version {}", source.sourceType().wireName(), source.sourceId(), source.version());

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("courseId", source.courseId());
        metadata.put("sourceType", source.sourceType().wireName());
        metadata.put("sourceId", source.sourceId());
        metadata.put("version", source.version());
        metadata.put("pointsPossible", source.pointsPossible());
        auditLog.record(AuditEntry.SOURCE_PUBLISH, actor, null, requestId, metadata);
        return source;
    }

    private static String validateTitle(String title) {
        if (title == null || title.isBlank()) {
            throw new ValidationException("title", "cannot be empty");
        }
        String trimmed = title.trim();
        if (trimmed.length() > MAX_TITLE_LENGTH) {
            throw new ValidationException("title", "at most " + MAX_TITLE_LENGTH + " characters");
        }
        return trimmed;
    }

    private static TestSettings validateTestSettings(PublishTestRequest request) {
        TestMode mode = request.mode() != null ? request.mode() : TestMode.PRACTICE;
        int attemptsAllowed = request.attemptsAllowed() != null ? request.attemptsAllowed() : 1;
        if (attemptsAllowed < 1 || attemptsAllowed > TestSettings.MAX_ATTEMPTS) {
            throw new ValidationException("attemptsAllowed", "must be between 1 and " + TestSettings.MAX_ATTEMPTS);
        }
        int durationMinutes = request.durationMinutes() != null ? request.durationMinutes() : 0;
        if (durationMinutes < 0 || durationMinutes > TestSettings.MAX_DURATION_MINUTES) {
            throw new ValidationException("durationMinutes", "must be between 0 and " + TestSettings.MAX_DURATION_MINUTES);
        }
        if (mode == TestMode.PRACTICE) {
            return new TestSettings(mode, attemptsAllowed, durationMinutes, null, null);
        }

        if (durationMinutes == 0) {
            throw new ValidationException("durationMinutes", "scheduled tests need a duration");
        }
        if (request.windowStart() == null || request.windowEnd() == null) {
            throw new ValidationException("window", "scheduled tests need windowStart and windowEnd");
        }
        if (!request.windowEnd().isAfter(request.windowStart())) {
            throw new ValidationException("window", "windowEnd must be after windowStart");
        }
        return TestSettings.scheduled(attemptsAllowed, durationMinutes, request.windowStart(), request.windowEnd());
    }

    private static ObjectNode basePayload(GradeSource source) {
        ObjectNode payload = JsonNodeFactory.instance.objectNode();
        payload.put("courseId", source.courseId());
        payload.put("title", source.title());
        payload.put("pointsPossible", source.pointsPossible());
        payload.put("version", source.version());
        return payload;
    }

    static void putInstant(ObjectNode payload, String field, Instant value) {
        if (value != null) {
            payload.put(field, value.toString());
        } else {
            payload.putNull(field);
        }
    }

    private record Published(GradeSource source, Emission emission) {}
}
