package com.gradeledger.api.rest;

import com.gradeledger.core.exception.ValidationException;
import com.gradeledger.core.model.GradeSource;
import com.gradeledger.core.model.TestMode;
import com.gradeledger.engine.logging.LoggingContext;
import com.gradeledger.engine.service.CatalogService;
import com.gradeledger.engine.service.CatalogService.PublishAssignmentRequest;
import com.gradeledger.engine.service.CatalogService.PublishTestRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * REST API for publishing assignments and tests.
 */
@RestController
@RequestMapping("/api/v1/courses/{courseId}")
public class CatalogController {

    private final CatalogService catalogService;

    public CatalogController(CatalogService catalogService) {
        this.catalogService = catalogService;
    }

    /**
     * Publish or republish an assignment.
     */
    @PostMapping("/assignments")
    public ResponseEntity<GradeSource> publishAssignment(
            @PathVariable String courseId,
            @RequestHeader(value = RequestActors.UID_HEADER, required = false) String actorUid,
            @RequestHeader(value = RequestActors.ROLE_HEADER, required = false) String actorRole,
            @RequestBody PublishAssignmentDto request) {

        GradeSource source = catalogService.publishAssignment(new PublishAssignmentRequest(
            courseId,
            request.assignmentId(),
            request.title(),
            request.pointsPossible(),
            request.dueAt(),
            Boolean.TRUE.equals(request.allowLate()),
            RequestActors.of(actorUid, actorRole),
            LoggingContext.getRequestId()
        ));
        return ResponseEntity.status(HttpStatus.CREATED).body(source);
    }

    /**
     * Publish or republish a test.
     */
    @PostMapping("/tests")
    public ResponseEntity<GradeSource> publishTest(
            @PathVariable String courseId,
            @RequestHeader(value = RequestActors.UID_HEADER, required = false) String actorUid,
            @RequestHeader(value = RequestActors.ROLE_HEADER, required = false) String actorRole,
            @RequestBody PublishTestDto request) {

        GradeSource source = catalogService.publishTest(new PublishTestRequest(
            courseId,
            request.testId(),
            request.title(),
            request.pointsPossible(),
            parseMode(request.mode()),
            request.attemptsAllowed(),
            request.durationMinutes(),
            request.windowStart(),
            request.windowEnd(),
            RequestActors.of(actorUid, actorRole),
            LoggingContext.getRequestId()
        ));
        return ResponseEntity.status(HttpStatus.CREATED).body(source);
    }

    /**
     * List the published sources of a course.
     */
    @GetMapping("/sources")
    public ResponseEntity<List<GradeSource>> listSources(@PathVariable String courseId) {
        return ResponseEntity.ok(catalogService.listSources(courseId));
    }

    private static TestMode parseMode(String mode) {
        if (mode == null || mode.isBlank()) {
            return TestMode.PRACTICE;
        }
        try {
            return TestMode.valueOf(mode.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("mode", "expected practice or scheduled, got " + mode);
        }
    }

    // ========== DTOs ==========

    public record PublishAssignmentDto(
        String assignmentId,
        String title,
        Double pointsPossible,
        Instant dueAt,
        Boolean allowLate
    ) {}

    public record PublishTestDto(
        String testId,
        String title,
        Double pointsPossible,
        String mode,
        Integer attemptsAllowed,
        Integer durationMinutes,
        Instant windowStart,
        Instant windowEnd
    ) {}
}
