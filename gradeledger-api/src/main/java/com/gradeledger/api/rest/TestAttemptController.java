package com.gradeledger.api.rest;

import com.gradeledger.core.model.TestAttempt;
import com.gradeledger.engine.logging.LoggingContext;
import com.gradeledger.engine.service.TestAttemptService;
import com.gradeledger.engine.service.TestAttemptService.AttemptStarted;
import com.gradeledger.engine.service.TestAttemptService.AttemptSubmitted;
import com.gradeledger.engine.service.TestAttemptService.SubmitAttemptRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for test attempts. The student taking the test is the actor.
 */
@RestController
@RequestMapping("/api/v1/courses/{courseId}/tests/{testId}/attempts")
public class TestAttemptController {

    private final TestAttemptService attemptService;

    public TestAttemptController(TestAttemptService attemptService) {
        this.attemptService = attemptService;
    }

    @PostMapping
    public ResponseEntity<AttemptResponse> start(
            @PathVariable String courseId,
            @PathVariable String testId,
            @RequestHeader(value = RequestActors.UID_HEADER, required = false) String actorUid,
            @RequestHeader(value = RequestActors.ROLE_HEADER, required = false) String actorRole) {

        AttemptStarted started = attemptService.startAttempt(
            courseId, testId, RequestActors.of(actorUid, actorRole), LoggingContext.getRequestId());
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(new AttemptResponse(started.attempt(), started.event().eventId(), null));
    }

    @PostMapping("/{attemptId}/submit")
    public ResponseEntity<AttemptResponse> submit(
            @PathVariable String courseId,
            @PathVariable String testId,
            @PathVariable String attemptId,
            @RequestHeader(value = RequestActors.UID_HEADER, required = false) String actorUid,
            @RequestHeader(value = RequestActors.ROLE_HEADER, required = false) String actorRole,
            @RequestBody SubmitAttemptDto request) {

        AttemptSubmitted submitted = attemptService.submitAttempt(new SubmitAttemptRequest(
            courseId, testId, attemptId, request.score(), RequestActors.of(actorUid, actorRole),
            LoggingContext.getRequestId()));
        String gradeEventId = submitted.grade() != null ? submitted.grade().event().eventId() : null;
        return ResponseEntity.ok(new AttemptResponse(submitted.attempt(), submitted.event().eventId(), gradeEventId));
    }

    // ========== DTOs ==========

    public record SubmitAttemptDto(Double score) {}

    public record AttemptResponse(TestAttempt attempt, String eventId, String gradeEventId) {}
}
