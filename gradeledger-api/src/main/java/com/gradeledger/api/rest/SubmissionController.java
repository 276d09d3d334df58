package com.gradeledger.api.rest;

import com.gradeledger.core.model.Submission;
import com.gradeledger.engine.logging.LoggingContext;
import com.gradeledger.engine.service.SubmissionService;
import com.gradeledger.engine.service.SubmissionService.SubmissionResult;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;

/**
 * REST API for assignment submissions. The submitting student is the actor.
 */
@RestController
@RequestMapping("/api/v1/courses/{courseId}/assignments/{assignmentId}/submissions")
public class SubmissionController {

    private final SubmissionService submissionService;

    public SubmissionController(SubmissionService submissionService) {
        this.submissionService = submissionService;
    }

    @PostMapping
    public ResponseEntity<SubmissionResponse> submit(
            @PathVariable String courseId,
            @PathVariable String assignmentId,
            @RequestHeader(value = RequestActors.UID_HEADER, required = false) String actorUid,
            @RequestHeader(value = RequestActors.ROLE_HEADER, required = false) String actorRole) {

        SubmissionResult result = submissionService.submit(
            courseId, assignmentId, RequestActors.of(actorUid, actorRole), LoggingContext.getRequestId());
        return ResponseEntity.status(HttpStatus.CREATED).body(SubmissionResponse.from(result));
    }

    public record SubmissionResponse(Submission submission, boolean late, List<String> eventIds) {
        static SubmissionResponse from(SubmissionResult result) {
            List<String> eventIds = new ArrayList<>();
            eventIds.add(result.submittedEvent().eventId());
            if (result.isLate()) {
                eventIds.add(result.lateEvent().eventId());
            }
            return new SubmissionResponse(result.submission(), result.isLate(), eventIds);
        }
    }
}
