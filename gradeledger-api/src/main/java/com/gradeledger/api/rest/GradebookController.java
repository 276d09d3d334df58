package com.gradeledger.api.rest;

import com.gradeledger.core.exception.ValidationException;
import com.gradeledger.core.model.GradeRecord;
import com.gradeledger.core.model.GradeSnapshot;
import com.gradeledger.core.model.GradebookEntry;
import com.gradeledger.core.model.SourceType;
import com.gradeledger.engine.logging.LoggingContext;
import com.gradeledger.engine.service.GradebookService;
import com.gradeledger.engine.service.GradebookService.GradeMutation;
import com.gradeledger.engine.service.GradebookService.GradebookRecomputation;
import com.gradeledger.engine.service.GradebookService.RecomputeRequest;
import com.gradeledger.engine.service.GradebookService.SetGradeRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST API for grades and gradebook totals.
 */
@RestController
@RequestMapping("/api/v1/courses/{courseId}")
public class GradebookController {

    private final GradebookService gradebookService;

    public GradebookController(GradebookService gradebookService) {
        this.gradebookService = gradebookService;
    }

    /**
     * Set (or re-set) a student's grade for one source.
     */
    @PutMapping("/grades")
    public ResponseEntity<GradeMutationResponse> setGrade(
            @PathVariable String courseId,
            @RequestHeader(value = RequestActors.UID_HEADER, required = false) String actorUid,
            @RequestHeader(value = RequestActors.ROLE_HEADER, required = false) String actorRole,
            @RequestBody SetGradeDto request) {

        GradeMutation mutation = gradebookService.setGrade(new SetGradeRequest(
            courseId,
            parseSourceType(request.sourceType()),
            request.sourceId(),
            request.studentId(),
            request.score(),
            request.pointsPossible(),
            request.feedback(),
            RequestActors.of(actorUid, actorRole),
            LoggingContext.getRequestId()
        ));
        return ResponseEntity.ok(GradeMutationResponse.from(mutation));
    }

    /**
     * Current totals and grade records of a student.
     */
    @GetMapping("/gradebook/{studentId}")
    public ResponseEntity<GradebookResponse> getGradebook(
            @PathVariable String courseId,
            @PathVariable String studentId) {

        return ResponseEntity.ok(new GradebookResponse(
            gradebookService.getGradebook(courseId, studentId),
            gradebookService.getGrades(courseId, studentId)));
    }

    /**
     * Recompute a student's totals from their grade records.
     */
    @PostMapping("/gradebook/{studentId}/recompute")
    public ResponseEntity<GradebookRecomputation> recompute(
            @PathVariable String courseId,
            @PathVariable String studentId,
            @RequestHeader(value = RequestActors.UID_HEADER, required = false) String actorUid,
            @RequestHeader(value = RequestActors.ROLE_HEADER, required = false) String actorRole,
            @RequestBody(required = false) RecomputeDto request) {

        String reason = request != null ? request.reason() : null;
        boolean reconcile = request != null && Boolean.TRUE.equals(request.reconcile());
        GradebookRecomputation result = gradebookService.recomputeStudent(new RecomputeRequest(
            courseId, studentId, reason, reconcile, RequestActors.of(actorUid, actorRole),
            LoggingContext.getRequestId()));
        return ResponseEntity.ok(result);
    }

    private static SourceType parseSourceType(String sourceType) {
        if (sourceType == null) {
            throw new ValidationException("sourceType", "is required");
        }
        try {
            return SourceType.fromWire(sourceType);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("sourceType", e.getMessage());
        }
    }

    // ========== DTOs ==========

    public record SetGradeDto(
        String sourceType,
        String sourceId,
        String studentId,
        Double score,
        Double pointsPossible,
        String feedback
    ) {}

    public record RecomputeDto(String reason, Boolean reconcile) {}

    public record GradebookResponse(GradebookEntry gradebook, List<GradeRecord> grades) {}

    public record GradeMutationResponse(
        GradeRecord grade,
        GradeSnapshot before,
        GradeSnapshot after,
        GradebookEntry gradebook,
        String eventId
    ) {
        static GradeMutationResponse from(GradeMutation mutation) {
            return new GradeMutationResponse(
                mutation.grade(),
                mutation.before(),
                mutation.after(),
                mutation.gradebook(),
                mutation.event().eventId());
        }
    }
}
