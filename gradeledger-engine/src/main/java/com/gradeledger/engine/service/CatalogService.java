package com.gradeledger.engine.service;

import com.gradeledger.core.model.Actor;
import com.gradeledger.core.model.GradeSource;
import com.gradeledger.core.model.TestMode;
import java.time.Instant;
import java.util.List;

/**
 * Publishes the gradable work of a course: assignments and tests.
 */
public interface CatalogService {

    /**
     * Create or republish an assignment. Every publish bumps the version.
     * 
     * @param request The assignment definition
     * @return The stored source
     */
    GradeSource publishAssignment(PublishAssignmentRequest request);

    /**
     * Create or republish a test. Every publish bumps the version.
     * 
     * @param request The test definition
     * @return The stored source
     */
    GradeSource publishTest(PublishTestRequest request);

    /**
     * List every published source of a course.
     */
    List<GradeSource> listSources(String courseId);

    record PublishAssignmentRequest(
        String courseId,
        String assignmentId,
        String title,
        Double pointsPossible,
        Instant dueAt,
        boolean allowLate,
        Actor actor,
        String requestId
    ) {}

    record PublishTestRequest(
        String courseId,
        String testId,
        String title,
        Double pointsPossible,
        TestMode mode,
        Integer attemptsAllowed,
        Integer durationMinutes,
        Instant windowStart,
        Instant windowEnd,
        Actor actor,
        String requestId
    ) {}
}
