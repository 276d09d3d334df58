package com.gradeledger.engine.service;

import com.gradeledger.core.model.Actor;
import com.gradeledger.core.model.DomainEvent;
import com.gradeledger.core.model.TestAttempt;

/**
 * Test attempt lifecycle: start, then submit once.
 */
public interface TestAttemptService {

    /**
     * Start the student's next attempt at a test.
     * 
     * @param courseId The course ID
     * @param testId The test ID
     * @param student The student starting the attempt
     * @param requestId Optional request correlation ID
     * @return The new attempt and its started event
     */
    AttemptStarted startAttempt(String courseId, String testId, Actor student, String requestId);

    /**
     * Submit a started attempt with its final score. Grades the attempt through
     * the gradebook in the same transaction.
     * 
     * @param request The submission
     * @return The submitted attempt and the events it produced
     */
    AttemptSubmitted submitAttempt(SubmitAttemptRequest request);

    record SubmitAttemptRequest(
        String courseId,
        String testId,
        String attemptId,
        Double score,
        Actor student,
        String requestId
    ) {}

    record AttemptStarted(TestAttempt attempt, DomainEvent event) {}

    record AttemptSubmitted(
        TestAttempt attempt,
        GradebookService.GradeMutation grade,
        DomainEvent event
    ) {}
}
