package com.gradeledger.engine.service;

import com.gradeledger.core.model.Actor;
import com.gradeledger.core.model.DomainEvent;
import com.gradeledger.core.model.Submission;

/**
 * Assignment submissions by students.
 */
public interface SubmissionService {

    /**
     * Submit (or resubmit) an assignment.
     * Late submissions are accepted only when the assignment allows them.
     * 
     * @param courseId The course ID
     * @param assignmentId The assignment ID
     * @param student The submitting student
     * @param requestId Optional request correlation ID
     * @return The stored submission and the events it produced
     */
    SubmissionResult submit(String courseId, String assignmentId, Actor student, String requestId);

    record SubmissionResult(
        Submission submission,
        DomainEvent submittedEvent,
        DomainEvent lateEvent
    ) {
        public boolean isLate() {
            return lateEvent != null;
        }
    }
}
