package com.gradeledger.core.model;

import java.time.Instant;

/**
 * A student's submission for an assignment, including the grade written onto it.
 * 
 * Primary Key: (courseId, assignmentId, studentId)
 */
public record Submission(
    String courseId,
    String assignmentId,
    String studentId,
    int assignmentVersion,
    SubmissionStatus status,
    Instant submittedAt,
    boolean late,
    Double gradeScore,
    int gradeRevision,
    Instant gradedAt
) {
    public static Submission first(String courseId, String assignmentId, String studentId,
                                   int assignmentVersion, Instant submittedAt, boolean late) {
        return new Submission(courseId, assignmentId, studentId, assignmentVersion,
            SubmissionStatus.SUBMITTED, submittedAt, late, null, 0, null);
    }

    public Submission resubmitted(int newAssignmentVersion, Instant now, boolean nowLate) {
        return new Submission(courseId, assignmentId, studentId, newAssignmentVersion,
            SubmissionStatus.RESUBMITTED, now, nowLate, gradeScore, gradeRevision, gradedAt);
    }

    public Submission graded(double score, int revision, Instant now) {
        return new Submission(courseId, assignmentId, studentId, assignmentVersion,
            status, submittedAt, late, score, revision, now);
    }
}
