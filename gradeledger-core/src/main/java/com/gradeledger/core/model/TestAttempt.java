package com.gradeledger.core.model;

import java.time.Instant;

/**
 * One attempt of a student at a test.
 * 
 * Primary Key: (courseId, testId, attemptId) with attemptId = {studentId}__{attemptNo}
 * 
 * Invariants:
 * - attemptNo is 1-based and at most the test's attemptsAllowed
 * - status moves STARTED -> SUBMITTED once
 */
public record TestAttempt(
    String courseId,
    String testId,
    String attemptId,
    String studentId,
    int attemptNo,
    int testVersion,
    AttemptStatus status,
    Instant startedAt,
    Instant expiresAt,
    Double score,
    Instant submittedAt
) {
    public static String idFor(String studentId, int attemptNo) {
        return studentId + "__" + attemptNo;
    }

    public static TestAttempt start(String courseId, String testId, String studentId, int attemptNo,
                                    int testVersion, Instant startedAt, Instant expiresAt) {
        return new TestAttempt(courseId, testId, idFor(studentId, attemptNo), studentId, attemptNo,
            testVersion, AttemptStatus.STARTED, startedAt, expiresAt, null, null);
    }

    public boolean isExpired(Instant now) {
        return now.isAfter(expiresAt);
    }

    public TestAttempt submitted(double finalScore, Instant now) {
        return new TestAttempt(courseId, testId, attemptId, studentId, attemptNo, testVersion,
            AttemptStatus.SUBMITTED, startedAt, expiresAt, finalScore, now);
    }
}
