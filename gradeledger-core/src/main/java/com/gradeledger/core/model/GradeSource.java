package com.gradeledger.core.model;

import java.time.Instant;

/**
 * Definition of a gradable piece of work: an assignment or a test.
 * 
 * Primary Key: (courseId, sourceType, sourceId)
 * 
 * Invariants:
 * - pointsPossible is finite and >= 0
 * - version starts at 1 and increases on every republish
 * - testSettings is present exactly when sourceType is TEST
 */
public record GradeSource(
    String courseId,
    SourceType sourceType,
    String sourceId,
    String title,
    double pointsPossible,
    int version,
    Instant dueAt,
    boolean allowLate,
    TestSettings testSettings,
    Instant publishedAt
) {
    public boolean isTest() {
        return sourceType == SourceType.TEST;
    }

    public boolean isLate(Instant submittedAt) {
        return dueAt != null && submittedAt.isAfter(dueAt);
    }

    public GradeSource republished(String title, double pointsPossible, Instant dueAt,
                                   boolean allowLate, TestSettings testSettings, Instant now) {
        return new GradeSource(courseId, sourceType, sourceId, title, pointsPossible,
            version + 1, dueAt, allowLate, testSettings, now);
    }
}
