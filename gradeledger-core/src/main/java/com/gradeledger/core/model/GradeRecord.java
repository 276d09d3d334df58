package com.gradeledger.core.model;

import java.time.Instant;

/**
 * Canonical grade of one student for one source.
 * Owned by the gradebook aggregator and only written inside its transactions.
 * 
 * Primary Key: (courseId, gradeId) with gradeId = {sourceType}_{sourceId}_{studentId}
 * 
 * Invariants:
 * - 0 <= score <= pointsPossible
 * - gradeRevision increases by exactly 1 on every write
 */
public record GradeRecord(
    String courseId,
    String studentId,
    SourceType sourceType,
    String sourceId,
    int sourceVersion,
    double score,
    double pointsPossible,
    String feedback,
    String gradedBy,
    int gradeRevision,
    Instant gradedAt
) {
    public static String idFor(SourceType sourceType, String sourceId, String studentId) {
        return sourceType.wireName() + "_" + sourceId + "_" + studentId;
    }

    public String gradeId() {
        return idFor(sourceType, sourceId, studentId);
    }

    public GradeSnapshot snapshot() {
        return new GradeSnapshot(score, gradeRevision);
    }
}
