package com.gradeledger.core.model;

import java.time.Instant;

/**
 * Running totals of one student in one course.
 * 
 * Primary Key: (courseId, studentId)
 * 
 * Invariants:
 * - totalScore equals the sum of current scores over the student's grade records
 * - totalPossible counts each graded source's pointsPossible once
 */
public record GradebookEntry(
    String courseId,
    String studentId,
    double totalScore,
    double totalPossible,
    Instant computedAt
) {
    public static GradebookEntry empty(String courseId, String studentId) {
        return new GradebookEntry(courseId, studentId, 0.0, 0.0, null);
    }

    public GradebookEntry applyDelta(double deltaScore, double deltaPossible, Instant now) {
        return new GradebookEntry(courseId, studentId,
            totalScore + deltaScore, totalPossible + deltaPossible, now);
    }

    public GradebookEntry withTotals(double newTotalScore, double newTotalPossible, Instant now) {
        return new GradebookEntry(courseId, studentId, newTotalScore, newTotalPossible, now);
    }
}
