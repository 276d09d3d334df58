package com.gradeledger.core.model;

/**
 * Score and revision of a grade at one point in time.
 * A null score means the work had not been graded yet.
 */
public record GradeSnapshot(Double score, int gradeRevision) {

    public static final GradeSnapshot UNGRADED = new GradeSnapshot(null, 0);

    public boolean isGraded() {
        return score != null;
    }
}
