package com.gradeledger.engine.service;

import com.gradeledger.core.model.Actor;
import com.gradeledger.core.model.DomainEvent;
import com.gradeledger.core.model.GradeRecord;
import com.gradeledger.core.model.GradeSnapshot;
import com.gradeledger.core.model.GradebookEntry;
import com.gradeledger.core.model.SourceType;
import java.util.List;

/**
 * Grade writes and the per-student gradebook kept consistent with them.
 */
public interface GradebookService {

    /** Upper bound on the grade records a recompute will sum. */
    int MAX_RECOMPUTE_GRADES = 1000;

    /**
     * Set a student's grade for a source and update the gradebook totals in
     * the same transaction.
     * 
     * @param request The grade to write
     * @return Prior and new grade state, the updated totals and the emitted event
     */
    GradeMutation setGrade(SetGradeRequest request);

    /**
     * Sum a student's grade records and compare with the live totals.
     * Drift is always reported; the live entry is only overwritten when
     * {@code reconcile} is set.
     * 
     * @param request What to recompute
     * @return The comparison and the emitted event
     */
    GradebookRecomputation recomputeStudent(RecomputeRequest request);

    /**
     * Current totals of a student; zero totals when nothing was graded yet.
     */
    GradebookEntry getGradebook(String courseId, String studentId);

    /**
     * Canonical grade records of a student, ordered by grade id.
     */
    List<GradeRecord> getGrades(String courseId, String studentId);

    record SetGradeRequest(
        String courseId,
        SourceType sourceType,
        String sourceId,
        String studentId,
        Double score,
        Double pointsPossible,
        String feedback,
        Actor actor,
        String requestId
    ) {}

    record GradeMutation(
        GradeRecord grade,
        GradeSnapshot before,
        GradeSnapshot after,
        GradebookEntry gradebook,
        DomainEvent event
    ) {}

    record RecomputeRequest(
        String courseId,
        String studentId,
        String reason,
        boolean reconcile,
        Actor actor,
        String requestId
    ) {}

    record GradebookRecomputation(
        String courseId,
        String studentId,
        int gradeCount,
        double totalScore,
        double totalPossible,
        double liveTotalScore,
        double liveTotalPossible,
        double deltaTotalScore,
        double deltaTotalPossible,
        boolean driftFlagged,
        boolean reconciled,
        DomainEvent event
    ) {}
}
