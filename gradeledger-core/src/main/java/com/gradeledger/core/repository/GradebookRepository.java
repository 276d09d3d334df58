package com.gradeledger.core.repository;

import com.gradeledger.core.model.GradebookEntry;
import java.util.List;
import java.util.Optional;

/**
 * Read side of per-student gradebook totals.
 */
public interface GradebookRepository {

    Optional<GradebookEntry> find(String courseId, String studentId);

    List<GradebookEntry> findByCourse(String courseId);

    /**
     * Every gradebook entry, ordered by (courseId, studentId).
     * Used by the periodic reconciler.
     */
    List<GradebookEntry> findAll();
}
