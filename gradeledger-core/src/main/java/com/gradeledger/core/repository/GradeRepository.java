package com.gradeledger.core.repository;

import com.gradeledger.core.model.GradeRecord;
import java.util.List;
import java.util.Optional;

/**
 * Read side of canonical grade records.
 */
public interface GradeRepository {

    Optional<GradeRecord> findById(String courseId, String gradeId);

    /**
     * Grade records of one student in a course, ordered by grade id.
     */
    List<GradeRecord> findByStudent(String courseId, String studentId);
}
