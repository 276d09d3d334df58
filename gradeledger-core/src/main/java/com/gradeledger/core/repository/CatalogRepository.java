package com.gradeledger.core.repository;

import com.gradeledger.core.model.GradeSource;
import com.gradeledger.core.model.SourceType;
import com.gradeledger.core.model.Submission;
import com.gradeledger.core.model.TestAttempt;
import java.util.List;
import java.util.Optional;

/**
 * Read side of course work: grade sources, submissions and test attempts.
 */
public interface CatalogRepository {

    Optional<GradeSource> findSource(String courseId, SourceType sourceType, String sourceId);

    List<GradeSource> findSources(String courseId);

    Optional<Submission> findSubmission(String courseId, String assignmentId, String studentId);

    Optional<TestAttempt> findAttempt(String courseId, String testId, String attemptId);
}
