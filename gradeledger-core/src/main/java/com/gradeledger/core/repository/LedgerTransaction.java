package com.gradeledger.core.repository;

import com.gradeledger.core.model.DomainEvent;
import com.gradeledger.core.model.GradeRecord;
import com.gradeledger.core.model.GradeSource;
import com.gradeledger.core.model.GradebookEntry;
import com.gradeledger.core.model.SourceType;
import com.gradeledger.core.model.Submission;
import com.gradeledger.core.model.TestAttempt;
import java.util.List;
import java.util.Optional;

/**
 * Read/write view of the store inside one transaction attempt.
 * 
 * <p>Every read records the version it saw; writes are validated against those
 * versions at commit. A document must be read before it is written in the same
 * transaction, so a write never silently overwrites a change it did not see.
 * Reads observe the transaction's own earlier writes.</p>
 */
public interface LedgerTransaction {

    // ========== Grade sources ==========

    Optional<GradeSource> readSource(String courseId, SourceType sourceType, String sourceId);

    void putSource(GradeSource source);

    // ========== Submissions ==========

    Optional<Submission> readSubmission(String courseId, String assignmentId, String studentId);

    void putSubmission(Submission submission);

    // ========== Test attempts ==========

    Optional<TestAttempt> readAttempt(String courseId, String testId, String attemptId);

    /**
     * All attempts of a student at a test, ordered by attempt number.
     * Each returned attempt counts as read.
     */
    List<TestAttempt> readAttemptsForStudent(String courseId, String testId, String studentId);

    void putAttempt(TestAttempt attempt);

    // ========== Grades ==========

    Optional<GradeRecord> readGrade(String courseId, String gradeId);

    /**
     * Grade records of one student in a course, ordered by grade id.
     * 
     * @param limit Maximum number of records returned
     */
    List<GradeRecord> readGradesForStudent(String courseId, String studentId, int limit);

    void putGrade(GradeRecord grade);

    // ========== Gradebook ==========

    Optional<GradebookEntry> readGradebook(String courseId, String studentId);

    void putGradebook(GradebookEntry entry);

    // ========== Events ==========

    Optional<DomainEvent> readEvent(String eventId);

    /**
     * Create the event; the caller must have read its id and found nothing.
     * A concurrent create of the same id surfaces as a conflict at commit.
     */
    void createEvent(DomainEvent event);
}
