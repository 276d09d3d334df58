package com.gradeledger.engine.persistence.memory;

import com.gradeledger.core.model.GradeSource;
import com.gradeledger.core.model.SourceType;
import com.gradeledger.core.model.Submission;
import com.gradeledger.core.model.TestAttempt;
import com.gradeledger.core.repository.CatalogRepository;
import com.gradeledger.engine.persistence.DocumentKeys;

import java.util.List;
import java.util.Optional;

/**
 * In-memory implementation of CatalogRepository over the shared document store.
 */
public class InMemoryCatalogRepository implements CatalogRepository {

    private final VersionedDocumentStore documents;

    public InMemoryCatalogRepository(VersionedDocumentStore documents) {
        this.documents = documents;
    }

    @Override
    public Optional<GradeSource> findSource(String courseId, SourceType sourceType, String sourceId) {
        return Optional.ofNullable(
            (GradeSource) documents.get(DocumentKeys.source(courseId, sourceType, sourceId)).value());
    }

    @Override
    public List<GradeSource> findSources(String courseId) {
        return documents.valuesUnder(DocumentKeys.sourcesOf(courseId), GradeSource.class);
    }

    @Override
    public Optional<Submission> findSubmission(String courseId, String assignmentId, String studentId) {
        return Optional.ofNullable(
            (Submission) documents.get(DocumentKeys.submission(courseId, assignmentId, studentId)).value());
    }

    @Override
    public Optional<TestAttempt> findAttempt(String courseId, String testId, String attemptId) {
        return Optional.ofNullable(
            (TestAttempt) documents.get(DocumentKeys.attempt(courseId, testId, attemptId)).value());
    }
}
