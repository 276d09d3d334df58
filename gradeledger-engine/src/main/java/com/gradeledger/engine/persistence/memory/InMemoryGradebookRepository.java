package com.gradeledger.engine.persistence.memory;

import com.gradeledger.core.model.GradebookEntry;
import com.gradeledger.core.repository.GradebookRepository;
import com.gradeledger.engine.persistence.DocumentKeys;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * In-memory implementation of GradebookRepository over the shared document store.
 */
public class InMemoryGradebookRepository implements GradebookRepository {

    private final VersionedDocumentStore documents;

    public InMemoryGradebookRepository(VersionedDocumentStore documents) {
        this.documents = documents;
    }

    @Override
    public Optional<GradebookEntry> find(String courseId, String studentId) {
        return Optional.ofNullable(
            (GradebookEntry) documents.get(DocumentKeys.gradebook(courseId, studentId)).value());
    }

    @Override
    public List<GradebookEntry> findByCourse(String courseId) {
        return documents.valuesUnder(DocumentKeys.gradebooksOf(courseId), GradebookEntry.class);
    }

    @Override
    public List<GradebookEntry> findAll() {
        return documents.valuesUnder("courses/", GradebookEntry.class).stream()
            .sorted(Comparator.comparing(GradebookEntry::courseId).thenComparing(GradebookEntry::studentId))
            .toList();
    }
}
