package com.gradeledger.engine.persistence.memory;

import com.gradeledger.core.model.GradeRecord;
import com.gradeledger.core.repository.GradeRepository;
import com.gradeledger.engine.persistence.DocumentKeys;

import java.util.List;
import java.util.Optional;

/**
 * In-memory implementation of GradeRepository over the shared document store.
 */
public class InMemoryGradeRepository implements GradeRepository {

    private final VersionedDocumentStore documents;

    public InMemoryGradeRepository(VersionedDocumentStore documents) {
        this.documents = documents;
    }

    @Override
    public Optional<GradeRecord> findById(String courseId, String gradeId) {
        return Optional.ofNullable((GradeRecord) documents.get(DocumentKeys.grade(courseId, gradeId)).value());
    }

    @Override
    public List<GradeRecord> findByStudent(String courseId, String studentId) {
        return documents.valuesUnder(DocumentKeys.gradesOf(courseId), GradeRecord.class).stream()
            .filter(g -> g.studentId().equals(studentId))
            .toList();
    }
}
