package com.gradeledger.engine.persistence.memory;

import com.gradeledger.core.model.DomainEvent;
import com.gradeledger.core.model.GradeRecord;
import com.gradeledger.core.model.GradeSource;
import com.gradeledger.core.model.GradebookEntry;
import com.gradeledger.core.model.SourceType;
import com.gradeledger.core.model.Submission;
import com.gradeledger.core.model.TestAttempt;
import com.gradeledger.core.repository.LedgerTransaction;
import com.gradeledger.engine.persistence.DocumentKeys;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One attempt against the {@link VersionedDocumentStore}. Reads record the
 * version seen; writes are buffered and only reach the store at commit.
 */
class InMemoryLedgerTransaction implements LedgerTransaction {

    private final VersionedDocumentStore store;
    private final Map<String, Long> readVersions = new HashMap<>();
    private final Map<String, Object> writes = new LinkedHashMap<>();

    InMemoryLedgerTransaction(VersionedDocumentStore store) {
        this.store = store;
    }

    // ========== Grade sources ==========

    @Override
    public Optional<GradeSource> readSource(String courseId, SourceType sourceType, String sourceId) {
        return read(DocumentKeys.source(courseId, sourceType, sourceId), GradeSource.class);
    }

    @Override
    public void putSource(GradeSource source) {
        write(DocumentKeys.source(source.courseId(), source.sourceType(), source.sourceId()), source);
    }

    // ========== Submissions ==========

    @Override
    public Optional<Submission> readSubmission(String courseId, String assignmentId, String studentId) {
        return read(DocumentKeys.submission(courseId, assignmentId, studentId), Submission.class);
    }

    @Override
    public void putSubmission(Submission submission) {
        write(DocumentKeys.submission(submission.courseId(), submission.assignmentId(), submission.studentId()),
            submission);
    }

    // ========== Test attempts ==========

    @Override
    public Optional<TestAttempt> readAttempt(String courseId, String testId, String attemptId) {
        return read(DocumentKeys.attempt(courseId, testId, attemptId), TestAttempt.class);
    }

    @Override
    public List<TestAttempt> readAttemptsForStudent(String courseId, String testId, String studentId) {
        List<TestAttempt> attempts = readAll(DocumentKeys.attemptsOf(courseId, testId), TestAttempt.class);
        attempts.removeIf(a -> !a.studentId().equals(studentId));
        attempts.sort(Comparator.comparingInt(TestAttempt::attemptNo));
        return attempts;
    }

    @Override
    public void putAttempt(TestAttempt attempt) {
        write(DocumentKeys.attempt(attempt.courseId(), attempt.testId(), attempt.attemptId()), attempt);
    }

    // ========== Grades ==========

    @Override
    public Optional<GradeRecord> readGrade(String courseId, String gradeId) {
        return read(DocumentKeys.grade(courseId, gradeId), GradeRecord.class);
    }

    @Override
    public List<GradeRecord> readGradesForStudent(String courseId, String studentId, int limit) {
        List<GradeRecord> grades = readAll(DocumentKeys.gradesOf(courseId), GradeRecord.class);
        grades.removeIf(g -> !g.studentId().equals(studentId));
        grades.sort(Comparator.comparing(GradeRecord::gradeId));
        return grades.size() > limit ? new ArrayList<>(grades.subList(0, limit)) : grades;
    }

    @Override
    public void putGrade(GradeRecord grade) {
        write(DocumentKeys.grade(grade.courseId(), grade.gradeId()), grade);
    }

    // ========== Gradebook ==========

    @Override
    public Optional<GradebookEntry> readGradebook(String courseId, String studentId) {
        return read(DocumentKeys.gradebook(courseId, studentId), GradebookEntry.class);
    }

    @Override
    public void putGradebook(GradebookEntry entry) {
        write(DocumentKeys.gradebook(entry.courseId(), entry.studentId()), entry);
    }

    // ========== Events ==========

    @Override
    public Optional<DomainEvent> readEvent(String eventId) {
        return read(DocumentKeys.event(eventId), DomainEvent.class);
    }

    @Override
    public void createEvent(DomainEvent event) {
        String key = DocumentKeys.event(event.eventId());
        Long seen = readVersions.get(key);
        if (seen == null || seen != 0L || writes.containsKey(key)) {
            throw new IllegalStateException("Event " + event.eventId() + " must be read as absent before it is created");
        }
        writes.put(key, event);
    }

    // ========== Commit ==========

    void commit() {
        store.commit(readVersions, writes);
    }

    private <T> Optional<T> read(String key, Class<T> type) {
        if (writes.containsKey(key)) {
            return Optional.of(type.cast(writes.get(key)));
        }
        VersionedDocumentStore.Versioned doc = store.get(key);
        readVersions.putIfAbsent(key, doc.version());
        return doc.exists() ? Optional.of(type.cast(doc.value())) : Optional.empty();
    }

    private <T> List<T> readAll(String prefix, Class<T> type) {
        Map<String, T> found = new LinkedHashMap<>();
        for (Map.Entry<String, VersionedDocumentStore.Versioned> entry : store.scan(prefix)) {
            readVersions.putIfAbsent(entry.getKey(), entry.getValue().version());
            found.put(entry.getKey(), type.cast(entry.getValue().value()));
        }
        for (Map.Entry<String, Object> write : writes.entrySet()) {
            if (write.getKey().startsWith(prefix)) {
                found.put(write.getKey(), type.cast(write.getValue()));
            }
        }
        return new ArrayList<>(found.values());
    }

    private void write(String key, Object value) {
        if (!readVersions.containsKey(key)) {
            throw new IllegalStateException("Document " + key + " must be read before it is written");
        }
        writes.put(key, value);
    }
}
