package com.gradeledger.engine.persistence.jdbc;

import com.gradeledger.core.exception.OptimisticLockException;
import com.gradeledger.core.model.DomainEvent;
import com.gradeledger.core.model.GradeRecord;
import com.gradeledger.core.model.GradeSource;
import com.gradeledger.core.model.GradebookEntry;
import com.gradeledger.core.model.SourceType;
import com.gradeledger.core.model.Submission;
import com.gradeledger.core.model.TestAttempt;
import com.gradeledger.core.model.TestSettings;
import com.gradeledger.core.repository.LedgerTransaction;
import com.gradeledger.engine.persistence.DocumentKeys;
import com.gradeledger.engine.persistence.jdbc.LedgerRowMappers.VersionedRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.gradeledger.engine.persistence.jdbc.LedgerRowMappers.toTimestamp;
import static com.gradeledger.engine.persistence.jdbc.LedgerRowMappers.versioned;

/**
 * One attempt inside a database transaction.
 * 
 * <p>Every row read is tracked under its document key with the row_version it
 * had. Writes go straight to the database guarded by that version
 * ({@code UPDATE ... WHERE row_version = ?}, or an insert that must not
 * collide), so the surrounding database transaction rolls them back on any
 * failure. Rows read but not written are re-checked under a share lock before
 * commit.</p>
 */
class JdbcLedgerTransaction implements LedgerTransaction {

    private static final Logger log = LoggerFactory.getLogger(JdbcLedgerTransaction.class);

    private final JdbcTemplate jdbcTemplate;
    private final LedgerRowMappers mappers;
    private final Map<String, TrackedRow> tracked = new HashMap<>();

    JdbcLedgerTransaction(JdbcTemplate jdbcTemplate, LedgerRowMappers mappers) {
        this.jdbcTemplate = jdbcTemplate;
        this.mappers = mappers;
    }

    // ========== Grade sources ==========

    @Override
    public Optional<GradeSource> readSource(String courseId, SourceType sourceType, String sourceId) {
        return readOne(DocumentKeys.source(courseId, sourceType, sourceId),
            sourceRow(courseId, sourceType, sourceId), mappers.source);
    }

    @Override
    public void putSource(GradeSource source) {
        TestSettings settings = source.testSettings();
        Object[] values = {
            source.title(), source.pointsPossible(), source.version(),
            toTimestamp(source.dueAt()), source.allowLate(),
            settings != null ? settings.mode().name() : null,
            settings != null ? settings.attemptsAllowed() : null,
            settings != null ? settings.durationMinutes() : null,
            settings != null ? toTimestamp(settings.windowStart()) : null,
            settings != null ? toTimestamp(settings.windowEnd()) : null,
            toTimestamp(source.publishedAt())
        };
        write(DocumentKeys.source(source.courseId(), source.sourceType(), source.sourceId()),
            sourceRow(source.courseId(), source.sourceType(), source.sourceId()),
            new String[] {"title", "points_possible", "version", "due_at", "allow_late", "test_mode",
                "attempts_allowed", "duration_minutes", "window_start", "window_end", "published_at"},
            values);
    }

    // ========== Submissions ==========

    @Override
    public Optional<Submission> readSubmission(String courseId, String assignmentId, String studentId) {
        return readOne(DocumentKeys.submission(courseId, assignmentId, studentId),
            submissionRow(courseId, assignmentId, studentId), mappers.submission);
    }

    @Override
    public void putSubmission(Submission submission) {
        write(DocumentKeys.submission(submission.courseId(), submission.assignmentId(), submission.studentId()),
            submissionRow(submission.courseId(), submission.assignmentId(), submission.studentId()),
            new String[] {"assignment_version", "status", "submitted_at", "late",
                "grade_score", "grade_revision", "graded_at"},
            new Object[] {submission.assignmentVersion(), submission.status().name(),
                toTimestamp(submission.submittedAt()), submission.late(), submission.gradeScore(),
                submission.gradeRevision(), toTimestamp(submission.gradedAt())});
    }

    // ========== Test attempts ==========

    @Override
    public Optional<TestAttempt> readAttempt(String courseId, String testId, String attemptId) {
        return readOne(DocumentKeys.attempt(courseId, testId, attemptId),
            attemptRow(courseId, testId, attemptId), mappers.attempt);
    }

    @Override
    public List<TestAttempt> readAttemptsForStudent(String courseId, String testId, String studentId) {
        String sql = """
            SELECT * FROM test_attempts
            WHERE course_id = ? AND test_id = ? AND student_id = ?
            ORDER BY attempt_no ASC
            """;
        List<TestAttempt> attempts = new ArrayList<>();
        for (VersionedRow<TestAttempt> row : jdbcTemplate.query(sql, versioned(mappers.attempt),
                courseId, testId, studentId)) {
            TestAttempt attempt = row.value();
            track(DocumentKeys.attempt(courseId, testId, attempt.attemptId()),
                attemptRow(courseId, testId, attempt.attemptId()), row.version());
            attempts.add(attempt);
        }
        return attempts;
    }

    @Override
    public void putAttempt(TestAttempt attempt) {
        write(DocumentKeys.attempt(attempt.courseId(), attempt.testId(), attempt.attemptId()),
            attemptRow(attempt.courseId(), attempt.testId(), attempt.attemptId()),
            new String[] {"student_id", "attempt_no", "test_version", "status", "started_at",
                "expires_at", "score", "submitted_at"},
            new Object[] {attempt.studentId(), attempt.attemptNo(), attempt.testVersion(),
                attempt.status().name(), toTimestamp(attempt.startedAt()), toTimestamp(attempt.expiresAt()),
                attempt.score(), toTimestamp(attempt.submittedAt())});
    }

    // ========== Grades ==========

    @Override
    public Optional<GradeRecord> readGrade(String courseId, String gradeId) {
        return readOne(DocumentKeys.grade(courseId, gradeId), gradeRow(courseId, gradeId), mappers.grade);
    }

    @Override
    public List<GradeRecord> readGradesForStudent(String courseId, String studentId, int limit) {
        String sql = """
            SELECT * FROM grade_records
            WHERE course_id = ? AND student_id = ?
            ORDER BY grade_id ASC
            LIMIT ?
            """;
        List<GradeRecord> grades = new ArrayList<>();
        for (VersionedRow<GradeRecord> row : jdbcTemplate.query(sql, versioned(mappers.grade),
                courseId, studentId, limit)) {
            GradeRecord grade = row.value();
            track(DocumentKeys.grade(courseId, grade.gradeId()), gradeRow(courseId, grade.gradeId()), row.version());
            grades.add(grade);
        }
        return grades;
    }

    @Override
    public void putGrade(GradeRecord grade) {
        write(DocumentKeys.grade(grade.courseId(), grade.gradeId()),
            gradeRow(grade.courseId(), grade.gradeId()),
            new String[] {"student_id", "source_type", "source_id", "source_version", "score",
                "points_possible", "feedback", "graded_by", "grade_revision", "graded_at"},
            new Object[] {grade.studentId(), grade.sourceType().wireName(), grade.sourceId(),
                grade.sourceVersion(), grade.score(), grade.pointsPossible(), grade.feedback(),
                grade.gradedBy(), grade.gradeRevision(), toTimestamp(grade.gradedAt())});
    }

    // ========== Gradebook ==========

    @Override
    public Optional<GradebookEntry> readGradebook(String courseId, String studentId) {
        return readOne(DocumentKeys.gradebook(courseId, studentId),
            gradebookRow(courseId, studentId), mappers.gradebook);
    }

    @Override
    public void putGradebook(GradebookEntry entry) {
        write(DocumentKeys.gradebook(entry.courseId(), entry.studentId()),
            gradebookRow(entry.courseId(), entry.studentId()),
            new String[] {"total_score", "total_possible", "computed_at"},
            new Object[] {entry.totalScore(), entry.totalPossible(), toTimestamp(entry.computedAt())});
    }

    // ========== Events ==========

    @Override
    public Optional<DomainEvent> readEvent(String eventId) {
        return readOne(DocumentKeys.event(eventId), eventRow(eventId), mappers.event);
    }

    @Override
    public void createEvent(DomainEvent event) {
        String key = DocumentKeys.event(event.eventId());
        TrackedRow row = tracked.get(key);
        if (row == null || row.version != 0L || row.written) {
            throw new IllegalStateException("Event " + event.eventId() + " must be read as absent before it is created");
        }

        String sql = """
            INSERT INTO domain_events (
                event_id, type, course_id, actor_uid, actor_role,
                aggregate_kind, aggregate_id, aggregate_version,
                payload, idempotency_key, request_id, occurred_at, row_version
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb, ?, ?, ?, 1)
            ON CONFLICT DO NOTHING
            """;
        int rows = jdbcTemplate.update(sql,
            event.eventId(),
            event.type(),
            event.courseId(),
            event.actorUid(),
            event.actorRole(),
            event.aggregate().kind().wireName(),
            event.aggregate().id(),
            event.aggregate().version(),
            mappers.writeJson(event.payload()),
            event.idempotencyKey(),
            event.requestId(),
            toTimestamp(event.occurredAt())
        );
        if (rows == 0) {
            throw new OptimisticLockException(key, 0L, 1L);
        }
        row.version = 1L;
        row.written = true;
        log.debug("Inserted event {} ({})", event.eventId(), event.type());
    }

    // ========== Commit-time validation ==========

    /**
     * Re-check every row that was read but not written. Existing rows are
     * share-locked so they cannot change before the database commit.
     */
    void validateReads() {
        for (Map.Entry<String, TrackedRow> entry : tracked.entrySet()) {
            TrackedRow row = entry.getValue();
            if (row.written) {
                continue;
            }
            String sql = "SELECT row_version FROM " + row.ref.table() + " WHERE " + row.ref.where() + " FOR SHARE";
            List<Long> current = jdbcTemplate.queryForList(sql, Long.class, row.ref.keyArgs());
            long actual = current.isEmpty() ? 0L : current.get(0);
            if (actual != row.version) {
                throw new OptimisticLockException(entry.getKey(), row.version, actual);
            }
        }
    }

    // ========== Internals ==========

    private <T> Optional<T> readOne(String key, RowRef ref, RowMapper<T> mapper) {
        String sql = "SELECT * FROM " + ref.table() + " WHERE " + ref.where();
        List<VersionedRow<T>> rows = jdbcTemplate.query(sql, versioned(mapper), ref.keyArgs());
        long version = rows.isEmpty() ? 0L : rows.get(0).version();
        track(key, ref, version);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0).value());
    }

    private void track(String key, RowRef ref, long version) {
        TrackedRow existing = tracked.get(key);
        if (existing == null) {
            tracked.put(key, new TrackedRow(ref, version));
        } else if (!existing.written && existing.version != version) {
            throw new OptimisticLockException(key, existing.version, version);
        }
    }

    private void write(String key, RowRef ref, String[] columns, Object[] values) {
        TrackedRow row = tracked.get(key);
        if (row == null) {
            throw new IllegalStateException("Document " + key + " must be read before it is written");
        }

        int rows;
        if (row.version == 0L) {
            rows = jdbcTemplate.update(insertSql(ref, columns), concat(ref.keyArgs(), values));
        } else {
            StringBuilder set = new StringBuilder();
            for (String column : columns) {
                set.append(column).append(" = ?, ");
            }
            String sql = "UPDATE " + ref.table() + " SET " + set + "row_version = ? WHERE "
                + ref.where() + " AND row_version = ?";
            Object[] args = concat(concat(values, new Object[] {row.version + 1}),
                concat(ref.keyArgs(), new Object[] {row.version}));
            rows = jdbcTemplate.update(sql, args);
        }

        if (rows == 0) {
            throw new OptimisticLockException(key, row.version, -1L);
        }
        row.version = row.version + 1;
        row.written = true;
    }

    private static String insertSql(RowRef ref, String[] columns) {
        List<String> names = new ArrayList<>(List.of(ref.keyColumns()));
        names.addAll(List.of(columns));
        String placeholders = String.join(", ", names.stream().map(n -> "?").toList());
        return "INSERT INTO " + ref.table() + " (" + String.join(", ", names) + ", row_version) VALUES ("
            + placeholders + ", 1) ON CONFLICT DO NOTHING";
    }

    private static Object[] concat(Object[] first, Object[] second) {
        Object[] result = new Object[first.length + second.length];
        System.arraycopy(first, 0, result, 0, first.length);
        System.arraycopy(second, 0, result, first.length, second.length);
        return result;
    }

    private static RowRef sourceRow(String courseId, SourceType sourceType, String sourceId) {
        return new RowRef("grade_sources", new String[] {"course_id", "source_type", "source_id"},
            new Object[] {courseId, sourceType.wireName(), sourceId});
    }

    private static RowRef submissionRow(String courseId, String assignmentId, String studentId) {
        return new RowRef("submissions", new String[] {"course_id", "assignment_id", "student_id"},
            new Object[] {courseId, assignmentId, studentId});
    }

    private static RowRef attemptRow(String courseId, String testId, String attemptId) {
        return new RowRef("test_attempts", new String[] {"course_id", "test_id", "attempt_id"},
            new Object[] {courseId, testId, attemptId});
    }

    private static RowRef gradeRow(String courseId, String gradeId) {
        return new RowRef("grade_records", new String[] {"course_id", "grade_id"},
            new Object[] {courseId, gradeId});
    }

    private static RowRef gradebookRow(String courseId, String studentId) {
        return new RowRef("gradebook_entries", new String[] {"course_id", "student_id"},
            new Object[] {courseId, studentId});
    }

    private static RowRef eventRow(String eventId) {
        return new RowRef("domain_events", new String[] {"event_id"}, new Object[] {eventId});
    }

    /** Table, primary-key columns and their values for one row. */
    private record RowRef(String table, String[] keyColumns, Object[] keyArgs) {
        String where() {
            return String.join(" AND ", List.of(keyColumns).stream().map(c -> c + " = ?").toList());
        }
    }

    private static final class TrackedRow {
        private final RowRef ref;
        private long version;
        private boolean written;

        TrackedRow(RowRef ref, long version) {
            this.ref = ref;
            this.version = version;
        }
    }
}
