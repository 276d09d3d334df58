package com.gradeledger.engine.persistence.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gradeledger.core.model.AggregateKind;
import com.gradeledger.core.model.AttemptStatus;
import com.gradeledger.core.model.DomainEvent;
import com.gradeledger.core.model.EventAggregate;
import com.gradeledger.core.model.GradeRecord;
import com.gradeledger.core.model.GradeSource;
import com.gradeledger.core.model.GradebookEntry;
import com.gradeledger.core.model.SourceType;
import com.gradeledger.core.model.Submission;
import com.gradeledger.core.model.SubmissionStatus;
import com.gradeledger.core.model.TestAttempt;
import com.gradeledger.core.model.TestMode;
import com.gradeledger.core.model.TestSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;

/**
 * Row mappers shared by the transactional store and the read repositories.
 */
class LedgerRowMappers {

    private static final Logger log = LoggerFactory.getLogger(LedgerRowMappers.class);

    private final ObjectMapper objectMapper;

    LedgerRowMappers(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    // ========== Domain events ==========

    final RowMapper<DomainEvent> event = (rs, rowNum) -> new DomainEvent(
        rs.getString("event_id"),
        rs.getString("type"),
        rs.getString("course_id"),
        rs.getString("actor_uid"),
        rs.getString("actor_role"),
        new EventAggregate(
            AggregateKind.fromWire(rs.getString("aggregate_kind")),
            rs.getString("aggregate_id"),
            (Integer) rs.getObject("aggregate_version")),
        readJson(rs.getString("payload")),
        rs.getString("idempotency_key"),
        rs.getString("request_id"),
        toInstant(rs.getTimestamp("occurred_at"))
    );

    // ========== Course work ==========

    final RowMapper<GradeSource> source = (rs, rowNum) -> {
        String mode = rs.getString("test_mode");
        TestSettings settings = mode == null ? null : new TestSettings(
            TestMode.valueOf(mode),
            rs.getInt("attempts_allowed"),
            rs.getInt("duration_minutes"),
            toInstant(rs.getTimestamp("window_start")),
            toInstant(rs.getTimestamp("window_end")));
        return new GradeSource(
            rs.getString("course_id"),
            SourceType.fromWire(rs.getString("source_type")),
            rs.getString("source_id"),
            rs.getString("title"),
            rs.getDouble("points_possible"),
            rs.getInt("version"),
            toInstant(rs.getTimestamp("due_at")),
            rs.getBoolean("allow_late"),
            settings,
            toInstant(rs.getTimestamp("published_at")));
    };

    final RowMapper<Submission> submission = (rs, rowNum) -> new Submission(
        rs.getString("course_id"),
        rs.getString("assignment_id"),
        rs.getString("student_id"),
        rs.getInt("assignment_version"),
        SubmissionStatus.valueOf(rs.getString("status")),
        toInstant(rs.getTimestamp("submitted_at")),
        rs.getBoolean("late"),
        nullableDouble(rs, "grade_score"),
        rs.getInt("grade_revision"),
        toInstant(rs.getTimestamp("graded_at"))
    );

    final RowMapper<TestAttempt> attempt = (rs, rowNum) -> new TestAttempt(
        rs.getString("course_id"),
        rs.getString("test_id"),
        rs.getString("attempt_id"),
        rs.getString("student_id"),
        rs.getInt("attempt_no"),
        rs.getInt("test_version"),
        AttemptStatus.valueOf(rs.getString("status")),
        toInstant(rs.getTimestamp("started_at")),
        toInstant(rs.getTimestamp("expires_at")),
        nullableDouble(rs, "score"),
        toInstant(rs.getTimestamp("submitted_at"))
    );

    // ========== Grades ==========

    final RowMapper<GradeRecord> grade = (rs, rowNum) -> new GradeRecord(
        rs.getString("course_id"),
        rs.getString("student_id"),
        SourceType.fromWire(rs.getString("source_type")),
        rs.getString("source_id"),
        rs.getInt("source_version"),
        rs.getDouble("score"),
        rs.getDouble("points_possible"),
        rs.getString("feedback"),
        rs.getString("graded_by"),
        rs.getInt("grade_revision"),
        toInstant(rs.getTimestamp("graded_at"))
    );

    final RowMapper<GradebookEntry> gradebook = (rs, rowNum) -> new GradebookEntry(
        rs.getString("course_id"),
        rs.getString("student_id"),
        rs.getDouble("total_score"),
        rs.getDouble("total_possible"),
        toInstant(rs.getTimestamp("computed_at"))
    );

    /**
     * Wrap a mapper so the row's version travels with the value.
     */
    static <T> RowMapper<VersionedRow<T>> versioned(RowMapper<T> mapper) {
        return (rs, rowNum) -> new VersionedRow<>(mapper.mapRow(rs, rowNum), rs.getLong("row_version"));
    }

    String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value cannot be stored as JSON: " + e.getMessage(), e);
        }
    }

    private JsonNode readJson(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            log.warn("Failed to deserialize payload: {}", e.getMessage());
            return null;
        }
    }

    static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }

    private static Double nullableDouble(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }

    record VersionedRow<T>(T value, long version) {}
}
