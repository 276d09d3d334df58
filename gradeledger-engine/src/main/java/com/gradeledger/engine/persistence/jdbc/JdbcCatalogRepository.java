package com.gradeledger.engine.persistence.jdbc;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gradeledger.core.model.GradeSource;
import com.gradeledger.core.model.SourceType;
import com.gradeledger.core.model.Submission;
import com.gradeledger.core.model.TestAttempt;
import com.gradeledger.core.repository.CatalogRepository;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL-backed implementation of CatalogRepository.
 */
public class JdbcCatalogRepository implements CatalogRepository {

    private final JdbcTemplate jdbcTemplate;
    private final LedgerRowMappers mappers;

    public JdbcCatalogRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.mappers = new LedgerRowMappers(objectMapper);
    }

    @Override
    public Optional<GradeSource> findSource(String courseId, SourceType sourceType, String sourceId) {
        String sql = "SELECT * FROM grade_sources WHERE course_id = ? AND source_type = ? AND source_id = ?";
        List<GradeSource> results = jdbcTemplate.query(sql, mappers.source, courseId, sourceType.wireName(), sourceId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<GradeSource> findSources(String courseId) {
        String sql = """
            SELECT * FROM grade_sources
            WHERE course_id = ?
            ORDER BY source_type ASC, source_id ASC
            """;
        return jdbcTemplate.query(sql, mappers.source, courseId);
    }

    @Override
    public Optional<Submission> findSubmission(String courseId, String assignmentId, String studentId) {
        String sql = "SELECT * FROM submissions WHERE course_id = ? AND assignment_id = ? AND student_id = ?";
        List<Submission> results = jdbcTemplate.query(sql, mappers.submission, courseId, assignmentId, studentId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public Optional<TestAttempt> findAttempt(String courseId, String testId, String attemptId) {
        String sql = "SELECT * FROM test_attempts WHERE course_id = ? AND test_id = ? AND attempt_id = ?";
        List<TestAttempt> results = jdbcTemplate.query(sql, mappers.attempt, courseId, testId, attemptId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }
}
