package com.gradeledger.engine.persistence.jdbc;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gradeledger.core.model.GradebookEntry;
import com.gradeledger.core.repository.GradebookRepository;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL-backed implementation of GradebookRepository.
 */
public class JdbcGradebookRepository implements GradebookRepository {

    private final JdbcTemplate jdbcTemplate;
    private final LedgerRowMappers mappers;

    public JdbcGradebookRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.mappers = new LedgerRowMappers(objectMapper);
    }

    @Override
    public Optional<GradebookEntry> find(String courseId, String studentId) {
        String sql = "SELECT * FROM gradebook_entries WHERE course_id = ? AND student_id = ?";
        List<GradebookEntry> results = jdbcTemplate.query(sql, mappers.gradebook, courseId, studentId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<GradebookEntry> findByCourse(String courseId) {
        String sql = "SELECT * FROM gradebook_entries WHERE course_id = ? ORDER BY student_id ASC";
        return jdbcTemplate.query(sql, mappers.gradebook, courseId);
    }

    @Override
    public List<GradebookEntry> findAll() {
        String sql = "SELECT * FROM gradebook_entries ORDER BY course_id ASC, student_id ASC";
        return jdbcTemplate.query(sql, mappers.gradebook);
    }
}
