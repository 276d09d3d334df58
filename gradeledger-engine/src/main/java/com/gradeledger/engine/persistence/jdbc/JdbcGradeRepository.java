package com.gradeledger.engine.persistence.jdbc;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gradeledger.core.model.GradeRecord;
import com.gradeledger.core.repository.GradeRepository;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL-backed implementation of GradeRepository.
 */
public class JdbcGradeRepository implements GradeRepository {

    private final JdbcTemplate jdbcTemplate;
    private final LedgerRowMappers mappers;

    public JdbcGradeRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.mappers = new LedgerRowMappers(objectMapper);
    }

    @Override
    public Optional<GradeRecord> findById(String courseId, String gradeId) {
        String sql = "SELECT * FROM grade_records WHERE course_id = ? AND grade_id = ?";
        List<GradeRecord> results = jdbcTemplate.query(sql, mappers.grade, courseId, gradeId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<GradeRecord> findByStudent(String courseId, String studentId) {
        String sql = """
            SELECT * FROM grade_records
            WHERE course_id = ? AND student_id = ?
            ORDER BY grade_id ASC
            """;
        return jdbcTemplate.query(sql, mappers.grade, courseId, studentId);
    }
}
