package com.gradeledger.engine.persistence.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gradeledger.core.model.AuditEntry;
import com.gradeledger.core.repository.AuditLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Timestamp;
import java.util.List;
import java.util.Map;

/**
 * PostgreSQL-backed audit trail. Rows are never updated.
 */
public class JdbcAuditLogRepository implements AuditLogRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcAuditLogRepository.class);

    private final JdbcTemplate jdbcTemplate;
    private final LedgerRowMappers mappers;
    private final ObjectMapper objectMapper;
    private final RowMapper<AuditEntry> rowMapper;

    public JdbcAuditLogRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.mappers = new LedgerRowMappers(objectMapper);
        this.rowMapper = (rs, rowNum) -> new AuditEntry(
            rs.getString("action"),
            rs.getString("actor_uid"),
            rs.getString("actor_role"),
            rs.getString("target_uid"),
            rs.getString("request_id"),
            readMetadata(rs.getString("metadata")),
            rs.getTimestamp("created_at").toInstant()
        );
    }

    @Override
    public void append(AuditEntry entry) {
        String sql = """
            INSERT INTO audit_log (
                action, actor_uid, actor_role, target_uid, request_id, metadata, created_at
            ) VALUES (?, ?, ?, ?, ?, ?::jsonb, ?)
            """;
        jdbcTemplate.update(sql,
            entry.action(),
            entry.actorUid(),
            entry.actorRole(),
            entry.targetUid(),
            entry.requestId(),
            mappers.writeJson(entry.metadata() != null ? entry.metadata() : Map.of()),
            Timestamp.from(entry.createdAt())
        );
        log.debug("Appended audit entry {} by {}", entry.action(), entry.actorUid());
    }

    @Override
    public List<AuditEntry> findRecent(int limit) {
        String sql = "SELECT * FROM audit_log ORDER BY id DESC LIMIT ?";
        return jdbcTemplate.query(sql, rowMapper, limit);
    }

    private Map<String, Object> readMetadata(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {});
        } catch (JsonProcessingException e) {
            log.warn("Failed to deserialize audit metadata: {}", e.getMessage());
            return Map.of();
        }
    }
}
