package com.gradeledger.engine.persistence.jdbc;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gradeledger.core.model.DomainEvent;
import com.gradeledger.core.repository.DomainEventRepository;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL-backed read side of the event ledger.
 * Range queries select the newest rows first and hand them back oldest first.
 */
public class JdbcDomainEventRepository implements DomainEventRepository {

    private final JdbcTemplate jdbcTemplate;
    private final LedgerRowMappers mappers;

    public JdbcDomainEventRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.mappers = new LedgerRowMappers(objectMapper);
    }

    @Override
    public Optional<DomainEvent> findById(String eventId) {
        String sql = "SELECT * FROM domain_events WHERE event_id = ?";
        List<DomainEvent> results = jdbcTemplate.query(sql, mappers.event, eventId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public Optional<DomainEvent> findByIdempotencyKey(String idempotencyKey) {
        String sql = "SELECT * FROM domain_events WHERE idempotency_key = ?";
        List<DomainEvent> results = jdbcTemplate.query(sql, mappers.event, idempotencyKey);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<DomainEvent> findByCourse(String courseId, Instant from, Instant to, int limit) {
        String sql = """
            SELECT * FROM domain_events
            WHERE course_id = ? AND occurred_at >= ? AND occurred_at < ?
            ORDER BY occurred_at DESC, event_id DESC
            LIMIT ?
            """;
        return oldestFirst(jdbcTemplate.query(sql, mappers.event,
            courseId, Timestamp.from(from), Timestamp.from(to), limit));
    }

    @Override
    public List<DomainEvent> findByTimeRange(Instant from, Instant to, int limit) {
        String sql = """
            SELECT * FROM domain_events
            WHERE occurred_at >= ? AND occurred_at < ?
            ORDER BY occurred_at DESC, event_id DESC
            LIMIT ?
            """;
        return oldestFirst(jdbcTemplate.query(sql, mappers.event,
            Timestamp.from(from), Timestamp.from(to), limit));
    }

    @Override
    public long count() {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM domain_events", Long.class);
        return count != null ? count : 0L;
    }

    private static List<DomainEvent> oldestFirst(List<DomainEvent> newestFirst) {
        List<DomainEvent> events = new ArrayList<>(newestFirst);
        Collections.reverse(events);
        return events;
    }
}
