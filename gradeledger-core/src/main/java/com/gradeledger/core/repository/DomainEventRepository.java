package com.gradeledger.core.repository;

import com.gradeledger.core.model.DomainEvent;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Read side of the event ledger.
 * Events are written only through {@link LedgerTransaction#createEvent}.
 */
public interface DomainEventRepository {

    /**
     * Find an event by ID.
     * 
     * @param eventId The content-derived event ID
     * @return The event if found
     */
    Optional<DomainEvent> findById(String eventId);

    /**
     * Find an event by idempotency key.
     * 
     * @param idempotencyKey The idempotency key
     * @return The event if found
     */
    Optional<DomainEvent> findByIdempotencyKey(String idempotencyKey);

    /**
     * Get the most recent events of a course within a time range.
     * 
     * @param courseId The course ID
     * @param from Start time (inclusive)
     * @param to End time (exclusive)
     * @param limit Maximum number of results, newest kept
     * @return Events ordered by (occurredAt, eventId)
     */
    List<DomainEvent> findByCourse(String courseId, Instant from, Instant to, int limit);

    /**
     * Get the most recent events across all courses within a time range.
     * 
     * @param from Start time (inclusive)
     * @param to End time (exclusive)
     * @param limit Maximum number of results, newest kept
     * @return Events ordered by (occurredAt, eventId)
     */
    List<DomainEvent> findByTimeRange(Instant from, Instant to, int limit);

    long count();
}
