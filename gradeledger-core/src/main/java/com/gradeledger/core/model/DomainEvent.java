package com.gradeledger.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Immutable record of something that happened.
 * Append-only ledger entry, the single input of insight analysis.
 * 
 * Primary Key: eventId = sha256(idempotencyKey)
 * Index: (courseId, occurredAt)
 * 
 * Invariants:
 * - at most one stored event per idempotencyKey
 * - events are never deleted or modified; the payload is copied on the way in
 *   and on the way out, so no caller holds a node the ledger stores
 * - type is an open string; unknown types are legal and must be tolerated by readers
 */
public record DomainEvent(
    // Primary key
    String eventId,

    // Event data
    String type,
    String courseId,

    // Actor (who caused this event)
    String actorUid,
    String actorRole,

    // Subject
    EventAggregate aggregate,
    JsonNode payload,

    // Deduplication and tracing
    String idempotencyKey,
    String requestId,

    Instant occurredAt
) {
    public DomainEvent {
        payload = payload == null ? null : payload.deepCopy();
    }

    /**
     * Copy of the payload. Use the {@code payload*} readers for single fields.
     */
    @Override
    public JsonNode payload() {
        return payload == null ? null : payload.deepCopy();
    }

    public boolean isType(EventType eventType) {
        return eventType.matches(type);
    }

    public Optional<EventType> knownType() {
        return EventType.fromWire(type);
    }

    /**
     * Text value of a top-level payload field, if present and non-blank.
     */
    public Optional<String> payloadText(String field) {
        if (payload == null) {
            return Optional.empty();
        }
        JsonNode node = payload.get(field);
        if (node == null || !node.isTextual() || node.asText().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(node.asText());
    }

    /**
     * Numeric value of a top-level payload field, if present and finite.
     */
    public OptionalDouble payloadNumber(String field) {
        if (payload == null) {
            return OptionalDouble.empty();
        }
        JsonNode node = payload.get(field);
        if (node == null || !node.isNumber()) {
            return OptionalDouble.empty();
        }
        double value = node.asDouble();
        return Double.isFinite(value) ? OptionalDouble.of(value) : OptionalDouble.empty();
    }

    /**
     * Boolean payload field; absent or non-boolean values read as false.
     */
    public boolean payloadFlag(String field) {
        if (payload == null) {
            return false;
        }
        JsonNode node = payload.get(field);
        return node != null && node.isBoolean() && node.asBoolean();
    }
}
