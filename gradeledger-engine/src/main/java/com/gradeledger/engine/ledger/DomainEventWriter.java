package com.gradeledger.engine.ledger;

import com.fasterxml.jackson.databind.JsonNode;
import com.gradeledger.core.exception.ValidationException;
import com.gradeledger.core.model.Actor;
import com.gradeledger.core.model.DomainEvent;
import com.gradeledger.core.model.EventAggregate;
import com.gradeledger.core.model.EventIds;
import com.gradeledger.core.repository.LedgerTransaction;
import com.gradeledger.engine.metrics.LedgerMetrics;
import com.gradeledger.engine.tx.TransactionRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Iterator;
import java.util.Optional;

/**
 * Writes domain events to the ledger.
 * 
 * <p>The event id is derived from the idempotency key, and the write is
 * create-if-absent: emitting the same key twice returns the stored event
 * unchanged. Emits run inside the caller's transaction, so an event exists
 * exactly when the mutation it describes committed.</p>
 */
public class DomainEventWriter {

    private static final Logger log = LoggerFactory.getLogger(DomainEventWriter.class);

    private final Clock clock;
    private final LedgerMetrics metrics;

    public DomainEventWriter(Clock clock, LedgerMetrics metrics) {
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Emit an event as part of an open transaction.
     * Malformed requests are rejected before anything is read or written.
     * 
     * @param tx The caller's transaction
     * @param request The event to write
     * @return The stored event, either new or the one already under this key
     * @throws ValidationException if the request is malformed
     */
    public DomainEvent emit(LedgerTransaction tx, EmitRequest request) {
        return append(tx, request).event();
    }

    /**
     * Same as {@link #emit(LedgerTransaction, EmitRequest)}, also telling
     * whether this call created the event.
     */
    public Emission append(LedgerTransaction tx, EmitRequest request) {
        validate(request);

        String eventId = EventIds.fromIdempotencyKey(request.idempotencyKey());
        Optional<DomainEvent> existing = tx.readEvent(eventId);
        if (existing.isPresent()) {
            log.debug("Event {} already recorded for key {}", eventId, request.idempotencyKey());
            return new Emission(existing.get(), false);
        }

        DomainEvent event = new DomainEvent(
            eventId,
            request.type(),
            request.courseId(),
            request.actor().uid(),
            request.actor().role(),
            request.aggregate(),
            request.payload(),
            request.idempotencyKey(),
            request.requestId(),
            clock.instant()
        );
        tx.createEvent(event);
        return new Emission(event, true);
    }

    /**
     * Emit an event in a transaction of its own, for events that do not
     * accompany a business mutation.
     */
    public DomainEvent emit(TransactionRunner runner, EmitRequest request) {
        validate(request);

        Emission emission = runner.execute("emit:" + request.type(), tx -> append(tx, request));
        recordCommitted(emission);
        if (emission.created()) {
            log.info("Emitted {} for course {} ({})",
                request.type(), request.courseId(), emission.event().eventId());
        }
        return emission.event();
    }

    /**
     * Count an emission once its transaction has committed.
     */
    public void recordCommitted(Emission emission) {
        if (emission.created()) {
            metrics.eventEmitted(emission.event().type());
        } else {
            metrics.eventDuplicate(emission.event().type());
        }
    }

    private void validate(EmitRequest request) {
        if (request == null) {
            throw new ValidationException("event", "cannot be null");
        }
        if (isBlank(request.idempotencyKey())) {
            throw new ValidationException("idempotencyKey", "cannot be empty");
        }
        if (isBlank(request.type())) {
            throw new ValidationException("type", "cannot be empty");
        }
        if (isBlank(request.courseId())) {
            throw new ValidationException("courseId", "cannot be empty");
        }
        if (request.actor() == null || request.actor().isBlank()) {
            throw new ValidationException("actor", "uid and role are required");
        }
        EventAggregate aggregate = request.aggregate();
        if (aggregate == null || aggregate.kind() == null || isBlank(aggregate.id())) {
            throw new ValidationException("aggregate", "kind and id are required");
        }
        JsonNode payload = request.payload();
        if (payload == null || !payload.isObject()) {
            throw new ValidationException("payload", "must be a JSON object");
        }
        if (containsNonFiniteNumber(payload)) {
            throw new ValidationException("payload", "numbers must be finite");
        }
    }

    private static boolean containsNonFiniteNumber(JsonNode node) {
        if (node.isNumber()) {
            return !Double.isFinite(node.asDouble());
        }
        if (node.isContainerNode()) {
            Iterator<JsonNode> children = node.elements();
            while (children.hasNext()) {
                if (containsNonFiniteNumber(children.next())) {
                    return true;
                }
            }
        }
        return false;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public record Emission(DomainEvent event, boolean created) {}

    /**
     * Input of an emit. The actor has already been authorized by the caller.
     */
    public record EmitRequest(
        String type,
        String courseId,
        Actor actor,
        EventAggregate aggregate,
        JsonNode payload,
        String idempotencyKey,
        String requestId
    ) {}
}
