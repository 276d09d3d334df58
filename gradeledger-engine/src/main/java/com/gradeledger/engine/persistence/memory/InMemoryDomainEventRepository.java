package com.gradeledger.engine.persistence.memory;

import com.gradeledger.core.model.DomainEvent;
import com.gradeledger.core.model.EventIds;
import com.gradeledger.core.repository.DomainEventRepository;
import com.gradeledger.engine.persistence.DocumentKeys;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * In-memory implementation of DomainEventRepository over the shared document store.
 */
public class InMemoryDomainEventRepository implements DomainEventRepository {

    static final Comparator<DomainEvent> LEDGER_ORDER =
        Comparator.comparing(DomainEvent::occurredAt).thenComparing(DomainEvent::eventId);

    private final VersionedDocumentStore documents;

    public InMemoryDomainEventRepository(VersionedDocumentStore documents) {
        this.documents = documents;
    }

    @Override
    public Optional<DomainEvent> findById(String eventId) {
        Object value = documents.get(DocumentKeys.event(eventId)).value();
        return Optional.ofNullable((DomainEvent) value);
    }

    @Override
    public Optional<DomainEvent> findByIdempotencyKey(String idempotencyKey) {
        return findById(EventIds.fromIdempotencyKey(idempotencyKey))
            .filter(e -> e.idempotencyKey().equals(idempotencyKey));
    }

    @Override
    public List<DomainEvent> findByCourse(String courseId, Instant from, Instant to, int limit) {
        return newest(e -> e.courseId().equals(courseId) && inRange(e, from, to), limit);
    }

    @Override
    public List<DomainEvent> findByTimeRange(Instant from, Instant to, int limit) {
        return newest(e -> inRange(e, from, to), limit);
    }

    @Override
    public long count() {
        return documents.scan(DocumentKeys.event("")).size();
    }

    private List<DomainEvent> newest(Predicate<DomainEvent> filter, int limit) {
        List<DomainEvent> matching = documents.valuesUnder(DocumentKeys.event(""), DomainEvent.class).stream()
            .filter(filter)
            .sorted(LEDGER_ORDER)
            .toList();
        return matching.size() > limit ? matching.subList(matching.size() - limit, matching.size()) : matching;
    }

    private static boolean inRange(DomainEvent event, Instant from, Instant to) {
        return !event.occurredAt().isBefore(from) && event.occurredAt().isBefore(to);
    }
}
