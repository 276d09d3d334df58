package com.gradeledger.api.rest;

import com.gradeledger.core.exception.NotFoundException;
import com.gradeledger.core.exception.ValidationException;
import com.gradeledger.core.model.DomainEvent;
import com.gradeledger.core.repository.DomainEventRepository;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Read-only access to the event ledger.
 */
@RestController
@RequestMapping("/api/v1")
public class EventController {

    static final int MAX_LIMIT = 1000;
    private static final Duration DEFAULT_RANGE = Duration.ofDays(30);

    private final DomainEventRepository eventRepository;
    private final Clock clock;

    public EventController(DomainEventRepository eventRepository, Clock clock) {
        this.eventRepository = eventRepository;
        this.clock = clock;
    }

    /**
     * Events of a course in [from, to), oldest first, newest {@code limit} kept.
     * Defaults to the last 30 days.
     */
    @GetMapping("/courses/{courseId}/events")
    public ResponseEntity<List<DomainEvent>> getCourseEvents(
            @PathVariable String courseId,
            @RequestParam(required = false) Instant from,
            @RequestParam(required = false) Instant to,
            @RequestParam(defaultValue = "100") int limit) {

        if (limit < 1 || limit > MAX_LIMIT) {
            throw new ValidationException("limit", "must be between 1 and " + MAX_LIMIT);
        }
        Instant end = to != null ? to : clock.instant().plusNanos(1);
        Instant start = from != null ? from : end.minus(DEFAULT_RANGE);
        if (!start.isBefore(end)) {
            throw new ValidationException("from", "must be before to");
        }
        return ResponseEntity.ok(eventRepository.findByCourse(courseId, start, end, limit));
    }

    @GetMapping("/events/{eventId}")
    public ResponseEntity<DomainEvent> getEvent(@PathVariable String eventId) {
        return eventRepository.findById(eventId)
            .map(ResponseEntity::ok)
            .orElseThrow(() -> new NotFoundException("DomainEvent", eventId));
    }
}
