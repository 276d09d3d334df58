package com.gradeledger.insights;

import com.gradeledger.core.model.DomainEvent;
import com.gradeledger.core.model.EventType;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Predicate;

/**
 * Immutable, ordered snapshot handed to every detector.
 * Events are well-formed and sorted by (occurredAt, eventId).
 */
public final class AnalysisWindow {

    private final List<DomainEvent> events;
    private final Instant now;
    private final AnalyzerThresholds thresholds;

    AnalysisWindow(List<DomainEvent> events, Instant now, AnalyzerThresholds thresholds) {
        this.events = List.copyOf(events);
        this.now = now;
        this.thresholds = thresholds;
    }

    public List<DomainEvent> events() {
        return events;
    }

    public Instant now() {
        return now;
    }

    public AnalyzerThresholds thresholds() {
        return thresholds;
    }

    public List<DomainEvent> ofType(EventType type) {
        return filter(e -> e.isType(type));
    }

    public List<DomainEvent> filter(Predicate<DomainEvent> predicate) {
        return events.stream().filter(predicate).toList();
    }

    /**
     * Group events by course, courses in name order, events in ledger order.
     */
    public static Map<String, List<DomainEvent>> byCourse(List<DomainEvent> events) {
        Map<String, List<DomainEvent>> grouped = new TreeMap<>();
        for (DomainEvent event : events) {
            grouped.computeIfAbsent(event.courseId(), k -> new ArrayList<>()).add(event);
        }
        return grouped;
    }

    /**
     * Event ids to cite, in ledger order, capped at the evidence limit.
     */
    public List<String> evidence(List<DomainEvent> cited) {
        return cited.stream()
            .map(DomainEvent::eventId)
            .limit(thresholds.maxEvidence())
            .toList();
    }
}
