package com.gradeledger.insights;

import com.gradeledger.core.model.DomainEvent;
import com.gradeledger.core.repository.DomainEventRepository;
import com.gradeledger.core.time.TimeController;
import com.gradeledger.insights.model.Insight;
import com.gradeledger.insights.model.InsightTypes;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.gradeledger.insights.TestEvents.NOW;
import static com.gradeledger.insights.TestEvents.late;
import static com.gradeledger.insights.TestEvents.recompute;
import static org.assertj.core.api.Assertions.assertThat;

public class LedgerInsightServiceTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final ListEventRepository repository = new ListEventRepository();
    private final LedgerInsightService service = new LedgerInsightService(
        repository,
        InsightAnalyzer.withDefaultDetectors(AnalyzerThresholds.defaults()),
        Duration.ofDays(14),
        TimeController.frozenAt(NOW),
        registry);

    @Test
    @DisplayName("Course analysis reads only that course and counts what it produced")
    void analyzesOneCourse() {
        repository.events.add(late("c1", "u_a", "hw1", NOW.minus(Duration.ofDays(3)), 1.0));
        repository.events.add(late("c1", "u_a", "hw2", NOW.minus(Duration.ofDays(1)), 1.0));
        repository.events.add(recompute("c2", "u_b", NOW.minusSeconds(10), 5, 0));

        List<Insight> insights = service.analyzeCourse("c1");

        assertThat(insights).extracting(Insight::insightType).containsExactly(InsightTypes.LATE_SUBMISSION_PATTERN);
        assertThat(registry.find(LedgerInsightService.INSIGHTS_GENERATED)
            .tag("type", InsightTypes.LATE_SUBMISSION_PATTERN).counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Events older than the lookback are not analyzed")
    void lookbackApplies() {
        repository.events.add(late("c1", "u_a", "hw1", NOW.minus(Duration.ofDays(20)), 1.0));
        repository.events.add(late("c1", "u_a", "hw2", NOW.minus(Duration.ofDays(1)), 1.0));

        assertThat(service.analyzeCourse("c1")).isEmpty();
        assertThat(service.analyzeAll()).isEmpty();
    }

    @Test
    @DisplayName("Analysis never writes to the ledger")
    void readOnly() {
        repository.events.add(recompute("c2", "u_b", NOW.minusSeconds(10), 5, 0));

        assertThat(service.analyzeAll()).hasSize(1);
        assertThat(repository.events).hasSize(1);
    }

    /** Query-only repository over a list. */
    private static final class ListEventRepository implements DomainEventRepository {
        private final List<DomainEvent> events = new ArrayList<>();

        @Override
        public Optional<DomainEvent> findById(String eventId) {
            return events.stream().filter(e -> e.eventId().equals(eventId)).findFirst();
        }

        @Override
        public Optional<DomainEvent> findByIdempotencyKey(String idempotencyKey) {
            return events.stream().filter(e -> e.idempotencyKey().equals(idempotencyKey)).findFirst();
        }

        @Override
        public List<DomainEvent> findByCourse(String courseId, Instant from, Instant to, int limit) {
            return events.stream()
                .filter(e -> e.courseId().equals(courseId) && inRange(e, from, to))
                .limit(limit)
                .toList();
        }

        @Override
        public List<DomainEvent> findByTimeRange(Instant from, Instant to, int limit) {
            return events.stream().filter(e -> inRange(e, from, to)).limit(limit).toList();
        }

        @Override
        public long count() {
            return events.size();
        }

        private static boolean inRange(DomainEvent event, Instant from, Instant to) {
            return !event.occurredAt().isBefore(from) && event.occurredAt().isBefore(to);
        }
    }
}
