package com.gradeledger.examples.insights;

import com.gradeledger.core.model.DomainEvent;
import com.gradeledger.core.model.EventType;
import com.gradeledger.insights.AnalyzerThresholds;
import com.gradeledger.insights.InsightAnalyzer;
import com.gradeledger.insights.InsightPresentation;
import com.gradeledger.insights.model.Insight;
import com.gradeledger.insights.model.InsightScope;
import com.gradeledger.insights.model.InsightTypes;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static com.gradeledger.examples.insights.DomainEventSimulator.CS101;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class DomainEventSimulatorTest {

    private static final Instant NOW = Instant.parse("2026-03-02T12:00:00Z");

    private final InsightAnalyzer analyzer = InsightAnalyzer.withDefaultDetectors(AnalyzerThresholds.defaults());

    @Test
    @DisplayName("Same seed and time give the same events")
    void deterministic() {
        List<DomainEvent> first = new DomainEventSimulator("seed-1").simulate(NOW);
        List<DomainEvent> second = new DomainEventSimulator("seed-1").simulate(NOW);

        assertThat(first).isEqualTo(second);
        assertThat(new DomainEventSimulator("seed-2").simulate(NOW)).isNotEqualTo(first);
    }

    @Test
    @DisplayName("Events are well formed, unique and in ledger order")
    void wellFormed() {
        List<DomainEvent> events = new DomainEventSimulator().simulate(NOW);

        assertThat(events).isNotEmpty();
        assertThat(events).extracting(DomainEvent::eventId).doesNotHaveDuplicates();
        assertThat(events).extracting(DomainEvent::idempotencyKey).doesNotHaveDuplicates();
        assertThat(events).allSatisfy(event -> {
            assertThat(event.knownType()).isPresent();
            assertThat(event.occurredAt()).isBeforeOrEqualTo(NOW);
            assertThat(event.occurredAt()).isAfterOrEqualTo(NOW.minusSeconds(7 * 24 * 3600));
        });
        for (int i = 1; i < events.size(); i++) {
            assertThat(events.get(i).occurredAt()).isAfterOrEqualTo(events.get(i - 1).occurredAt());
        }
        assertThat(events.stream().filter(e -> e.isType(EventType.TEST_ATTEMPT_STARTED))
            .filter(e -> e.occurredAt().isAfter(NOW.minusSeconds(45 * 60 + 1))))
            .hasSize(DomainEventSimulator.BURST_STARTS);
    }

    @Test
    @DisplayName("Built in signals surface as insights for any seed")
    void expectedInsightsFire() {
        for (String seed : List.of(DomainEventSimulator.DEFAULT_SEED, "another-seed", "third")) {
            List<Insight> insights = analyzer.analyze(new DomainEventSimulator(seed).simulate(NOW), NOW);

            Set<String> types = insights.stream().map(Insight::insightType).collect(Collectors.toSet());
            assertThat(types).contains(
                InsightTypes.ATTEMPT_BURST,
                InsightTypes.LATE_SUBMISSION_PATTERN,
                InsightTypes.GRADEBOOK_DRIFT,
                InsightTypes.ATTEMPT_DROPOFF);

            assertThat(insights).anySatisfy(insight -> {
                assertThat(insight.insightType()).isEqualTo(InsightTypes.LATE_SUBMISSION_PATTERN);
                assertThat(insight.scope()).isEqualTo(InsightScope.user(CS101, DomainEventSimulator.LATE_STUDENT));
            });
            assertThat(insights).anySatisfy(insight -> {
                assertThat(insight.insightType()).isEqualTo(InsightTypes.ATTEMPT_DROPOFF);
                assertThat(insight.scope()).isEqualTo(InsightScope.user(CS101, DomainEventSimulator.DROPOFF_STUDENT));
            });
            assertThat(insights)
                .filteredOn(insight -> insight.insightType().equals(InsightTypes.GRADEBOOK_DRIFT))
                .allSatisfy(insight -> assertThat(insight.scope().courseId()).isEqualTo(CS101));
        }
    }

    @Test
    @DisplayName("Demo report lists detections and advice")
    void demoReport() {
        InsightSimulationDemo demo = new InsightSimulationDemo(
            new DomainEventSimulator(), analyzer, new InsightPresentation());

        InsightSimulationDemo.Report report = demo.run(NOW);

        assertThat(report.insights()).isNotEmpty();
        assertThat(report.render())
            .contains("Insights generated: " + report.insights().size())
            .contains(InsightTypes.ATTEMPT_BURST)
            .contains(InsightSimulationDemo.adviceFor(InsightTypes.ATTEMPT_BURST));
        assertThat(report.insights()).allSatisfy(insight ->
            assertThat(insight.confidence()).isEqualTo(Math.round(insight.confidence() * 100) / 100.0));
    }

    @Test
    @DisplayName("Blank seed is rejected")
    void blankSeed() {
        assertThatThrownBy(() -> new DomainEventSimulator(" ")).isInstanceOf(IllegalArgumentException.class);
    }
}
