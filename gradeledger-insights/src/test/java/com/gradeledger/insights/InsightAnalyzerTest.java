package com.gradeledger.insights;

import com.gradeledger.core.model.DomainEvent;
import com.gradeledger.core.model.AggregateKind;
import com.gradeledger.core.model.EventAggregate;
import com.gradeledger.core.model.EventType;
import com.gradeledger.insights.detector.LatePatternDetector;
import com.gradeledger.insights.model.Insight;
import com.gradeledger.insights.model.InsightScope;
import com.gradeledger.insights.model.InsightTypes;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static com.gradeledger.insights.TestEvents.NOW;
import static com.gradeledger.insights.TestEvents.attemptStarted;
import static com.gradeledger.insights.TestEvents.late;
import static com.gradeledger.insights.TestEvents.recompute;
import static org.assertj.core.api.Assertions.assertThat;

public class InsightAnalyzerTest {

    private final InsightAnalyzer analyzer = InsightAnalyzer.withDefaultDetectors(AnalyzerThresholds.defaults());

    @Test
    @DisplayName("Identical snapshots give identical output regardless of input order")
    void pureAndOrderIndependent() {
        List<DomainEvent> events = mixedSnapshot();
        List<DomainEvent> shuffled = new ArrayList<>(events);
        Collections.shuffle(shuffled, new Random(7));

        List<Insight> first = analyzer.analyze(events, NOW);
        List<Insight> second = analyzer.analyze(shuffled, NOW);

        assertThat(first).isNotEmpty().isEqualTo(second);
        assertThat(first).extracting(Insight::insightType).containsExactly(
            InsightTypes.ATTEMPT_BURST,
            InsightTypes.LATE_SUBMISSION_PATTERN,
            InsightTypes.GRADEBOOK_DRIFT);
    }

    @Test
    @DisplayName("Malformed and unknown events are skipped without failing the analysis")
    void toleratesBadInput() {
        List<DomainEvent> events = new ArrayList<>(mixedSnapshot());
        events.add(null);
        events.add(new DomainEvent("", "submission.late", "c1", "u", "student",
            EventAggregate.unversioned(AggregateKind.COURSE, "c1"), null, "k", null, NOW));
        events.add(new DomainEvent("abc", "submission.late", "c1", "u", "student",
            EventAggregate.unversioned(AggregateKind.COURSE, "c1"), null, "k2", null, null));
        events.add(TestEvents.event(
            EventType.ASSIGNMENT_PUBLISHED, "c1", NOW, "x", p -> p.put("odd", true)));
        events.add(new DomainEvent("def", "stream.post.created", "c1", "u", "student",
            EventAggregate.unversioned(AggregateKind.STREAM_POST, "p1"), null, "k3", null, NOW));

        assertThat(analyzer.analyze(events, NOW)).isEqualTo(analyzer.analyze(mixedSnapshot(), NOW));
    }

    @Test
    @DisplayName("A failing detector does not stop the others")
    void detectorFailureIsolated() {
        InsightDetector broken = new InsightDetector() {
            @Override
            public String insightType() {
                return "broken";
            }

            @Override
            public List<Insight> detect(AnalysisWindow window) {
                throw new IllegalStateException("boom");
            }
        };
        InsightAnalyzer withBroken = new InsightAnalyzer(
            List.of(broken, new LatePatternDetector()), AnalyzerThresholds.defaults());

        assertThat(withBroken.analyze(mixedSnapshot(), NOW))
            .extracting(Insight::insightType)
            .containsExactly(InsightTypes.LATE_SUBMISSION_PATTERN);
    }

    @Test
    @DisplayName("Insights without evidence are dropped")
    void evidenceRequired() {
        InsightDetector empty = new InsightDetector() {
            @Override
            public String insightType() {
                return "empty";
            }

            @Override
            public List<Insight> detect(AnalysisWindow window) {
                return List.of(new Insight("empty", InsightScope.course("c1"), "no evidence", List.of(), 0.9, "n/a"));
            }
        };

        assertThat(new InsightAnalyzer(List.of(empty), AnalyzerThresholds.defaults()).analyze(mixedSnapshot(), NOW))
            .isEmpty();
    }

    @Test
    @DisplayName("Only the most recent events within the bound are analyzed")
    void boundedToMostRecent() {
        List<DomainEvent> events = new ArrayList<>();
        events.add(late("c1", "u_a", "hw1", NOW.minus(Duration.ofDays(3)), 1.0));
        events.add(late("c1", "u_a", "hw2", NOW.minus(Duration.ofDays(2)), 1.0));
        for (int i = 0; i < 5; i++) {
            events.add(attemptStarted("c2", "u_" + i, 1, NOW.minusSeconds(60 - i), 120));
        }

        InsightAnalyzer bounded = InsightAnalyzer.withDefaultDetectors(
            AnalyzerThresholds.builder().maxEvents(5).build());

        assertThat(bounded.analyze(events, NOW)).isEmpty();
        assertThat(analyzer.analyze(events, NOW))
            .extracting(Insight::insightType)
            .containsExactly(InsightTypes.LATE_SUBMISSION_PATTERN);
    }

    @Test
    @DisplayName("Empty snapshot gives no insights")
    void emptySnapshot() {
        assertThat(analyzer.analyze(List.of(), NOW)).isEmpty();
        assertThat(analyzer.analyze(null, NOW)).isEmpty();
    }

    private static List<DomainEvent> mixedSnapshot() {
        List<DomainEvent> events = new ArrayList<>();
        for (int i = 0; i < 18; i++) {
            events.add(attemptStarted("c1", "u_" + i, 1, NOW.minus(Duration.ofMinutes(45)).plusSeconds(150L * i), 60));
        }
        events.add(late("c1", "u_a", "hw1", NOW.minus(Duration.ofDays(4)), 2.0));
        events.add(late("c1", "u_a", "hw2", NOW.minus(Duration.ofDays(2)), 6.0));
        events.add(recompute("c1", "u_b", NOW.minus(Duration.ofHours(1)), 7, 0));
        return events;
    }
}
