package com.gradeledger.insights.detector;

import com.gradeledger.core.model.DomainEvent;
import com.gradeledger.core.model.EventType;
import com.gradeledger.insights.TestEvents;
import com.gradeledger.insights.model.Insight;
import com.gradeledger.insights.model.InsightScope;
import com.gradeledger.insights.model.InsightTypes;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.gradeledger.insights.TestEvents.NOW;
import static com.gradeledger.insights.TestEvents.recompute;
import static com.gradeledger.insights.TestEvents.window;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

public class GradebookDriftDetectorTest {

    private final GradebookDriftDetector detector = new GradebookDriftDetector();

    @Test
    @DisplayName("A score delta of 7 is flagged")
    void deltaFires() {
        DomainEvent event = recompute("c1", "u_a", NOW.minusSeconds(30), 7, 0);

        List<Insight> insights = detector.detect(window(List.of(event)));

        assertThat(insights).singleElement().satisfies(insight -> {
            assertThat(insight.insightType()).isEqualTo(InsightTypes.GRADEBOOK_DRIFT);
            assertThat(insight.scope()).isEqualTo(InsightScope.user("c1", "u_a"));
            assertThat(insight.confidence()).isCloseTo(0.6 + 7 / 40.0, within(1e-9));
            assertThat(insight.evidenceRefs()).containsExactly(event.eventId());
        });
    }

    @Test
    @DisplayName("A zero delta is not flagged")
    void zeroDeltaDoesNotFire() {
        assertThat(detector.detect(window(List.of(recompute("c1", "u_a", NOW, 0, 0))))).isEmpty();
    }

    @Test
    @DisplayName("Points-possible drift adds its own share of confidence")
    void possibleDeltaCounts() {
        List<Insight> insights = detector.detect(window(List.of(recompute("c1", "u_a", NOW, 0, -50))));

        assertThat(insights).singleElement()
            .satisfies(insight -> assertThat(insight.confidence()).isCloseTo(0.7, within(1e-9)));
    }

    @Test
    @DisplayName("A drift flag without readable deltas fires at the base confidence")
    void flagWithoutDeltas() {
        DomainEvent event = TestEvents.event(EventType.GRADEBOOK_RECOMPUTED, "c1", NOW, "u_a", p -> {
            p.put("studentId", "u_a");
            p.put("driftFlagged", true);
            p.put("deltaTotalScore", "not a number");
        });

        assertThat(detector.detect(window(List.of(event)))).singleElement()
            .satisfies(insight -> assertThat(insight.confidence()).isEqualTo(0.6));
    }

    @Test
    @DisplayName("Repeated drift for one student yields one insight rated by the worst delta")
    void groupedPerStudent() {
        DomainEvent small = recompute("c1", "u_a", NOW.minusSeconds(120), 1, 0);
        DomainEvent big = recompute("c1", "u_a", NOW.minusSeconds(60), 20, 0);

        assertThat(detector.detect(window(List.of(small, big)))).singleElement().satisfies(insight -> {
            assertThat(insight.evidenceRefs()).containsExactly(small.eventId(), big.eventId());
            assertThat(insight.confidence()).isCloseTo(0.85, within(1e-9));
        });
    }
}
