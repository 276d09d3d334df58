package com.gradeledger.insights;

import com.gradeledger.insights.model.Insight;
import com.gradeledger.insights.model.InsightScope;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class InsightPresentationTest {

    private final InsightPresentation presentation = new InsightPresentation();

    @Test
    @DisplayName("Confidence is rounded to two decimals")
    void roundsConfidence() {
        assertThat(presentation.normalize(insight(0.7749)).confidence()).isEqualTo(0.77);
        assertThat(presentation.normalize(insight(0.775)).confidence()).isEqualTo(0.78);
    }

    @Test
    @DisplayName("Low-confidence insights are labelled informational once")
    void labelsLowConfidence() {
        Insight low = presentation.normalize(insight(0.35));

        assertThat(low.whyGenerated()).isEqualTo("INFORMATIONAL ONLY: Something happened.");
        assertThat(presentation.normalize(low).whyGenerated()).isEqualTo(low.whyGenerated());
        assertThat(presentation.isInformationalOnly(low)).isTrue();
    }

    @Test
    @DisplayName("Insights at or above the cutoff keep their text")
    void leavesConfidentInsights() {
        List<Insight> normalized = presentation.normalize(List.of(insight(0.4), insight(0.9)));

        assertThat(normalized).extracting(Insight::whyGenerated).containsOnly("Something happened.");
        assertThat(normalized.get(0).evidenceRefs()).containsExactly("e1");
    }

    private static Insight insight(double confidence) {
        return new Insight("x.type", InsightScope.course("c1"), "Something happened.", List.of("e1"), confidence, "n/a");
    }
}
