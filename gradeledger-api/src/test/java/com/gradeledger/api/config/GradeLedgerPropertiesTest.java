package com.gradeledger.api.config;

import com.gradeledger.insights.AnalyzerThresholds;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

public class GradeLedgerPropertiesTest {

    private static GradeLedgerProperties bind(Map<String, String> values) {
        Binder binder = new Binder(new MapConfigurationPropertySource(values));
        return binder.bindOrCreate("gradeledger", GradeLedgerProperties.class);
    }

    @Test
    @DisplayName("Unset insight properties fall back to the analyzer defaults")
    void defaultsMatchAnalyzer() {
        AnalyzerThresholds bound = bind(Map.of()).getInsights().toThresholds();

        assertThat(bound).isEqualTo(AnalyzerThresholds.defaults());
    }

    @Test
    @DisplayName("Drop-off, late recency and drift thresholds bind from properties")
    void detectorThresholdsBind() {
        GradeLedgerProperties properties = bind(Map.of(
            "gradeledger.insights.late-recency-window", "3d",
            "gradeledger.insights.dropoff-course-min", "6",
            "gradeledger.insights.dropoff-user-min", "3",
            "gradeledger.insights.drift-epsilon", "0.001",
            "gradeledger.insights.burst-min-starts", "5"));

        AnalyzerThresholds thresholds = properties.getInsights().toThresholds();

        assertThat(thresholds.lateRecencyWindow()).isEqualTo(Duration.ofDays(3));
        assertThat(thresholds.dropoffCourseMin()).isEqualTo(6);
        assertThat(thresholds.dropoffUserMin()).isEqualTo(3);
        assertThat(thresholds.driftEpsilon()).isEqualTo(0.001);
        assertThat(thresholds.burstMinStarts()).isEqualTo(5);
        assertThat(thresholds.dropoffDefaultDuration()).isEqualTo(Duration.ofHours(12));
    }
}
