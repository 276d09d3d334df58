package com.gradeledger.insights.detector;

import com.gradeledger.core.model.DomainEvent;
import com.gradeledger.core.model.EventType;
import com.gradeledger.insights.AnalysisWindow;
import com.gradeledger.insights.AnalyzerThresholds;
import com.gradeledger.insights.InsightDetector;
import com.gradeledger.insights.model.Insight;
import com.gradeledger.insights.model.InsightScope;
import com.gradeledger.insights.model.InsightTypes;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.TreeMap;

/**
 * Flags a student who keeps submitting late in the same course.
 */
public class LatePatternDetector implements InsightDetector {

    private static final String INVALIDATION =
        "If the student's next assignment in this course is submitted on time, or the lateness is covered "
            + "by an accommodation or extended deadline not visible in events, this pattern may not reflect risk.";

    @Override
    public String insightType() {
        return InsightTypes.LATE_SUBMISSION_PATTERN;
    }

    @Override
    public List<Insight> detect(AnalysisWindow window) {
        AnalyzerThresholds thresholds = window.thresholds();
        Instant since = window.now().minus(thresholds.lateWindow());

        // course -> student -> late events
        Map<String, Map<String, List<DomainEvent>>> lates = new TreeMap<>();
        for (DomainEvent event : window.ofType(EventType.SUBMISSION_LATE)) {
            if (event.occurredAt().isBefore(since) || event.occurredAt().isAfter(window.now())) {
                continue;
            }
            event.payloadText("studentId").ifPresent(studentId -> lates
                .computeIfAbsent(event.courseId(), k -> new TreeMap<>())
                .computeIfAbsent(studentId, k -> new ArrayList<>())
                .add(event));
        }

        List<Insight> insights = new ArrayList<>();
        for (Map.Entry<String, Map<String, List<DomainEvent>>> course : lates.entrySet()) {
            for (Map.Entry<String, List<DomainEvent>> student : course.getValue().entrySet()) {
                List<DomainEvent> events = student.getValue();
                if (events.size() < thresholds.lateMinCount()) {
                    continue;
                }

                DomainEvent latest = events.get(events.size() - 1);
                double confidence = InsightDetector.clamp01(
                    0.45
                        + Math.min(0.35, (events.size() - thresholds.lateMinCount()) * 0.15)
                        + recencyBonus(latest.occurredAt(), window.now(), thresholds.lateRecencyWindow()));

                OptionalDouble avgLateHours = events.stream()
                    .map(e -> e.payloadNumber("lateByHours"))
                    .filter(OptionalDouble::isPresent)
                    .mapToDouble(OptionalDouble::getAsDouble)
                    .average();
                String why = String.format(Locale.ROOT,
                    "Multiple late submissions detected (count=%d, avgLateHours=%s). "
                        + "Pattern may indicate workload overload or disengagement risk.",
                    events.size(),
                    avgLateHours.isPresent() ? String.format(Locale.ROOT, "%.1f", avgLateHours.getAsDouble()) : "unknown");

                insights.add(new Insight(
                    InsightTypes.LATE_SUBMISSION_PATTERN,
                    InsightScope.user(course.getKey(), student.getKey()),
                    why,
                    window.evidence(events),
                    confidence,
                    INVALIDATION));
            }
        }
        return insights;
    }

    /**
     * Up to 0.1 extra, fading linearly as the latest late submission ages.
     */
    static double recencyBonus(Instant latest, Instant now, Duration recencyWindow) {
        if (recencyWindow.isZero() || recencyWindow.isNegative()) {
            return 0.0;
        }
        double age = Math.max(0, Duration.between(latest, now).toMillis());
        double span = recencyWindow.toMillis();
        if (age >= span) {
            return 0.0;
        }
        return 0.1 * (1.0 - age / span);
    }
}
