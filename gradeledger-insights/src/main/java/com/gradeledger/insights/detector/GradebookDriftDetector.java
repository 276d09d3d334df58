package com.gradeledger.insights.detector;

import com.gradeledger.core.model.DomainEvent;
import com.gradeledger.core.model.EventType;
import com.gradeledger.insights.AnalysisWindow;
import com.gradeledger.insights.InsightDetector;
import com.gradeledger.insights.model.Insight;
import com.gradeledger.insights.model.InsightScope;
import com.gradeledger.insights.model.InsightTypes;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.TreeMap;

/**
 * Surfaces gradebook recomputes that found totals out of line with the grade
 * records. One insight per student, rated by the largest drift seen.
 */
public class GradebookDriftDetector implements InsightDetector {

    private static final String INVALIDATION =
        "If a later recompute shows no drift with stable totals, or the drift is explained by a legitimate "
            + "grade change not visible in events, this concern may be reduced.";

    @Override
    public String insightType() {
        return InsightTypes.GRADEBOOK_DRIFT;
    }

    @Override
    public List<Insight> detect(AnalysisWindow window) {
        double epsilon = window.thresholds().driftEpsilon();

        // course -> student -> drift findings
        Map<String, Map<String, List<Drift>>> drifts = new TreeMap<>();
        for (DomainEvent event : window.filter(e -> e.isType(EventType.GRADEBOOK_STUDENT_RECOMPUTED)
                || e.isType(EventType.GRADEBOOK_RECOMPUTED))) {
            String studentId = event.payloadText("studentId").orElse(null);
            if (studentId == null) {
                continue;
            }
            OptionalDouble deltaScore = event.payloadNumber("deltaTotalScore");
            OptionalDouble deltaPossible = event.payloadNumber("deltaTotalPossible");

            Drift drift;
            if (deltaScore.isPresent() || deltaPossible.isPresent()) {
                double dS = Math.abs(deltaScore.orElse(0.0));
                double dP = Math.abs(deltaPossible.orElse(0.0));
                if (dS <= epsilon && dP <= epsilon) {
                    continue;
                }
                drift = new Drift(event, deltaScore, deltaPossible,
                    0.6 + Math.min(0.25, dS / 40.0) + Math.min(0.1, dP / 100.0));
            } else if (event.payloadFlag("driftFlagged")) {
                drift = new Drift(event, deltaScore, deltaPossible, 0.6);
            } else {
                continue;
            }

            drifts.computeIfAbsent(event.courseId(), k -> new TreeMap<>())
                .computeIfAbsent(studentId, k -> new ArrayList<>())
                .add(drift);
        }

        List<Insight> insights = new ArrayList<>();
        for (Map.Entry<String, Map<String, List<Drift>>> course : drifts.entrySet()) {
            for (Map.Entry<String, List<Drift>> student : course.getValue().entrySet()) {
                List<Drift> found = student.getValue();
                Drift worst = found.get(0);
                for (Drift drift : found) {
                    if (drift.confidence() > worst.confidence()) {
                        worst = drift;
                    }
                }

                String why = String.format(Locale.ROOT,
                    "Gradebook recompute reported drift %d time(s) (largest deltaTotalScore=%s, "
                        + "deltaTotalPossible=%s). This indicates an earlier inconsistency between grade "
                        + "records and the gradebook totals.",
                    found.size(), format(worst.deltaScore()), format(worst.deltaPossible()));

                insights.add(new Insight(
                    InsightTypes.GRADEBOOK_DRIFT,
                    InsightScope.user(course.getKey(), student.getKey()),
                    why,
                    window.evidence(found.stream().map(Drift::event).toList()),
                    InsightDetector.clamp01(worst.confidence()),
                    INVALIDATION));
            }
        }
        return insights;
    }

    private static String format(OptionalDouble value) {
        return value.isPresent() ? String.format(Locale.ROOT, "%.2f", value.getAsDouble()) : "unknown";
    }

    private record Drift(DomainEvent event, OptionalDouble deltaScore, OptionalDouble deltaPossible,
                         double confidence) {}
}
