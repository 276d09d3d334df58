package com.gradeledger.insights.detector;

import com.gradeledger.core.model.DomainEvent;
import com.gradeledger.core.model.EventType;
import com.gradeledger.insights.AnalysisWindow;
import com.gradeledger.insights.AnalyzerThresholds;
import com.gradeledger.insights.InsightDetector;
import com.gradeledger.insights.model.Insight;
import com.gradeledger.insights.model.InsightScope;
import com.gradeledger.insights.model.InsightTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Flags a course whose test attempt starts pile up inside one short interval.
 * 
 * The interval is the densest window of {@code burstWindow} length anchored at
 * some start; both ends are inclusive.
 */
public class AttemptBurstDetector implements InsightDetector {

    private static final String INVALIDATION =
        "If the burst is expected (for example a scheduled exam start) and infrastructure error rates "
            + "remain normal, this risk may be overestimated.";

    @Override
    public String insightType() {
        return InsightTypes.ATTEMPT_BURST;
    }

    @Override
    public List<Insight> detect(AnalysisWindow window) {
        AnalyzerThresholds thresholds = window.thresholds();
        List<Insight> insights = new ArrayList<>();

        Map<String, List<DomainEvent>> startsByCourse =
            AnalysisWindow.byCourse(window.ofType(EventType.TEST_ATTEMPT_STARTED));
        for (Map.Entry<String, List<DomainEvent>> entry : startsByCourse.entrySet()) {
            List<DomainEvent> starts = entry.getValue();
            if (starts.size() < thresholds.burstMinStarts()) {
                continue;
            }

            int bestCount = 0;
            int bestFrom = 0;
            int to = 0;
            for (int from = 0; from < starts.size(); from++) {
                Instant windowEnd = starts.get(from).occurredAt().plus(thresholds.burstWindow());
                to = Math.max(to, from);
                while (to < starts.size() && !starts.get(to).occurredAt().isAfter(windowEnd)) {
                    to++;
                }
                if (to - from > bestCount) {
                    bestCount = to - from;
                    bestFrom = from;
                }
            }

            if (bestCount < thresholds.burstFireCount()) {
                continue;
            }

            List<DomainEvent> burst = starts.subList(bestFrom, bestFrom + bestCount);
            double confidence = InsightDetector.clamp01(
                0.55 + Math.min(0.35, (bestCount - thresholds.burstFireCount()) * 0.02));
            String why = String.format(Locale.ROOT,
                "Detected %d test attempt starts within %d minutes (from %s). "
                    + "This can indicate load spikes and degraded availability risk.",
                bestCount, thresholds.burstWindow().toMinutes(), burst.get(0).occurredAt());

            insights.add(new Insight(
                InsightTypes.ATTEMPT_BURST,
                InsightScope.course(entry.getKey()),
                why,
                window.evidence(burst),
                confidence,
                INVALIDATION));
        }
        return insights;
    }
}
