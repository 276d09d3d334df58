package com.gradeledger.insights;

import com.gradeledger.core.model.DomainEvent;
import com.gradeledger.insights.detector.AttemptBurstDetector;
import com.gradeledger.insights.detector.AttemptDropoffDetector;
import com.gradeledger.insights.detector.GradebookDriftDetector;
import com.gradeledger.insights.detector.LatePatternDetector;
import com.gradeledger.insights.model.Insight;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Read-only analysis of a snapshot of domain events.
 * 
 * CRITICAL: this class has no access to any store. It never mutates events,
 * grades or gradebooks; the insights it returns are advisory.
 * 
 * <p>Analysis is a pure function of (events, now): the snapshot is cleaned of
 * malformed events, ordered by (occurredAt, eventId), bounded to the most
 * recent {@code maxEvents}, and handed to each detector in turn. A detector
 * that fails is logged and skipped; the others still run.</p>
 */
public class InsightAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(InsightAnalyzer.class);

    static final Comparator<DomainEvent> LEDGER_ORDER =
        Comparator.comparing(DomainEvent::occurredAt).thenComparing(DomainEvent::eventId);

    private final List<InsightDetector> detectors;
    private final AnalyzerThresholds thresholds;

    public InsightAnalyzer(List<InsightDetector> detectors, AnalyzerThresholds thresholds) {
        this.detectors = List.copyOf(detectors);
        this.thresholds = thresholds;
    }

    /**
     * Analyzer running the four standard detectors.
     */
    public static InsightAnalyzer withDefaultDetectors(AnalyzerThresholds thresholds) {
        return new InsightAnalyzer(List.of(
            new AttemptBurstDetector(),
            new LatePatternDetector(),
            new GradebookDriftDetector(),
            new AttemptDropoffDetector()
        ), thresholds);
    }

    /**
     * Analyze events as of the given time.
     * 
     * @param events Snapshot to analyze, in any order
     * @param now Reference time for age-based rules
     * @return Insights in detector order, each citing at least one event
     */
    public List<Insight> analyze(Collection<DomainEvent> events, Instant now) {
        AnalysisWindow window = new AnalysisWindow(prepare(events), now, thresholds);

        List<Insight> insights = new ArrayList<>();
        for (InsightDetector detector : detectors) {
            try {
                for (Insight insight : detector.detect(window)) {
                    if (insight.hasEvidence()) {
                        insights.add(insight);
                    } else {
                        log.debug("Dropped {} insight without evidence", insight.insightType());
                    }
                }
            } catch (RuntimeException e) {
                log.warn("Detector {} failed, skipping: {}", detector.insightType(), e.getMessage(), e);
            }
        }

        log.debug("Analyzed {} events, {} insights", window.events().size(), insights.size());
        return insights;
    }

    public AnalyzerThresholds getThresholds() {
        return thresholds;
    }

    private List<DomainEvent> prepare(Collection<DomainEvent> events) {
        List<DomainEvent> usable = new ArrayList<>();
        if (events == null) {
            return usable;
        }
        for (DomainEvent event : events) {
            if (isWellFormed(event)) {
                usable.add(event);
            } else {
                log.debug("Skipping malformed event {}", event != null ? event.eventId() : null);
            }
        }
        usable.sort(LEDGER_ORDER);
        int size = usable.size();
        return size > thresholds.maxEvents() ? usable.subList(size - thresholds.maxEvents(), size) : usable;
    }

    private static boolean isWellFormed(DomainEvent event) {
        return event != null
            && notBlank(event.eventId())
            && notBlank(event.type())
            && notBlank(event.courseId())
            && event.occurredAt() != null;
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
