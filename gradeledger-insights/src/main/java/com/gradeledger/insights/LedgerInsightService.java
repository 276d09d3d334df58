package com.gradeledger.insights;

import com.gradeledger.core.model.DomainEvent;
import com.gradeledger.core.repository.DomainEventRepository;
import com.gradeledger.insights.model.Insight;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Runs the analyzer over recent ledger events.
 * 
 * CRITICAL: READ-ONLY. Only the event repository's query methods are used;
 * nothing is written back to the ledger or the gradebook.
 */
public class LedgerInsightService {

    private static final Logger log = LoggerFactory.getLogger(LedgerInsightService.class);

    public static final String INSIGHTS_GENERATED = "gradeledger.insights.generated";

    private final DomainEventRepository eventRepository;
    private final InsightAnalyzer analyzer;
    private final Duration lookback;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    public LedgerInsightService(DomainEventRepository eventRepository, InsightAnalyzer analyzer,
                                Duration lookback, Clock clock, MeterRegistry meterRegistry) {
        this.eventRepository = eventRepository;
        this.analyzer = analyzer;
        this.lookback = lookback;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Analyze the recent events of one course.
     */
    public List<Insight> analyzeCourse(String courseId) {
        Instant now = clock.instant();
        List<DomainEvent> events = eventRepository.findByCourse(
            courseId, now.minus(lookback), now.plusNanos(1), analyzer.getThresholds().maxEvents());
        return analyze(events, now, courseId);
    }

    /**
     * Analyze the recent events of every course together.
     */
    public List<Insight> analyzeAll() {
        Instant now = clock.instant();
        List<DomainEvent> events = eventRepository.findByTimeRange(
            now.minus(lookback), now.plusNanos(1), analyzer.getThresholds().maxEvents());
        return analyze(events, now, "*");
    }

    private List<Insight> analyze(List<DomainEvent> events, Instant now, String scope) {
        List<Insight> insights = analyzer.analyze(events, now);
        for (Insight insight : insights) {
            Counter.builder(INSIGHTS_GENERATED)
                .tag("type", insight.insightType())
                .description("Insights produced by ledger analysis")
                .register(meterRegistry)
                .increment();
        }
        log.info("Insight analysis of {} over {} events produced {} insights", scope, events.size(), insights.size());
        return insights;
    }
}
