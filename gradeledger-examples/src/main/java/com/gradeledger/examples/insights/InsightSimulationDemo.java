package com.gradeledger.examples.insights;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.gradeledger.core.model.DomainEvent;
import com.gradeledger.insights.AnalyzerThresholds;
import com.gradeledger.insights.InsightAnalyzer;
import com.gradeledger.insights.InsightPresentation;
import com.gradeledger.insights.model.Insight;
import com.gradeledger.insights.model.InsightScope;
import com.gradeledger.insights.model.InsightTypes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Demonstration runner for ledger insights.
 * 
 * Simulates a week of course activity, analyzes it, and logs the insights
 * together with an advisory action list. Nothing is written anywhere; the
 * actions are suggestions for staff.
 * 
 * Usage: {@code InsightSimulationDemo [seed] [now]}
 */
public class InsightSimulationDemo {

    private static final Logger log = LoggerFactory.getLogger(InsightSimulationDemo.class);
    private static final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private static final int TOP_INSIGHTS = 6;

    private final DomainEventSimulator simulator;
    private final InsightAnalyzer analyzer;
    private final InsightPresentation presentation;

    public InsightSimulationDemo(DomainEventSimulator simulator, InsightAnalyzer analyzer,
                                 InsightPresentation presentation) {
        this.simulator = simulator;
        this.analyzer = analyzer;
        this.presentation = presentation;
    }

    public static void main(String[] args) throws Exception {
        String seed = args.length > 0 ? args[0] : DomainEventSimulator.DEFAULT_SEED;
        Instant now = args.length > 1 ? Instant.parse(args[1]) : Instant.now();

        InsightSimulationDemo demo = new InsightSimulationDemo(
            new DomainEventSimulator(seed),
            InsightAnalyzer.withDefaultDetectors(AnalyzerThresholds.defaults()),
            new InsightPresentation());

        log.info("╔══════════════════════════════════════════════════════════════════════╗");
        log.info("║     GRADELEDGER - SIMULATED INSIGHT ANALYSIS                         ║");
        log.info("╠══════════════════════════════════════════════════════════════════════╣");
        log.info("║  Read-only: insights are advisory and never written back             ║");
        log.info("╚══════════════════════════════════════════════════════════════════════╝");
        log.info("");

        Report report = demo.run(now);

        log.info("{}", report.insightsJson());
        log.info("");
        for (String line : report.lines()) {
            log.info(line);
        }
    }

    /**
     * Simulate, analyze and build the report as of {@code now}.
     */
    public Report run(Instant now) {
        List<DomainEvent> events = simulator.simulate(now);
        List<Insight> insights = presentation.normalize(analyzer.analyze(events, now));
        return new Report(events.size(), insights, buildLines(events.size(), insights));
    }

    private List<String> buildLines(int eventCount, List<Insight> insights) {
        List<String> lines = new ArrayList<>();
        lines.add("SIMULATED INSIGHT REPORT");
        lines.add("");
        lines.add("Simulated events analyzed: " + eventCount);
        lines.add("Insights generated: " + insights.size());

        long informational = insights.stream().filter(presentation::isInformationalOnly).count();
        if (informational > 0) {
            lines.add("Informational-only insights: " + informational);
        }

        List<Insight> top = topInsights(insights);
        lines.add("");
        lines.add("Key detections:");
        for (Insight insight : top) {
            lines.add(String.format(Locale.ROOT, "- %s [%s] conf=%.2f%s",
                insight.insightType(),
                describeScope(insight.scope()),
                insight.confidence(),
                presentation.isInformationalOnly(insight) ? " (informational only)" : ""));
        }

        lines.add("");
        lines.add("Recommended next actions (advisory only, no direct messaging):");
        for (Insight insight : top) {
            lines.add("- " + adviceFor(insight.insightType()));
        }
        return lines;
    }

    static List<Insight> topInsights(List<Insight> insights) {
        return insights.stream()
            .sorted(Comparator.comparingDouble(Insight::confidence).reversed())
            .limit(TOP_INSIGHTS)
            .toList();
    }

    static String adviceFor(String insightType) {
        return switch (insightType) {
            case InsightTypes.ATTEMPT_BURST ->
                "Verify scheduled exam timing against the burst; check latency and error budgets, scale ahead where possible.";
            case InsightTypes.LATE_SUBMISSION_PATTERN ->
                "Staff review: consider outreach through existing human workflows; check whether accommodations apply.";
            case InsightTypes.GRADEBOOK_DRIFT ->
                "Staff audit: inspect recent grade mutations for the student, then run a targeted recompute with reconcile.";
            case InsightTypes.ATTEMPT_DROPOFF ->
                "Check whether students start but fail to submit (timeouts, confusion); review attempt expiry and server logs.";
            default -> "Review the evidence events and confirm whether intervention is needed.";
        };
    }

    private static String describeScope(InsightScope scope) {
        if (scope.type() == InsightScope.ScopeType.COURSE) {
            return "course=" + scope.courseId();
        }
        return "user=" + scope.userId() + " course=" + scope.courseId();
    }

    /**
     * Outcome of one demo run.
     */
    public record Report(int eventCount, List<Insight> insights, List<String> lines) {

        public String render() {
            return String.join(System.lineSeparator(), lines);
        }

        public String insightsJson() throws JsonProcessingException {
            return mapper.writeValueAsString(insights);
        }
    }
}
