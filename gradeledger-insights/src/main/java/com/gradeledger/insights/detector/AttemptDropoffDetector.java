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
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.TreeMap;

/**
 * Flags test attempts that were started and never submitted within their
 * allotted time, per course and per student.
 * 
 * An attempt only counts once its allotted time has fully elapsed, so
 * attempts still in progress are never reported. The allotted time ends at
 * the attempt's recorded expiry, which for practice attempts is days rather
 * than minutes.
 */
public class AttemptDropoffDetector implements InsightDetector {

    private static final String COURSE_INVALIDATION =
        "If later events show delayed submissions for these attempts, or the test is practice-only with "
            + "no submission requirement, this signal may be a false positive.";

    private static final String USER_INVALIDATION =
        "If the student submits a later attempt of the same tests, or abandoned practice attempts on purpose, "
            + "this signal may be a false positive.";

    @Override
    public String insightType() {
        return InsightTypes.ATTEMPT_DROPOFF;
    }

    @Override
    public List<Insight> detect(AnalysisWindow window) {
        AnalyzerThresholds thresholds = window.thresholds();

        Map<String, DomainEvent> starts = new LinkedHashMap<>();
        for (DomainEvent event : window.ofType(EventType.TEST_ATTEMPT_STARTED)) {
            event.payloadText("attemptId").ifPresent(id -> starts.putIfAbsent(key(event, id), event));
        }
        Map<String, Instant> submissions = new HashMap<>();
        for (DomainEvent event : window.ofType(EventType.TEST_ATTEMPT_SUBMITTED)) {
            event.payloadText("attemptId").ifPresent(id -> submissions.putIfAbsent(key(event, id), event.occurredAt()));
        }

        // course -> elapsed attempts / dropped attempts, and per student within the course
        Map<String, Tally> courses = new TreeMap<>();
        Map<String, Map<String, Tally>> students = new TreeMap<>();
        for (Map.Entry<String, DomainEvent> entry : starts.entrySet()) {
            DomainEvent start = entry.getValue();
            Instant deadline = start.occurredAt().plus(allotted(start, thresholds));
            if (!window.now().isAfter(deadline)) {
                continue;
            }

            Instant submittedAt = submissions.get(entry.getKey());
            boolean dropped = submittedAt == null || submittedAt.isAfter(deadline);

            courses.computeIfAbsent(start.courseId(), k -> new Tally()).add(start, dropped);
            start.payloadText("studentId").ifPresent(studentId -> students
                .computeIfAbsent(start.courseId(), k -> new TreeMap<>())
                .computeIfAbsent(studentId, k -> new Tally())
                .add(start, dropped));
        }

        List<Insight> insights = new ArrayList<>();
        for (Map.Entry<String, Tally> course : courses.entrySet()) {
            Tally tally = course.getValue();
            if (tally.dropped.size() >= thresholds.dropoffCourseMin()) {
                double confidence = InsightDetector.clamp01(
                    0.3 + 0.5 * tally.rate()
                        + Math.min(0.15, (tally.dropped.size() - thresholds.dropoffCourseMin()) * 0.03));
                insights.add(new Insight(
                    InsightTypes.ATTEMPT_DROPOFF,
                    InsightScope.course(course.getKey()),
                    describe(tally, "in this course"),
                    window.evidence(tally.dropped),
                    confidence,
                    COURSE_INVALIDATION));
            }

            for (Map.Entry<String, Tally> student : students.getOrDefault(course.getKey(), Map.of()).entrySet()) {
                Tally studentTally = student.getValue();
                if (studentTally.dropped.size() < thresholds.dropoffUserMin()) {
                    continue;
                }
                double confidence = InsightDetector.clamp01(
                    0.35 + 0.4 * studentTally.rate()
                        + Math.min(0.15, (studentTally.dropped.size() - thresholds.dropoffUserMin()) * 0.05));
                insights.add(new Insight(
                    InsightTypes.ATTEMPT_DROPOFF,
                    InsightScope.user(course.getKey(), student.getKey()),
                    describe(studentTally, "by this student"),
                    window.evidence(studentTally.dropped),
                    confidence,
                    USER_INVALIDATION));
            }
        }
        return insights;
    }

    /**
     * Recorded expiry first, then the test duration, then the configured default.
     */
    private static Duration allotted(DomainEvent start, AnalyzerThresholds thresholds) {
        Optional<Instant> expiresAt = start.payloadText("expiresAt").flatMap(AttemptDropoffDetector::parseInstant);
        if (expiresAt.isPresent() && expiresAt.get().isAfter(start.occurredAt())) {
            return Duration.between(start.occurredAt(), expiresAt.get());
        }
        OptionalDouble minutes = start.payloadNumber("durationMinutes");
        if (minutes.isPresent() && minutes.getAsDouble() > 0) {
            return Duration.ofMinutes((long) Math.ceil(minutes.getAsDouble()));
        }
        return thresholds.dropoffDefaultDuration();
    }

    private static Optional<Instant> parseInstant(String text) {
        try {
            return Optional.of(Instant.parse(text));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static String describe(Tally tally, String where) {
        return String.format(Locale.ROOT,
            "Detected %d of %d finished test attempts %s that were started but not submitted within their "
                + "allotted time (rate=%.2f). Could indicate UX friction, window confusion, or platform "
                + "reliability issues.",
            tally.dropped.size(), tally.elapsed, where, tally.rate());
    }

    private static String key(DomainEvent event, String attemptId) {
        return event.courseId() + "::" + event.payloadText("testId").orElse("") + "::" + attemptId;
    }

    private static final class Tally {
        private final List<DomainEvent> dropped = new ArrayList<>();
        private int elapsed;

        void add(DomainEvent start, boolean isDropped) {
            elapsed++;
            if (isDropped) {
                dropped.add(start);
            }
        }

        double rate() {
            return elapsed == 0 ? 0.0 : (double) dropped.size() / elapsed;
        }
    }
}
