package com.gradeledger.insights;

import java.time.Duration;

/**
 * Tunable limits of the insight detectors.
 * 
 * @param maxEvents Most recent events considered per analysis
 * @param maxEvidence Most event ids cited by one insight
 * @param burstWindow Width of the sliding window for attempt bursts
 * @param burstMinStarts Starts a course needs before bursts are looked for
 * @param burstFireCount Starts inside one window that make a burst
 * @param lateWindow How far back late submissions count
 * @param lateMinCount Late submissions that make a pattern
 * @param lateRecencyWindow Age under which the latest late submission adds confidence
 * @param dropoffDefaultDuration Allotted time for attempts that carry no duration
 * @param dropoffCourseMin Dropped attempts in a course that make a course insight
 * @param dropoffUserMin Dropped attempts of one student that make a user insight
 * @param driftEpsilon Deltas at or below this are treated as zero
 */
public record AnalyzerThresholds(
    int maxEvents,
    int maxEvidence,
    Duration burstWindow,
    int burstMinStarts,
    int burstFireCount,
    Duration lateWindow,
    int lateMinCount,
    Duration lateRecencyWindow,
    Duration dropoffDefaultDuration,
    int dropoffCourseMin,
    int dropoffUserMin,
    double driftEpsilon
) {

    public AnalyzerThresholds {
        if (maxEvents < 1) {
            throw new IllegalArgumentException("maxEvents must be >= 1");
        }
        if (maxEvidence < 1) {
            throw new IllegalArgumentException("maxEvidence must be >= 1");
        }
        if (burstFireCount < burstMinStarts) {
            throw new IllegalArgumentException("burstFireCount must be >= burstMinStarts");
        }
        if (lateMinCount < 1 || dropoffCourseMin < 1 || dropoffUserMin < 1) {
            throw new IllegalArgumentException("minimum counts must be >= 1");
        }
        if (driftEpsilon < 0) {
            throw new IllegalArgumentException("driftEpsilon must be >= 0");
        }
    }

    public static AnalyzerThresholds defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int maxEvents = 250;
        private int maxEvidence = 25;
        private Duration burstWindow = Duration.ofMinutes(60);
        private int burstMinStarts = 8;
        private int burstFireCount = 15;
        private Duration lateWindow = Duration.ofDays(30);
        private int lateMinCount = 2;
        private Duration lateRecencyWindow = Duration.ofDays(7);
        private Duration dropoffDefaultDuration = Duration.ofHours(12);
        private int dropoffCourseMin = 4;
        private int dropoffUserMin = 2;
        private double driftEpsilon = 1e-9;

        public Builder maxEvents(int maxEvents) {
            this.maxEvents = maxEvents;
            return this;
        }

        public Builder maxEvidence(int maxEvidence) {
            this.maxEvidence = maxEvidence;
            return this;
        }

        public Builder burstWindow(Duration burstWindow) {
            this.burstWindow = burstWindow;
            return this;
        }

        public Builder burstMinStarts(int burstMinStarts) {
            this.burstMinStarts = burstMinStarts;
            return this;
        }

        public Builder burstFireCount(int burstFireCount) {
            this.burstFireCount = burstFireCount;
            return this;
        }

        public Builder lateWindow(Duration lateWindow) {
            this.lateWindow = lateWindow;
            return this;
        }

        public Builder lateMinCount(int lateMinCount) {
            this.lateMinCount = lateMinCount;
            return this;
        }

        public Builder lateRecencyWindow(Duration lateRecencyWindow) {
            this.lateRecencyWindow = lateRecencyWindow;
            return this;
        }

        public Builder dropoffDefaultDuration(Duration dropoffDefaultDuration) {
            this.dropoffDefaultDuration = dropoffDefaultDuration;
            return this;
        }

        public Builder dropoffCourseMin(int dropoffCourseMin) {
            this.dropoffCourseMin = dropoffCourseMin;
            return this;
        }

        public Builder dropoffUserMin(int dropoffUserMin) {
            this.dropoffUserMin = dropoffUserMin;
            return this;
        }

        public Builder driftEpsilon(double driftEpsilon) {
            this.driftEpsilon = driftEpsilon;
            return this;
        }

        public AnalyzerThresholds build() {
            return new AnalyzerThresholds(maxEvents, maxEvidence, burstWindow, burstMinStarts, burstFireCount,
                lateWindow, lateMinCount, lateRecencyWindow, dropoffDefaultDuration, dropoffCourseMin,
                dropoffUserMin, driftEpsilon);
        }
    }
}
