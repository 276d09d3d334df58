package com.gradeledger.insights;

import com.gradeledger.insights.model.Insight;

import java.util.List;

/**
 * One independent heuristic over the event window.
 * Implementations hold no mutable state and perform no I/O.
 */
public interface InsightDetector {

    /**
     * The insight type this detector produces.
     */
    String insightType();

    /**
     * Inspect the window and return zero or more insights.
     * 
     * @param window Ordered, well-formed events and the analysis time
     * @return Insights, each citing at least one event
     */
    List<Insight> detect(AnalysisWindow window);

    static double clamp01(double value) {
        if (!Double.isFinite(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
