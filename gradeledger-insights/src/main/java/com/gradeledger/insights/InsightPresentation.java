package com.gradeledger.insights;

import com.gradeledger.insights.model.Insight;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Display policy for insights. Kept apart from analysis so the analyzer's
 * output stays raw and comparable.
 */
public class InsightPresentation {

    public static final double DEFAULT_INFORMATIONAL_BELOW = 0.4;
    public static final String INFORMATIONAL_PREFIX = "INFORMATIONAL ONLY: ";

    private final double informationalBelow;

    public InsightPresentation() {
        this(DEFAULT_INFORMATIONAL_BELOW);
    }

    public InsightPresentation(double informationalBelow) {
        this.informationalBelow = informationalBelow;
    }

    /**
     * Round confidence to two decimals and label low-confidence insights.
     */
    public List<Insight> normalize(List<Insight> insights) {
        return insights.stream().map(this::normalize).toList();
    }

    public Insight normalize(Insight insight) {
        double confidence = BigDecimal.valueOf(insight.confidence()).setScale(2, RoundingMode.HALF_UP).doubleValue();
        String why = insight.whyGenerated();
        if (confidence < informationalBelow && !why.startsWith(INFORMATIONAL_PREFIX)) {
            why = INFORMATIONAL_PREFIX + why;
        }
        return insight.withPresentation(why, confidence);
    }

    public boolean isInformationalOnly(Insight insight) {
        return insight.confidence() < informationalBelow;
    }
}
