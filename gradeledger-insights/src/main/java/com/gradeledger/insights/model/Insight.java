package com.gradeledger.insights.model;

import java.util.List;

/**
 * Advisory finding derived from the event ledger.
 * 
 * CRITICAL: insights are never written back. They explain a pattern and cite
 * the events behind it; acting on them is a human decision.
 */
public record Insight(
    String insightType,
    InsightScope scope,
    String whyGenerated,
    List<String> evidenceRefs,
    double confidence,
    String invalidationConditions
) {

    public Insight {
        evidenceRefs = evidenceRefs == null ? List.of() : List.copyOf(evidenceRefs);
    }

    public boolean hasEvidence() {
        return !evidenceRefs.isEmpty();
    }

    public Insight withPresentation(String newWhyGenerated, double newConfidence) {
        return new Insight(insightType, scope, newWhyGenerated, evidenceRefs, newConfidence, invalidationConditions);
    }
}
