package com.gradeledger.insights.model;

/**
 * Insight type names as they appear on the wire.
 */
public final class InsightTypes {

    public static final String ATTEMPT_BURST = "overload_risk.test_attempt_burst";
    public static final String LATE_SUBMISSION_PATTERN = "risk.student_late_submission_pattern";
    public static final String GRADEBOOK_DRIFT = "integrity.gradebook_drift_flagged";
    public static final String ATTEMPT_DROPOFF = "risk.test_attempt_dropoff";

    private InsightTypes() {
    }
}
