package com.gradeledger.core.model;

import java.time.Instant;
import java.util.Map;

/**
 * Human-facing compliance trail entry, written alongside (not instead of) domain events.
 */
public record AuditEntry(
    String action,
    String actorUid,
    String actorRole,
    String targetUid,
    String requestId,
    Map<String, Object> metadata,
    Instant createdAt
) {
    public static final String GRADE_SET = "grade.set";
    public static final String GRADEBOOK_RECOMPUTE = "gradebook.recompute";
    public static final String TEST_ATTEMPT_START = "test.attempt.start";
    public static final String TEST_ATTEMPT_SUBMIT = "test.attempt.submit";
    public static final String SUBMISSION_SUBMIT = "submission.submit";
    public static final String SOURCE_PUBLISH = "source.publish";
}
