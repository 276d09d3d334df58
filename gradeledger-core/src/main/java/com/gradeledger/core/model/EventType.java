package com.gradeledger.core.model;

import java.util.Optional;

/**
 * Event types written by this system.
 *
 * <p>Stored events carry their type as a plain string so that entries written by
 * a newer schema can still be read back; this enum only names the ones we know.</p>
 */
public enum EventType {
    // Catalog
    ASSIGNMENT_PUBLISHED("assignment.published"),
    TEST_PUBLISHED("test.published"),

    // Submissions
    SUBMISSION_SUBMITTED("submission.submitted"),
    SUBMISSION_LATE("submission.late"),

    // Test attempts
    TEST_ATTEMPT_STARTED("test.attempt.started"),
    TEST_ATTEMPT_SUBMITTED("test.attempt.submitted"),

    // Grades
    GRADE_MUTATED("grade.mutated"),
    GRADEBOOK_STUDENT_RECOMPUTED("gradebook.student.recomputed"),
    GRADEBOOK_RECOMPUTED("gradebook.recomputed");

    private final String wireName;

    EventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public boolean matches(String type) {
        return wireName.equals(type);
    }

    public static Optional<EventType> fromWire(String type) {
        for (EventType eventType : values()) {
            if (eventType.wireName.equals(type)) {
                return Optional.of(eventType);
            }
        }
        return Optional.empty();
    }
}
