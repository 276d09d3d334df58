package com.gradeledger.core.model;

/**
 * Actor roles recorded on events and audit entries.
 */
public final class ActorRole {

    public static final String STUDENT = "student";
    public static final String INSTRUCTOR = "instructor";
    public static final String ADMIN = "admin";
    public static final String SYSTEM = "system";

    private ActorRole() {
    }
}
