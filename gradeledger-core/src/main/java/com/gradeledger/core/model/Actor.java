package com.gradeledger.core.model;

/**
 * The already-authorized caller of an operation.
 * Role checks happen upstream; the ledger only records who acted.
 */
public record Actor(String uid, String role) {

    public static final Actor RECONCILER = new Actor("gradebook-reconciler", ActorRole.SYSTEM);
    public static final Actor AUTO_GRADER = new Actor("system", ActorRole.SYSTEM);

    public static Actor student(String uid) {
        return new Actor(uid, ActorRole.STUDENT);
    }

    public static Actor instructor(String uid) {
        return new Actor(uid, ActorRole.INSTRUCTOR);
    }

    public boolean isBlank() {
        return uid == null || uid.isBlank() || role == null || role.isBlank();
    }
}
