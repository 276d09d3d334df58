package com.gradeledger.api.rest;

import com.gradeledger.core.exception.ValidationException;
import com.gradeledger.core.model.Actor;

/**
 * Builds the already-authorized actor from the identity headers set by the
 * gateway in front of this service.
 */
final class RequestActors {

    static final String UID_HEADER = "X-Actor-Uid";
    static final String ROLE_HEADER = "X-Actor-Role";

    private RequestActors() {
    }

    static Actor of(String uid, String role) {
        Actor actor = new Actor(uid, role);
        if (actor.isBlank()) {
            throw new ValidationException("actor", UID_HEADER + " and " + ROLE_HEADER + " are required");
        }
        return actor;
    }
}
