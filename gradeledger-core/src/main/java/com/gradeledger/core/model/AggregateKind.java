package com.gradeledger.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of persistent object a domain event describes.
 */
public enum AggregateKind {
    COURSE("course"),
    STREAM_POST("streamPost"),
    ASSIGNMENT("assignment"),
    SUBMISSION("submission"),
    TEST("test"),
    ATTEMPT("attempt"),
    GRADE("grade"),
    GRADEBOOK("gradebook");

    private final String wireName;

    AggregateKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static AggregateKind fromWire(String value) {
        for (AggregateKind kind : values()) {
            if (kind.wireName.equals(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown aggregate kind: " + value);
    }
}
