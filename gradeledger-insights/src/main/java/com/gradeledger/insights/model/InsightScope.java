package com.gradeledger.insights.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What an insight is about: a whole course, or one user within a course.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record InsightScope(ScopeType type, String courseId, String userId) {

    public static InsightScope course(String courseId) {
        return new InsightScope(ScopeType.COURSE, courseId, null);
    }

    public static InsightScope user(String courseId, String userId) {
        return new InsightScope(ScopeType.USER, courseId, userId);
    }

    public enum ScopeType {
        COURSE,
        USER;

        @JsonValue
        public String wireName() {
            return name().toLowerCase();
        }
    }
}
