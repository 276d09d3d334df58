package com.gradeledger.engine.persistence;

import com.gradeledger.core.model.SourceType;

/**
 * Document paths shared by both stores. The in-memory store keys its map by
 * them and the JDBC store uses them to track row versions per transaction.
 */
public final class DocumentKeys {

    private DocumentKeys() {
    }

    public static String event(String eventId) {
        return "events/" + eventId;
    }

    public static String source(String courseId, SourceType sourceType, String sourceId) {
        return sourcesOf(courseId) + sourceType.wireName() + "/" + sourceId;
    }

    public static String sourcesOf(String courseId) {
        return "courses/" + courseId + "/sources/";
    }

    public static String submission(String courseId, String assignmentId, String studentId) {
        return "courses/" + courseId + "/submissions/" + assignmentId + "/" + studentId;
    }

    public static String attempt(String courseId, String testId, String attemptId) {
        return attemptsOf(courseId, testId) + attemptId;
    }

    public static String attemptsOf(String courseId, String testId) {
        return "courses/" + courseId + "/tests/" + testId + "/attempts/";
    }

    public static String grade(String courseId, String gradeId) {
        return gradesOf(courseId) + gradeId;
    }

    public static String gradesOf(String courseId) {
        return "courses/" + courseId + "/grades/";
    }

    public static String gradebook(String courseId, String studentId) {
        return gradebooksOf(courseId) + studentId;
    }

    public static String gradebooksOf(String courseId) {
        return "courses/" + courseId + "/gradebook/";
    }
}
