package com.gradeledger.engine.logging;

import org.slf4j.MDC;
import java.util.UUID;

/**
 * MDC helper for structured logging.
 * Puts the identifiers of the grade or student being worked on into every log line.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forGrade(courseId, studentId, gradeId, requestId)) {
 *     log.info("Applying grade"); // carries courseId, studentId, gradeId, requestId
 * }
 * </pre>
 *
 * Log output with MDC:
 * 2024-03-04 10:30:45.123 [http-nio-8080-exec-1] INFO  c.g.e.c.GradebookCoordinator - Grade applied
 *   courseId=course_cs101 studentId=u_student_a gradeId=assignment_a1_u_student_a traceId=1f3a9c0e
 */
public final class LoggingContext implements AutoCloseable {

    public static final String COURSE_ID = "courseId";
    public static final String STUDENT_ID = "studentId";
    public static final String GRADE_ID = "gradeId";
    public static final String REQUEST_ID = "requestId";
    public static final String TRACE_ID = "traceId";

    private LoggingContext() {
    }

    public static LoggingContext forCourse(String courseId, String requestId) {
        return forGrade(courseId, null, null, requestId);
    }

    public static LoggingContext forStudent(String courseId, String studentId, String requestId) {
        return forGrade(courseId, studentId, null, requestId);
    }

    public static LoggingContext forGrade(String courseId, String studentId, String gradeId, String requestId) {
        LoggingContext ctx = new LoggingContext();
        putIfPresent(COURSE_ID, courseId);
        putIfPresent(STUDENT_ID, studentId);
        putIfPresent(GRADE_ID, gradeId);
        putIfPresent(REQUEST_ID, requestId);
        ensureTraceId();
        return ctx;
    }

    /**
     * Set the request id for the rest of the current thread's work.
     * Cleared by {@link #clearAll()}, not by {@link #close()}.
     */
    public static void setRequestId(String requestId) {
        putIfPresent(REQUEST_ID, requestId);
    }

    public static String getRequestId() {
        return MDC.get(REQUEST_ID);
    }

    public static String getTraceId() {
        return MDC.get(TRACE_ID);
    }

    private static void putIfPresent(String key, String value) {
        if (value != null && !value.isBlank()) {
            MDC.put(key, value);
        }
    }

    private static void ensureTraceId() {
        if (MDC.get(TRACE_ID) == null) {
            MDC.put(TRACE_ID, UUID.randomUUID().toString().substring(0, 8));
        }
    }

    @Override
    public void close() {
        MDC.remove(COURSE_ID);
        MDC.remove(STUDENT_ID);
        MDC.remove(GRADE_ID);
        // requestId and traceId are request scoped
    }

    /**
     * Clear all MDC context. Call at the end of a request.
     */
    public static void clearAll() {
        MDC.clear();
    }
}
