package com.gradeledger.engine.coordinator;

import com.gradeledger.core.exception.ValidationException;

import java.util.regex.Pattern;

/**
 * Plain-text normalization for free text stored on grades and recomputes.
 */
final class InputSanitizer {

    static final int MAX_FEEDBACK_LENGTH = 20_000;
    static final int MAX_REASON_LENGTH = 500;

    private static final Pattern SCRIPT_BLOCK = Pattern.compile("(?is)<script.*?>.*?</script>");
    private static final Pattern STYLE_BLOCK = Pattern.compile("(?is)<style.*?>.*?</style>");
    private static final Pattern TAG = Pattern.compile("<[^>]+>");
    // keeps \t \n \r
    private static final Pattern CONTROL = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");

    private InputSanitizer() {
    }

    /**
     * Strip markup and control characters from grader feedback.
     * 
     * @return The plain text, or null when nothing is left
     * @throws ValidationException if the cleaned text is too long
     */
    static String sanitizeFeedback(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        String s = input.trim();
        s = SCRIPT_BLOCK.matcher(s).replaceAll("");
        s = STYLE_BLOCK.matcher(s).replaceAll("");
        s = TAG.matcher(s).replaceAll("");
        s = CONTROL.matcher(s).replaceAll("");
        s = s.trim();
        if (s.isEmpty()) {
            return null;
        }
        if (s.length() > MAX_FEEDBACK_LENGTH) {
            throw new ValidationException("feedback", "at most " + MAX_FEEDBACK_LENGTH + " characters");
        }
        return s;
    }

    /**
     * Trimmed reason, or null when blank or longer than the limit.
     */
    static String sanitizeReason(String reason) {
        if (reason == null) {
            return null;
        }
        String trimmed = reason.trim();
        if (trimmed.isEmpty() || trimmed.length() > MAX_REASON_LENGTH) {
            return null;
        }
        return trimmed;
    }

    static String requireId(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field, "cannot be empty");
        }
        return value.trim();
    }

    static double requirePoints(String field, Double value) {
        if (value == null || !Double.isFinite(value)) {
            throw new ValidationException(field, "must be a finite number");
        }
        if (value < 0) {
            throw new ValidationException(field, "must be >= 0");
        }
        return value;
    }
}
