package com.gradeledger.core.exception;

/**
 * Thrown when a request is malformed. Always raised before any write happens.
 */
public class ValidationException extends GradeLedgerException {
    
    public static final String ERROR_CODE = "VALIDATION_FAILED";
    
    public ValidationException(String message) {
        super(ERROR_CODE, message);
    }
    
    public ValidationException(String field, String reason) {
        super(ERROR_CODE, String.format("Invalid %s: %s", field, reason));
    }
}
