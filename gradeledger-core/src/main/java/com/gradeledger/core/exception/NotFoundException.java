package com.gradeledger.core.exception;

/**
 * Thrown when a grade source, submission or attempt does not exist.
 */
public class NotFoundException extends GradeLedgerException {
    
    public static final String ERROR_CODE = "NOT_FOUND";
    
    public NotFoundException(String entityType, String entityId) {
        super(ERROR_CODE, String.format(
            "%s not found: %s",
            entityType, entityId
        ));
    }
}
