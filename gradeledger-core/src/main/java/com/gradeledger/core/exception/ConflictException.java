package com.gradeledger.core.exception;

/**
 * Thrown when an operation is not allowed in the current state of an aggregate,
 * e.g. no remaining test attempts or an attempt that was already submitted.
 */
public class ConflictException extends GradeLedgerException {
    
    public static final String ERROR_CODE = "CONFLICT";
    
    public ConflictException(String message) {
        super(ERROR_CODE, message);
    }
}
