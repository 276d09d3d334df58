package com.gradeledger.core.exception;

/**
 * Base exception for all ledger errors.
 */
public class GradeLedgerException extends RuntimeException {
    
    private final String errorCode;
    
    public GradeLedgerException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    
    public GradeLedgerException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
    
    public String getErrorCode() {
        return errorCode;
    }

    /**
     * Whether the caller may safely retry the whole operation.
     */
    public boolean isRetryable() {
        return false;
    }
}
