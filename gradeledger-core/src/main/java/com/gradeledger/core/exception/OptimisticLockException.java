package com.gradeledger.core.exception;

/**
 * Thrown when a transaction observes that a document it read was changed
 * by a concurrent writer before commit.
 */
public class OptimisticLockException extends GradeLedgerException {
    
    public static final String ERROR_CODE = "OPTIMISTIC_LOCK_CONFLICT";
    
    public OptimisticLockException(String documentKey, long expectedVersion, long actualVersion) {
        super(ERROR_CODE, String.format(
            "Optimistic lock conflict on %s: expected version %d, actual version %d",
            documentKey, expectedVersion, actualVersion
        ));
    }

    public OptimisticLockException(String message) {
        super(ERROR_CODE, message);
    }

    public OptimisticLockException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
