package com.gradeledger.core.exception;

/**
 * Thrown when a transaction kept conflicting until its retry budget ran out.
 * Nothing was committed; the caller may retry the whole mutation.
 */
public class TransactionContentionException extends GradeLedgerException {
    
    public static final String ERROR_CODE = "TRANSACTION_CONTENTION";

    private final int attempts;
    
    public TransactionContentionException(String operation, int attempts, Throwable cause) {
        super(ERROR_CODE, String.format(
            "Transaction '%s' aborted after %d attempts due to concurrent modification",
            operation, attempts
        ), cause);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
