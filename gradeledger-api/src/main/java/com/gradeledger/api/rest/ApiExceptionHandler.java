package com.gradeledger.api.rest;

import com.gradeledger.core.exception.ConflictException;
import com.gradeledger.core.exception.GradeLedgerException;
import com.gradeledger.core.exception.NotFoundException;
import com.gradeledger.core.exception.OptimisticLockException;
import com.gradeledger.core.exception.TransactionContentionException;
import com.gradeledger.core.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

/**
 * Maps ledger exceptions to problem responses.
 * Every body carries the ledger error code and whether retrying may help.
 */
@RestControllerAdvice
public class ApiExceptionHandler extends ResponseEntityExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ProblemDetail> handleValidation(ValidationException ex) {
        return problem(HttpStatus.BAD_REQUEST, "Validation Failed", ex);
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ProblemDetail> handleNotFound(NotFoundException ex) {
        return problem(HttpStatus.NOT_FOUND, "Not Found", ex);
    }

    @ExceptionHandler(ConflictException.class)
    public ResponseEntity<ProblemDetail> handleConflict(ConflictException ex) {
        return problem(HttpStatus.CONFLICT, "Conflict", ex);
    }

    @ExceptionHandler({TransactionContentionException.class, OptimisticLockException.class})
    public ResponseEntity<ProblemDetail> handleContention(GradeLedgerException ex) {
        log.warn("Request gave up under contention [{}]: {}", ex.getErrorCode(), ex.getMessage());
        return problem(HttpStatus.SERVICE_UNAVAILABLE, "Contention", ex);
    }

    @ExceptionHandler(GradeLedgerException.class)
    public ResponseEntity<ProblemDetail> handleLedger(GradeLedgerException ex) {
        log.error("Unhandled ledger error [{}]: {}", ex.getErrorCode(), ex.getMessage(), ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Ledger Error", ex);
    }

    private static ResponseEntity<ProblemDetail> problem(HttpStatus status, String title, GradeLedgerException ex) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, ex.getMessage());
        problem.setTitle(title);
        problem.setProperty("errorCode", ex.getErrorCode());
        problem.setProperty("retryable", ex.isRetryable());
        return ResponseEntity.status(status).body(problem);
    }
}
