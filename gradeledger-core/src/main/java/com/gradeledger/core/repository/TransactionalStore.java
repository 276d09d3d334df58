package com.gradeledger.core.repository;

/**
 * Document store offering optimistic multi-document transactions.
 * 
 * <p>A single {@link #execute} call is one attempt: the work runs, then the
 * store validates that every document read is still at the version it was read
 * at. On any mismatch nothing is committed and an
 * {@link com.gradeledger.core.exception.OptimisticLockException} is thrown.
 * Retrying is the caller's job.</p>
 */
public interface TransactionalStore {

    /**
     * Run the work as one atomic attempt.
     * 
     * @param work The transaction body
     * @return Whatever the body returned, once committed
     * @throws com.gradeledger.core.exception.OptimisticLockException on a read/write conflict
     */
    <T> T execute(TransactionWork<T> work);
}
