package com.gradeledger.core.repository;

/**
 * Body of an optimistic transaction. May run several times when it conflicts,
 * so it must derive everything it writes from what it reads through {@code tx}.
 */
@FunctionalInterface
public interface TransactionWork<T> {

    T run(LedgerTransaction tx);
}
