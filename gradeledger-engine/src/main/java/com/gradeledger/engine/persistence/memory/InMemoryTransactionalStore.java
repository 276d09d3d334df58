package com.gradeledger.engine.persistence.memory;

import com.gradeledger.core.repository.TransactionWork;
import com.gradeledger.core.repository.TransactionalStore;

/**
 * In-memory implementation of TransactionalStore.
 * For tests, the dev harness and single-node demos.
 */
public class InMemoryTransactionalStore implements TransactionalStore {

    private final VersionedDocumentStore documents;

    public InMemoryTransactionalStore(VersionedDocumentStore documents) {
        this.documents = documents;
    }

    @Override
    public <T> T execute(TransactionWork<T> work) {
        InMemoryLedgerTransaction tx = new InMemoryLedgerTransaction(documents);
        T result = work.run(tx);
        tx.commit();
        return result;
    }

    public VersionedDocumentStore documents() {
        return documents;
    }
}
