package com.gradeledger.engine.persistence.jdbc;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gradeledger.core.exception.OptimisticLockException;
import com.gradeledger.core.repository.TransactionWork;
import com.gradeledger.core.repository.TransactionalStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * PostgreSQL-backed implementation of TransactionalStore.
 * 
 * Each attempt runs in one database transaction. Version checks happen on
 * every write and once more for plain reads before commit; database-level
 * serialization and unique-key failures are reported as lock conflicts so the
 * caller's retry loop treats them like any other lost race.
 */
public class JdbcTransactionalStore implements TransactionalStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcTransactionalStore.class);

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final LedgerRowMappers mappers;

    public JdbcTransactionalStore(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate,
                                  ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
        this.mappers = new LedgerRowMappers(objectMapper);
    }

    @Override
    public <T> T execute(TransactionWork<T> work) {
        try {
            return transactionTemplate.execute(status -> {
                JdbcLedgerTransaction tx = new JdbcLedgerTransaction(jdbcTemplate, mappers);
                T result = work.run(tx);
                tx.validateReads();
                return result;
            });
        } catch (DuplicateKeyException e) {
            log.debug("Unique key collision treated as conflict: {}", e.getMessage());
            throw new OptimisticLockException("Concurrent insert of the same document", e);
        } catch (ConcurrencyFailureException e) {
            log.debug("Database concurrency failure treated as conflict: {}", e.getMessage());
            throw new OptimisticLockException("Concurrent update detected by the database", e);
        }
    }
}
