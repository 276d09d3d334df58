package com.gradeledger.api.config;

import com.gradeledger.engine.persistence.memory.InMemoryAuditLogRepository;
import com.gradeledger.engine.persistence.memory.InMemoryCatalogRepository;
import com.gradeledger.engine.persistence.memory.InMemoryDomainEventRepository;
import com.gradeledger.engine.persistence.memory.InMemoryGradeRepository;
import com.gradeledger.engine.persistence.memory.InMemoryGradebookRepository;
import com.gradeledger.engine.persistence.memory.InMemoryTransactionalStore;
import com.gradeledger.engine.persistence.memory.VersionedDocumentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Process-local store. The default; state is lost on restart.
 */
@Configuration
@ConditionalOnProperty(name = "gradeledger.store.type", havingValue = "memory", matchIfMissing = true)
public class InMemoryStoreConfiguration {

    private static final Logger log = LoggerFactory.getLogger(InMemoryStoreConfiguration.class);

    @Bean
    public VersionedDocumentStore versionedDocumentStore() {
        log.warn("Using the in-memory ledger store; data will not survive a restart");
        return new VersionedDocumentStore();
    }

    @Bean
    public InMemoryTransactionalStore transactionalStore(VersionedDocumentStore documents) {
        return new InMemoryTransactionalStore(documents);
    }

    @Bean
    public InMemoryDomainEventRepository domainEventRepository(VersionedDocumentStore documents) {
        return new InMemoryDomainEventRepository(documents);
    }

    @Bean
    public InMemoryGradeRepository gradeRepository(VersionedDocumentStore documents) {
        return new InMemoryGradeRepository(documents);
    }

    @Bean
    public InMemoryGradebookRepository gradebookRepository(VersionedDocumentStore documents) {
        return new InMemoryGradebookRepository(documents);
    }

    @Bean
    public InMemoryCatalogRepository catalogRepository(VersionedDocumentStore documents) {
        return new InMemoryCatalogRepository(documents);
    }

    @Bean
    public InMemoryAuditLogRepository auditLogRepository() {
        return new InMemoryAuditLogRepository();
    }
}
