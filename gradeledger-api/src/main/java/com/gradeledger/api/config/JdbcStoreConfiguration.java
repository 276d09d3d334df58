package com.gradeledger.api.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gradeledger.engine.persistence.jdbc.JdbcAuditLogRepository;
import com.gradeledger.engine.persistence.jdbc.JdbcCatalogRepository;
import com.gradeledger.engine.persistence.jdbc.JdbcDomainEventRepository;
import com.gradeledger.engine.persistence.jdbc.JdbcGradeRepository;
import com.gradeledger.engine.persistence.jdbc.JdbcGradebookRepository;
import com.gradeledger.engine.persistence.jdbc.JdbcTransactionalStore;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.init.DataSourceInitializer;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;

/**
 * PostgreSQL store through Spring JDBC.
 */
@Configuration
@ConditionalOnProperty(name = "gradeledger.store.type", havingValue = "jdbc")
public class JdbcStoreConfiguration {

    static final String SCHEMA_SCRIPT = "db/gradeledger-schema.sql";

    @Bean(destroyMethod = "close")
    public HikariDataSource dataSource(GradeLedgerProperties properties) {
        GradeLedgerProperties.Jdbc jdbc = properties.getStore().getJdbc();
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(jdbc.getUrl());
        config.setUsername(jdbc.getUsername());
        config.setPassword(jdbc.getPassword());
        config.setMaximumPoolSize(jdbc.getMaximumPoolSize());
        config.setPoolName("gradeledger");
        config.setAutoCommit(true);
        return new HikariDataSource(config);
    }

    @Bean
    public DataSourceInitializer schemaInitializer(DataSource dataSource, GradeLedgerProperties properties) {
        DataSourceInitializer initializer = new DataSourceInitializer();
        initializer.setDataSource(dataSource);
        initializer.setDatabasePopulator(new ResourceDatabasePopulator(new ClassPathResource(SCHEMA_SCRIPT)));
        initializer.setEnabled(properties.getStore().getJdbc().isInitializeSchema());
        return initializer;
    }

    @Bean
    public JdbcTemplate jdbcTemplate(DataSource dataSource) {
        return new JdbcTemplate(dataSource);
    }

    @Bean
    public DataSourceTransactionManager transactionManager(DataSource dataSource) {
        return new DataSourceTransactionManager(dataSource);
    }

    @Bean
    public TransactionTemplate transactionTemplate(DataSourceTransactionManager transactionManager) {
        return new TransactionTemplate(transactionManager);
    }

    @Bean
    public JdbcTransactionalStore transactionalStore(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate,
                                                     ObjectMapper objectMapper) {
        return new JdbcTransactionalStore(jdbcTemplate, transactionTemplate, objectMapper);
    }

    @Bean
    public JdbcDomainEventRepository domainEventRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        return new JdbcDomainEventRepository(jdbcTemplate, objectMapper);
    }

    @Bean
    public JdbcGradeRepository gradeRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        return new JdbcGradeRepository(jdbcTemplate, objectMapper);
    }

    @Bean
    public JdbcGradebookRepository gradebookRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        return new JdbcGradebookRepository(jdbcTemplate, objectMapper);
    }

    @Bean
    public JdbcCatalogRepository catalogRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        return new JdbcCatalogRepository(jdbcTemplate, objectMapper);
    }

    @Bean
    public JdbcAuditLogRepository auditLogRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        return new JdbcAuditLogRepository(jdbcTemplate, objectMapper);
    }
}
