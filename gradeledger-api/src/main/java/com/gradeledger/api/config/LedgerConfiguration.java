package com.gradeledger.api.config;

import com.gradeledger.core.repository.AuditLogRepository;
import com.gradeledger.core.repository.CatalogRepository;
import com.gradeledger.core.repository.DomainEventRepository;
import com.gradeledger.core.repository.GradeRepository;
import com.gradeledger.core.repository.GradebookRepository;
import com.gradeledger.core.repository.TransactionalStore;
import com.gradeledger.engine.audit.AuditLogWriter;
import com.gradeledger.engine.coordinator.CatalogCoordinator;
import com.gradeledger.engine.coordinator.GradebookCoordinator;
import com.gradeledger.engine.coordinator.SubmissionCoordinator;
import com.gradeledger.engine.coordinator.TestAttemptCoordinator;
import com.gradeledger.engine.ledger.DomainEventWriter;
import com.gradeledger.engine.metrics.LedgerMetrics;
import com.gradeledger.engine.reconcile.GradebookReconciler;
import com.gradeledger.engine.service.GradebookService;
import com.gradeledger.engine.tx.TransactionRunner;
import com.gradeledger.insights.InsightAnalyzer;
import com.gradeledger.insights.InsightPresentation;
import com.gradeledger.insights.LedgerInsightService;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the ledger engine and the insight analyzer on top of whichever
 * store configuration is active.
 */
@Configuration
public class LedgerConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TransactionRunner transactionRunner(TransactionalStore store, GradeLedgerProperties properties,
                                               LedgerMetrics metrics) {
        return new TransactionRunner(store, properties.getRetry().toPolicy(), metrics);
    }

    @Bean
    public DomainEventWriter domainEventWriter(Clock clock, LedgerMetrics metrics) {
        return new DomainEventWriter(clock, metrics);
    }

    @Bean
    public AuditLogWriter auditLogWriter(AuditLogRepository repository, Clock clock, LedgerMetrics metrics) {
        return new AuditLogWriter(repository, clock, metrics);
    }

    @Bean
    public CatalogCoordinator catalogCoordinator(TransactionRunner runner, DomainEventWriter eventWriter,
                                                 CatalogRepository catalogRepository, AuditLogWriter auditLog,
                                                 Clock clock) {
        return new CatalogCoordinator(runner, eventWriter, catalogRepository, auditLog, clock);
    }

    @Bean
    public SubmissionCoordinator submissionCoordinator(TransactionRunner runner, DomainEventWriter eventWriter,
                                                       AuditLogWriter auditLog, Clock clock) {
        return new SubmissionCoordinator(runner, eventWriter, auditLog, clock);
    }

    @Bean
    public GradebookCoordinator gradebookCoordinator(TransactionRunner runner, DomainEventWriter eventWriter,
                                                     GradeRepository gradeRepository,
                                                     GradebookRepository gradebookRepository,
                                                     AuditLogWriter auditLog, LedgerMetrics metrics, Clock clock) {
        return new GradebookCoordinator(
            runner, eventWriter, gradeRepository, gradebookRepository, auditLog, metrics, clock);
    }

    @Bean
    public TestAttemptCoordinator testAttemptCoordinator(TransactionRunner runner, DomainEventWriter eventWriter,
                                                         AuditLogWriter auditLog, LedgerMetrics metrics,
                                                         Clock clock) {
        return new TestAttemptCoordinator(runner, eventWriter, auditLog, metrics, clock);
    }

    @Bean
    public GradebookReconciler gradebookReconciler(GradebookRepository gradebookRepository,
                                                   GradebookService gradebookService) {
        return new GradebookReconciler(gradebookRepository, gradebookService);
    }

    @Bean
    public InsightAnalyzer insightAnalyzer(GradeLedgerProperties properties) {
        return InsightAnalyzer.withDefaultDetectors(properties.getInsights().toThresholds());
    }

    @Bean
    public InsightPresentation insightPresentation(GradeLedgerProperties properties) {
        return new InsightPresentation(properties.getInsights().getInformationalBelow());
    }

    @Bean
    public LedgerInsightService ledgerInsightService(DomainEventRepository eventRepository, InsightAnalyzer analyzer,
                                                     GradeLedgerProperties properties, Clock clock,
                                                     MeterRegistry meterRegistry) {
        return new LedgerInsightService(
            eventRepository, analyzer, properties.getInsights().getLookback(), clock, meterRegistry);
    }
}
