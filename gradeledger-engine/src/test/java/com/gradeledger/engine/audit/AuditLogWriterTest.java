package com.gradeledger.engine.audit;

import com.gradeledger.core.model.Actor;
import com.gradeledger.core.model.AuditEntry;
import com.gradeledger.core.repository.AuditLogRepository;
import com.gradeledger.core.time.TimeController;
import com.gradeledger.engine.metrics.LedgerMetrics;
import com.gradeledger.engine.persistence.memory.InMemoryAuditLogRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

public class AuditLogWriterTest {

    private final TimeController clock = TimeController.frozenAt(Instant.parse("2026-01-12T09:00:00Z"));
    private final LedgerMetrics metrics = LedgerMetrics.detached();

    @Test
    @DisplayName("Entries carry actor, target and the clock's time")
    void recordsEntry() {
        InMemoryAuditLogRepository repository = new InMemoryAuditLogRepository();
        AuditLogWriter writer = new AuditLogWriter(repository, clock, metrics);

        writer.record(AuditEntry.GRADE_SET, Actor.instructor("u_instructor"), "u_ana", "req-9", Map.of("score", 4.0));

        AuditEntry entry = repository.findRecent(1).get(0);
        assertThat(entry.actorUid()).isEqualTo("u_instructor");
        assertThat(entry.actorRole()).isEqualTo("instructor");
        assertThat(entry.targetUid()).isEqualTo("u_ana");
        assertThat(entry.requestId()).isEqualTo("req-9");
        assertThat(entry.createdAt()).isEqualTo(clock.instant());
    }

    @Test
    @DisplayName("A failing audit store is counted and does not fail the caller")
    void failureIsCountedNotThrown() {
        AuditLogRepository broken = new AuditLogRepository() {
            @Override
            public void append(AuditEntry entry) {
                throw new IllegalStateException("audit store down");
            }

            @Override
            public List<AuditEntry> findRecent(int limit) {
                return List.of();
            }
        };
        AuditLogWriter writer = new AuditLogWriter(broken, clock, metrics);

        assertThatCode(() -> writer.record(AuditEntry.GRADE_SET, Actor.instructor("u_instructor"), "u_ana", null, Map.of()))
            .doesNotThrowAnyException();
        assertThat(metrics.count(LedgerMetrics.AUDIT_FAILURES, "action", AuditEntry.GRADE_SET)).isEqualTo(1.0);
    }
}
