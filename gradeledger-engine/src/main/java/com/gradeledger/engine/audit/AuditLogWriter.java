package com.gradeledger.engine.audit;

import com.gradeledger.core.model.Actor;
import com.gradeledger.core.model.AuditEntry;
import com.gradeledger.core.repository.AuditLogRepository;
import com.gradeledger.engine.metrics.LedgerMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;

/**
 * Writes the compliance trail after a mutation has committed.
 * 
 * <p>A failed audit write cannot undo the committed mutation, and retrying the
 * mutation would create a new grade revision, so failures are logged at error
 * level and counted instead of thrown.</p>
 */
public class AuditLogWriter {

    private static final Logger log = LoggerFactory.getLogger(AuditLogWriter.class);

    private final AuditLogRepository repository;
    private final Clock clock;
    private final LedgerMetrics metrics;

    public AuditLogWriter(AuditLogRepository repository, Clock clock, LedgerMetrics metrics) {
        this.repository = repository;
        this.clock = clock;
        this.metrics = metrics;
    }

    public void record(String action, Actor actor, String targetUid, String requestId, Map<String, Object> metadata) {
        AuditEntry entry = new AuditEntry(
            action,
            actor.uid(),
            actor.role(),
            targetUid,
            requestId,
            metadata,
            clock.instant()
        );
        try {
            repository.append(entry);
        } catch (RuntimeException e) {
            metrics.auditFailed(action);
            log.error("Audit write failed for {} by {} (target {}): {}",
                action, actor.uid(), targetUid, e.getMessage(), e);
        }
    }
}
