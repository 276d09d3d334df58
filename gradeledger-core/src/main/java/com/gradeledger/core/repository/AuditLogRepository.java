package com.gradeledger.core.repository;

import com.gradeledger.core.model.AuditEntry;
import java.util.List;

/**
 * Append-only audit trail. Writes happen outside the business transaction.
 */
public interface AuditLogRepository {

    void append(AuditEntry entry);

    /**
     * Most recent entries first.
     */
    List<AuditEntry> findRecent(int limit);
}
