package com.gradeledger.engine.persistence.memory;

import com.gradeledger.core.model.AuditEntry;
import com.gradeledger.core.repository.AuditLogRepository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory implementation of AuditLogRepository.
 */
public class InMemoryAuditLogRepository implements AuditLogRepository {

    private final List<AuditEntry> entries = new CopyOnWriteArrayList<>();

    @Override
    public void append(AuditEntry entry) {
        entries.add(entry);
    }

    @Override
    public List<AuditEntry> findRecent(int limit) {
        List<AuditEntry> recent = new ArrayList<>(entries);
        Collections.reverse(recent);
        return recent.size() > limit ? recent.subList(0, limit) : recent;
    }
}
