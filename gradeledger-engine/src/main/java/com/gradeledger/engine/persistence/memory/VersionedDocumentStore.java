package com.gradeledger.engine.persistence.memory;

import com.gradeledger.core.exception.OptimisticLockException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Sorted map of immutable documents, each carrying a version that increases
 * on every write. Absent documents have version 0.
 * 
 * <p>Reads are lock free. Commits validate read versions and apply writes
 * under the store monitor, so two commits never interleave.</p>
 */
public class VersionedDocumentStore {

    private final ConcurrentSkipListMap<String, Versioned> documents = new ConcurrentSkipListMap<>();

    public Versioned get(String key) {
        Versioned doc = documents.get(key);
        return doc != null ? doc : Versioned.ABSENT;
    }

    /**
     * Documents whose key starts with the prefix, in key order.
     */
    public List<Map.Entry<String, Versioned>> scan(String prefix) {
        NavigableMap<String, Versioned> range = documents.subMap(prefix, true, prefix + Character.MAX_VALUE, false);
        return new ArrayList<>(range.entrySet());
    }

    /**
     * Every stored value of the given type, in key order.
     */
    public <T> List<T> valuesUnder(String prefix, Class<T> type) {
        List<T> values = new ArrayList<>();
        for (Map.Entry<String, Versioned> entry : scan(prefix)) {
            if (type.isInstance(entry.getValue().value())) {
                values.add(type.cast(entry.getValue().value()));
            }
        }
        return values;
    }

    /**
     * Atomically check that every read document is still at the version that
     * was read, then apply the writes.
     * 
     * @param readVersions Version seen per key (0 for absent)
     * @param writes New value per key
     * @throws OptimisticLockException if any read document changed since it was read
     */
    public synchronized void commit(Map<String, Long> readVersions, Map<String, Object> writes) {
        for (Map.Entry<String, Long> read : readVersions.entrySet()) {
            long current = get(read.getKey()).version();
            if (current != read.getValue()) {
                throw new OptimisticLockException(read.getKey(), read.getValue(), current);
            }
        }
        for (Map.Entry<String, Object> write : writes.entrySet()) {
            long next = get(write.getKey()).version() + 1;
            documents.put(write.getKey(), new Versioned(write.getValue(), next));
        }
    }

    public int size() {
        return documents.size();
    }

    public record Versioned(Object value, long version) {
        static final Versioned ABSENT = new Versioned(null, 0L);

        public boolean exists() {
            return value != null;
        }
    }
}
