package com.z254.forge.vigil.persistence;

import com.z254.forge.vigil.domain.model.AuditRecord;

import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * Bounded in-memory audit store for local runs and tests. Oldest records are evicted first.
 */
public class InMemoryAuditStore implements AuditStore {

    private final Deque<AuditRecord> records = new ConcurrentLinkedDeque<>();
    private final int capacity;

    public InMemoryAuditStore(int capacity) {
        this.capacity = capacity;
    }

    @Override
    public void save(AuditRecord record) {
        records.addLast(record);
        while (records.size() > capacity) {
            records.pollFirst();
        }
    }

    @Override
    public void verifyConnection() {
        // always reachable
    }

    public List<AuditRecord> findAll() {
        return new ArrayList<>(records);
    }
}
