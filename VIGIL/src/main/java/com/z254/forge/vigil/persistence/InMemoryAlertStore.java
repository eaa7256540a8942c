package com.z254.forge.vigil.persistence;

import com.z254.forge.vigil.domain.model.AlertRecord;

import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * Bounded in-memory alert store for local runs and tests. Oldest records are evicted first.
 */
public class InMemoryAlertStore implements AlertStore {

    private final Deque<AlertRecord> records = new ConcurrentLinkedDeque<>();
    private final int capacity;

    public InMemoryAlertStore(int capacity) {
        this.capacity = capacity;
    }

    @Override
    public void save(AlertRecord record) {
        records.addLast(record);
        while (records.size() > capacity) {
            records.pollFirst();
        }
    }

    @Override
    public void verifyConnection() {
        // always reachable
    }

    public List<AlertRecord> findAll() {
        return new ArrayList<>(records);
    }
}
