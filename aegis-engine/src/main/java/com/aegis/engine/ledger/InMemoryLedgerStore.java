package com.aegis.engine.ledger;

import com.aegis.core.domain.LedgerRecord;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Volatile store. Readers get copy-on-write snapshots, so a record is either
 * fully visible or not at all.
 */
public class InMemoryLedgerStore implements LedgerStore {

    private final Map<String, CopyOnWriteArrayList<LedgerRecord>> records = new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<String> projectOrder = new CopyOnWriteArrayList<>();
    private final Map<String, String> publicKeys = new ConcurrentHashMap<>();

    @Override
    public void append(LedgerRecord record) {
        Objects.requireNonNull(record, "Record cannot be null");
        records.computeIfAbsent(record.projectId(), k -> new CopyOnWriteArrayList<>()).add(record);
        projectOrder.addIfAbsent(record.projectId());
    }

    @Override
    public List<LedgerRecord> records(String projectId) {
        CopyOnWriteArrayList<LedgerRecord> list = records.get(projectId);
        return list != null ? List.copyOf(list) : List.of();
    }

    @Override
    public LedgerRecord last(String projectId) {
        CopyOnWriteArrayList<LedgerRecord> list = records.get(projectId);
        if (list == null) {
            return null;
        }
        List<LedgerRecord> snapshot = List.copyOf(list);
        return snapshot.isEmpty() ? null : snapshot.get(snapshot.size() - 1);
    }

    @Override
    public List<String> projectIds() {
        return List.copyOf(projectOrder);
    }

    @Override
    public void storePublicKey(String keyId, String pem) {
        publicKeys.putIfAbsent(keyId, pem);
    }

    @Override
    public Map<String, String> publicKeys() {
        return Map.copyOf(publicKeys);
    }
}
