package com.aegis.engine.ledger;

import com.aegis.core.domain.LedgerRecord;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Volatile store whose records can be overwritten in place, standing in for
 * an attacker with write access to ledger storage.
 */
class TamperingLedgerStore implements LedgerStore {

    private final Map<String, List<LedgerRecord>> records = new LinkedHashMap<>();
    private final Map<String, String> publicKeys = new ConcurrentHashMap<>();

    @Override
    public synchronized void append(LedgerRecord record) {
        records.computeIfAbsent(record.projectId(), k -> new ArrayList<>()).add(record);
    }

    @Override
    public synchronized List<LedgerRecord> records(String projectId) {
        return List.copyOf(records.getOrDefault(projectId, List.of()));
    }

    @Override
    public synchronized LedgerRecord last(String projectId) {
        List<LedgerRecord> list = records.get(projectId);
        return list == null || list.isEmpty() ? null : list.get(list.size() - 1);
    }

    @Override
    public synchronized List<String> projectIds() {
        return List.copyOf(records.keySet());
    }

    @Override
    public void storePublicKey(String keyId, String pem) {
        publicKeys.putIfAbsent(keyId, pem);
    }

    @Override
    public Map<String, String> publicKeys() {
        return Map.copyOf(publicKeys);
    }

    synchronized void replace(String projectId, int index, LedgerRecord record) {
        records.get(projectId).set(index, record);
    }

    synchronized void remove(String projectId, int index) {
        records.get(projectId).remove(index);
    }
}
