package com.cityhex.store;

import com.cityhex.common.model.IndexRecord;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Heap-backed table with the same key ordering as the RocksDB store.
 * Used by tests and the {@code --in-memory} demo mode.
 */
public class InMemoryStorageGateway implements StorageGateway {

    private final ConcurrentNavigableMap<String, IndexRecord> table = new ConcurrentSkipListMap<>();

    @Override
    public void put(IndexRecord record) {
        table.put(CompositeKey.of(record.partitionKey(), record.sortKey()), record);
    }

    @Override
    public void putAll(Collection<IndexRecord> records) {
        records.forEach(this::put);
    }

    @Override
    public List<IndexRecord> query(String partitionKey, String sortKeyPrefix) {
        String prefix = CompositeKey.of(partitionKey, sortKeyPrefix);
        var results = new ArrayList<IndexRecord>();
        for (var entry : table.tailMap(prefix, true).entrySet()) {
            if (!entry.getKey().startsWith(prefix)) break;
            results.add(entry.getValue());
        }
        return results;
    }

    @Override
    public void truncate() {
        table.clear();
    }

    public int size() {
        return table.size();
    }

    @Override
    public void close() {}
}
