package com.cityhex.store;

import com.cityhex.common.model.IndexRecord;

import java.util.Collection;
import java.util.List;

/**
 * Single keyed table: partition key plus sort key, no secondary indexes.
 * Implementations are thread-safe and shared across concurrent queries; every
 * failure of the underlying store surfaces as
 * {@link com.cityhex.common.error.StorageUnavailableException}.
 */
public interface StorageGateway extends AutoCloseable {

    /** Upsert by (partitionKey, sortKey); rewriting an identical key overwrites. */
    void put(IndexRecord record);

    /** Batched upsert. On failure the batch may have been partially applied. */
    void putAll(Collection<IndexRecord> records);

    /** Every record in {@code partitionKey} whose sort key starts with {@code sortKeyPrefix}, in no promised order. */
    List<IndexRecord> query(String partitionKey, String sortKeyPrefix);

    /** Removes every record; the table-level reload hook. */
    void truncate();

    default BatchWriter batchWriter(int batchSize) {
        return new BatchWriter(this, batchSize);
    }

    @Override
    void close();
}
