package com.cityhex.store;

import com.cityhex.common.error.StorageUnavailableException;
import com.cityhex.common.model.IndexRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Buffers records and writes them through {@link StorageGateway#putAll} once
 * {@code batchSize} are pending, and again on {@link #close()}.
 *
 * When a batch fails the writer falls back to one {@link StorageGateway#put} per
 * record so a single bad write costs one record, not the batch. Records that still
 * fail go to the failure listener; the exception only escapes when the listener
 * rethrows it.
 */
public class BatchWriter implements AutoCloseable {

    public interface FailureListener {
        void onFailure(IndexRecord record, StorageUnavailableException error);
    }

    private final StorageGateway gateway;
    private final int batchSize;
    private final List<IndexRecord> buffer;
    private FailureListener failureListener = (record, error) -> { throw error; };
    private Consumer<IndexRecord> successListener = record -> {};

    BatchWriter(StorageGateway gateway, int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive, got " + batchSize);
        }
        this.gateway = gateway;
        this.batchSize = batchSize;
        this.buffer = new ArrayList<>(batchSize);
    }

    public BatchWriter onFailure(FailureListener listener) {
        this.failureListener = listener;
        return this;
    }

    public BatchWriter onSuccess(Consumer<IndexRecord> listener) {
        this.successListener = listener;
        return this;
    }

    public void add(IndexRecord record) {
        buffer.add(record);
        if (buffer.size() >= batchSize) {
            flush();
        }
    }

    public void flush() {
        if (buffer.isEmpty()) return;
        var batch = List.copyOf(buffer);
        buffer.clear();
        try {
            gateway.putAll(batch);
            batch.forEach(successListener);
        } catch (StorageUnavailableException batchError) {
            for (IndexRecord record : batch) {
                try {
                    gateway.put(record);
                    successListener.accept(record);
                } catch (StorageUnavailableException recordError) {
                    failureListener.onFailure(record, recordError);
                }
            }
        }
    }

    public int pending() {
        return buffer.size();
    }

    @Override
    public void close() {
        flush();
    }
}
