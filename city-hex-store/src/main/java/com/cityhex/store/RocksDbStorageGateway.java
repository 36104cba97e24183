package com.cityhex.store;

import com.cityhex.common.error.StorageUnavailableException;
import com.cityhex.common.model.IndexRecord;
import org.rocksdb.BlockBasedTableConfig;
import org.rocksdb.CompactionStyle;
import org.rocksdb.CompressionType;
import org.rocksdb.LRUCache;
import org.rocksdb.Options;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.rocksdb.WriteBatch;
import org.rocksdb.WriteOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * {@link StorageGateway} over an embedded RocksDB instance.
 *
 * Key:   partitionKey ':' sortKey   (UTF-8, byte-wise ordered)
 * Value: the record as JSON
 *
 * A prefix query seeks to {@code partitionKey:prefix} and walks forward while keys
 * still start with it, so it touches only the matching key range.
 *
 * Reads and writes hold the read lock; {@link #close()} takes the write lock, so the
 * native handle is never released under a running scan.
 */
public class RocksDbStorageGateway implements StorageGateway {
    private static final Logger log = LoggerFactory.getLogger(RocksDbStorageGateway.class);

    private final String dbPath;
    private final Options options;
    private final LRUCache blockCache;
    private final WriteOptions writeOptions;
    private final RocksDB rocksDB;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private boolean closed;

    public RocksDbStorageGateway(String dbPath) {
        RocksDB.loadLibrary();
        this.dbPath = dbPath;
        this.blockCache = new LRUCache(64 * 1024 * 1024); // 64MB
        this.options = buildOptions(blockCache);
        this.writeOptions = new WriteOptions();
        try {
            this.rocksDB = RocksDB.open(options, dbPath);
        } catch (RocksDBException e) {
            writeOptions.close();
            options.close();
            blockCache.close();
            throw new StorageUnavailableException("Failed to open RocksDB at " + dbPath, e);
        }
        log.info("RocksDbStorageGateway opened at {}", dbPath);
    }

    private static Options buildOptions(LRUCache blockCache) {
        var tableConfig = new BlockBasedTableConfig()
            .setBlockCache(blockCache)
            .setBlockSize(16 * 1024); // 16KB blocks
        return new Options()
            .setCreateIfMissing(true)
            .setCompressionType(CompressionType.LZ4_COMPRESSION)
            // Load is one write-heavy burst, reads are short range scans
            .setCompactionStyle(CompactionStyle.LEVEL)
            .setLevel0FileNumCompactionTrigger(4)
            .setWriteBufferSize(64 * 1024 * 1024) // 64MB memtables
            .setMaxWriteBufferNumber(4)
            .setMaxBackgroundJobs(4)
            .setTableFormatConfig(tableConfig);
    }

    @Override
    public void put(IndexRecord record) {
        lock.readLock().lock();
        try {
            ensureOpen();
            rocksDB.put(writeOptions, keyOf(record), RecordSerde.serialize(record));
        } catch (RocksDBException e) {
            throw new StorageUnavailableException("RocksDB put failed for " + record.sortKey(), e);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void putAll(Collection<IndexRecord> records) {
        lock.readLock().lock();
        try (var batch = new WriteBatch()) {
            ensureOpen();
            for (IndexRecord record : records) {
                batch.put(keyOf(record), RecordSerde.serialize(record));
            }
            rocksDB.write(writeOptions, batch);
        } catch (RocksDBException e) {
            throw new StorageUnavailableException("RocksDB batch write of " + records.size() + " records failed", e);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<IndexRecord> query(String partitionKey, String sortKeyPrefix) {
        byte[] prefix = CompositeKey.of(partitionKey, sortKeyPrefix).getBytes(StandardCharsets.UTF_8);
        var results = new ArrayList<IndexRecord>();

        lock.readLock().lock();
        try {
            ensureOpen();
            scan(prefix, results);
        } catch (RocksDBException e) {
            throw new StorageUnavailableException("RocksDB scan failed for partition " + partitionKey, e);
        } catch (UncheckedIOException e) {
            throw new StorageUnavailableException("Unreadable record in partition " + partitionKey, e);
        } finally {
            lock.readLock().unlock();
        }

        log.debug("Scanned partition={} prefix={} -> {} records", partitionKey, sortKeyPrefix, results.size());
        return results;
    }

    private void scan(byte[] prefix, List<IndexRecord> results) throws RocksDBException {
        try (RocksIterator iter = rocksDB.newIterator()) {
            iter.seek(prefix);
            while (iter.isValid() && startsWith(iter.key(), prefix)) {
                results.add(RecordSerde.deserialize(iter.value()));
                iter.next();
            }
            iter.status();
        }
    }

    @Override
    public void truncate() {
        int deleted;
        lock.readLock().lock();
        try {
            ensureOpen();
            deleted = deleteAll();
        } catch (RocksDBException e) {
            throw new StorageUnavailableException("RocksDB truncate failed at " + dbPath, e);
        } finally {
            lock.readLock().unlock();
        }
        log.info("Truncated {} records from {}", deleted, dbPath);
    }

    private int deleteAll() throws RocksDBException {
        int deleted = 0;
        try (RocksIterator iter = rocksDB.newIterator(); var batch = new WriteBatch()) {
            for (iter.seekToFirst(); iter.isValid(); iter.next()) {
                batch.delete(iter.key());
                deleted++;
            }
            iter.status();
            rocksDB.write(writeOptions, batch);
        }
        return deleted;
    }

    private void ensureOpen() {
        if (closed) {
            throw new StorageUnavailableException("Store at " + dbPath + " is closed");
        }
    }

    private static byte[] keyOf(IndexRecord record) {
        return CompositeKey.of(record.partitionKey(), record.sortKey()).getBytes(StandardCharsets.UTF_8);
    }

    private static boolean startsWith(byte[] array, byte[] prefix) {
        if (array.length < prefix.length) return false;
        for (int i = 0; i < prefix.length; i++) {
            if (array[i] != prefix[i]) return false;
        }
        return true;
    }

    @Override
    public void close() {
        // waits for in-flight reads and writes to leave the native handle
        lock.writeLock().lock();
        try {
            if (closed) return;
            closed = true;
            rocksDB.close();
            writeOptions.close();
            options.close();
            blockCache.close();
        } finally {
            lock.writeLock().unlock();
        }
        log.info("RocksDbStorageGateway at {} closed", dbPath);
    }
}
