package com.cityhex.store;

import com.cityhex.common.error.StorageUnavailableException;
import com.cityhex.common.model.IndexRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class RocksDbStorageGatewayTest {

    @TempDir
    Path tempDir;

    private RocksDbStorageGateway gateway;

    @BeforeEach
    void open() {
        gateway = new RocksDbStorageGateway(tempDir.resolve("index").toString());
    }

    @AfterEach
    void close() {
        gateway.close();
    }

    @Test
    void prefixQueryStaysInsidePartitionAndPrefix() {
        gateway.putAll(List.of(
            record("17", "A2#A3#A4#A5#A6#A7#A8#0", "Alpha", "0"),
            record("17", "A2#A3#A4#A5#A6#B7#B8#2", "Beta", "2"),
            record("17", "A2#A3#A4#A5#C6#C7#C8#3", "Gamma", "3"),
            record("18", "A2#A3#A4#A5#A6#A7#A8#4", "OtherPartition", "4")
        ));

        assertEquals(Set.of("Alpha", "Beta"), names(gateway.query("17", "A2#A3#A4#A5#A6#")));
        assertEquals(Set.of("Alpha"), names(gateway.query("17", "A2#A3#A4#A5#A6#A7#")));
        assertEquals(Set.of("Alpha", "Beta", "Gamma"), names(gateway.query("17", "A2#")));
        assertTrue(gateway.query("17", "Z2#").isEmpty());
        assertTrue(gateway.query("99", "A2#").isEmpty());
    }

    @Test
    void partitionKeyIsNotAPrefixOfItsNeighbour() {
        gateway.put(record("1", "A2#0", "One", "0"));
        gateway.put(record("17", "A2#1", "Seventeen", "1"));

        assertEquals(Set.of("One"), names(gateway.query("1", "A2#")));
    }

    @Test
    void rewritingTheSameKeyDoesNotDuplicate() {
        var alpha = record("17", "A2#A3#0", "Alpha", "0");
        gateway.put(alpha);
        gateway.putAll(List.of(alpha, alpha));

        assertEquals(1, gateway.query("17", "A2#").size());
    }

    @Test
    void recordsSurviveReopen() {
        gateway.put(record("3", "x2#x3#9", "Persisted", "9"));
        gateway.close();

        gateway = new RocksDbStorageGateway(tempDir.resolve("index").toString());
        var found = gateway.query("3", "x2#");
        assertEquals(List.of(record("3", "x2#x3#9", "Persisted", "9")), found);
    }

    @Test
    void truncateRemovesEverything() {
        gateway.putAll(List.of(record("1", "a#0", "A", "0"), record("2", "b#1", "B", "1")));
        gateway.truncate();

        assertTrue(gateway.query("1", "").isEmpty());
        assertTrue(gateway.query("2", "").isEmpty());
    }

    @Test
    void closedStoreReportsUnavailable() {
        gateway.close();
        assertThrows(StorageUnavailableException.class, () -> gateway.query("1", "a#"));
        assertThrows(StorageUnavailableException.class, () -> gateway.put(record("1", "a#0", "A", "0")));
        assertThrows(StorageUnavailableException.class, () -> gateway.putAll(List.of(record("1", "a#0", "A", "0"))));
        assertThrows(StorageUnavailableException.class, () -> gateway.truncate());
    }

    @Test
    void closeWaitsForRunningScansAndLaterScansFailCleanly() throws Exception {
        var records = new ArrayList<IndexRecord>();
        for (int i = 0; i < 2_000; i++) {
            records.add(record("17", "A2#A3#" + i, "City" + i, Integer.toString(i)));
        }
        gateway.putAll(records);

        ExecutorService readers = Executors.newFixedThreadPool(4);
        var started = new CountDownLatch(4);
        try {
            var results = new ArrayList<Future<Integer>>();
            for (int t = 0; t < 4; t++) {
                results.add(readers.submit(() -> {
                    started.countDown();
                    int scans = 0;
                    while (true) {
                        try {
                            assertEquals(2_000, gateway.query("17", "A2#").size());
                            scans++;
                        } catch (StorageUnavailableException closed) {
                            return scans;
                        }
                    }
                }));
            }
            assertTrue(started.await(5, TimeUnit.SECONDS));
            gateway.close();

            for (Future<Integer> result : results) {
                // a failed assertion inside a reader surfaces here as ExecutionException
                assertTrue(result.get(30, TimeUnit.SECONDS) >= 0);
            }
        } finally {
            readers.shutdownNow();
        }
    }

    static IndexRecord record(String partition, String sortKey, String name, String id) {
        return new IndexRecord(partition, sortKey, name, id);
    }

    static Set<String> names(List<IndexRecord> records) {
        return records.stream().map(IndexRecord::cityName).collect(Collectors.toSet());
    }
}
