package com.cityhex.service.loader;

import com.cityhex.common.config.IndexSettings;
import com.cityhex.common.error.MalformedGeometryException;
import com.cityhex.common.error.StorageUnavailableException;
import com.cityhex.common.geo.GeoJsonGeometryParser;
import com.cityhex.common.grid.HexGrid;
import com.cityhex.common.key.IndexKeyCodec;
import com.cityhex.common.model.IndexRecord;
import com.cityhex.store.BatchWriter;
import com.cityhex.store.StorageGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

/**
 * Tiles every named city at the maximum index resolution and writes one
 * {@link IndexRecord} per (leaf cell, city).
 *
 * Writes are upserts keyed by cell chain and city id, so a partial load is repaired
 * by running the loader again. Individual write failures are counted and skipped;
 * {@code maxConsecutiveWriteFailures} failures in a row mean the store is down and
 * abort the load.
 */
public class BulkLoader {
    private static final Logger log = LoggerFactory.getLogger(BulkLoader.class);

    private final HexGrid grid;
    private final IndexKeyCodec codec;
    private final StorageGateway gateway;
    private final IndexSettings settings;

    public BulkLoader(HexGrid grid, IndexKeyCodec codec, StorageGateway gateway, IndexSettings settings) {
        this.grid = grid;
        this.codec = codec;
        this.gateway = gateway;
        this.settings = settings;
    }

    /** Loads from a file path, falling back to a classpath resource of the same name. */
    public LoadReport loadDataset(String location) {
        Path path = Path.of(location);
        try (InputStream in = Files.exists(path)
                ? Files.newInputStream(path)
                : BulkLoader.class.getClassLoader().getResourceAsStream(location)) {
            if (in == null) {
                throw new FileNotFoundException("Dataset not found on disk or classpath: " + location);
            }
            log.info("Loading database table from {}", location);
            return load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read dataset " + location, e);
        }
    }

    public LoadReport load(InputStream in) throws IOException {
        long start = System.currentTimeMillis();
        var progress = new Progress();
        var reader = new CityFeatureReader(settings.nameProperty());

        try (BatchWriter writer = gateway.batchWriter(settings.writeBatchSize())
                .onSuccess(record -> progress.written())
                .onFailure((record, error) -> progress.failed(record, error))) {
            reader.read(in, feature -> {
                progress.featuresRead++;
                if (index(feature, writer)) {
                    progress.featuresIndexed++;
                } else {
                    progress.featuresSkipped++;
                }
                if (progress.featuresRead % settings.progressInterval() == 0) {
                    log.info("Processed {} cities ({} records written, {} failed)",
                             progress.featuresRead, progress.recordsWritten, progress.recordsFailed);
                }
            });
        }

        var report = new LoadReport(progress.featuresRead, progress.featuresIndexed, progress.featuresSkipped,
                                    progress.recordsWritten, progress.recordsFailed,
                                    System.currentTimeMillis() - start);
        if (report.complete()) {
            log.info("Load complete: {}", report);
        } else {
            log.warn("Load finished with {} failed records; re-run to complete: {}", report.recordsFailed(), report);
        }
        return report;
    }

    private boolean index(CityFeature feature, BatchWriter writer) {
        if (!feature.hasName()) {
            return false;
        }
        Set<String> cells;
        try {
            cells = grid.polygonToCells(GeoJsonGeometryParser.parse(feature.geometry()), codec.maxResolution());
        } catch (MalformedGeometryException e) {
            log.warn("Skipping city {} ({}): {}", feature.id(), feature.name(), e.getMessage());
            return false;
        }
        if (cells.isEmpty()) {
            log.debug("City {} ({}) covers no cell at resolution {}", feature.id(), feature.name(),
                      codec.maxResolution());
            return false;
        }
        for (String cell : cells) {
            var key = codec.encode(cell, feature.id());
            writer.add(new IndexRecord(key.partitionKey(), key.sortKey(), feature.name(), feature.id()));
        }
        return true;
    }

    private final class Progress {
        long featuresRead;
        long featuresIndexed;
        long featuresSkipped;
        long recordsWritten;
        long recordsFailed;
        int consecutiveFailures;

        void written() {
            recordsWritten++;
            consecutiveFailures = 0;
        }

        void failed(IndexRecord record, StorageUnavailableException error) {
            recordsFailed++;
            consecutiveFailures++;
            log.warn("Write failed for city {} key {}: {}", record.cityId(), record.sortKey(), error.getMessage());
            if (consecutiveFailures >= settings.maxConsecutiveWriteFailures()) {
                log.error("Aborting load after {} consecutive write failures", consecutiveFailures);
                throw new StorageUnavailableException(
                    "Store unavailable: " + consecutiveFailures + " consecutive write failures", error);
            }
        }
    }
}
