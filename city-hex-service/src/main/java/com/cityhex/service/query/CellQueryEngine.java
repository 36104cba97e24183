package com.cityhex.service.query;

import com.cityhex.common.error.InvalidCellException;
import com.cityhex.common.grid.HexGrid;
import com.cityhex.common.key.IndexKeyCodec;
import com.cityhex.common.model.IndexRecord;
import com.cityhex.store.StorageGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Answers "which cities are indexed under this cell" with one prefix scan.
 *
 * A cell finer than the stored resolution is clamped to its ancestor at the maximum
 * resolution; a cell coarser than the minimum resolution is rejected.
 * Stateless and safe to call from many threads.
 */
public class CellQueryEngine {
    private static final Logger log = LoggerFactory.getLogger(CellQueryEngine.class);

    private final HexGrid grid;
    private final IndexKeyCodec codec;
    private final StorageGateway gateway;

    public CellQueryEngine(HexGrid grid, IndexKeyCodec codec, StorageGateway gateway) {
        this.grid = grid;
        this.codec = codec;
        this.gateway = gateway;
    }

    /** Distinct city names under {@code cell}. */
    public Set<String> queryCell(String cell) {
        var names = new LinkedHashSet<String>();
        for (IndexRecord record : lookup(cell)) {
            names.add(record.cityName());
        }
        return names;
    }

    /** Raw records under {@code cell}; one record per (leaf cell, city) pair. */
    public List<IndexRecord> lookup(String cell) {
        var prefix = codec.queryPrefix(clamp(cell));
        var records = gateway.query(prefix.partitionKey(), prefix.sortKeyPrefix());
        log.debug("Cell {} (res {}) -> {} records", cell, prefix.resolution(), records.size());
        return records;
    }

    String clamp(String cell) {
        if (!grid.isValidCell(cell)) {
            throw new InvalidCellException(cell);
        }
        int resolution = grid.resolution(cell);
        return resolution > codec.maxResolution() ? grid.cellToParent(cell, codec.maxResolution()) : cell;
    }
}
