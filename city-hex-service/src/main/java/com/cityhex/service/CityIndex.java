package com.cityhex.service;

import com.cityhex.common.config.IndexSettings;
import com.cityhex.common.grid.H3HexGrid;
import com.cityhex.common.grid.HexGrid;
import com.cityhex.common.key.IndexKeyCodec;
import com.cityhex.service.loader.BulkLoader;
import com.cityhex.service.query.CellQueryEngine;
import com.cityhex.service.query.PolygonQueryEngine;
import com.cityhex.store.InMemoryStorageGateway;
import com.cityhex.store.RocksDbStorageGateway;
import com.cityhex.store.StorageGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires grid, codec, store, loader and both query engines from one {@link IndexSettings}.
 * Owns the store and the polygon worker pool; closing the index releases both.
 */
public class CityIndex implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CityIndex.class);

    private final IndexSettings settings;
    private final HexGrid grid;
    private final StorageGateway gateway;
    private final IndexKeyCodec codec;
    private final BulkLoader loader;
    private final CellQueryEngine cellEngine;
    private final PolygonQueryEngine polygonEngine;

    public CityIndex(IndexSettings settings, HexGrid grid, StorageGateway gateway) {
        this.settings = settings;
        this.grid = grid;
        this.gateway = gateway;
        this.codec = new IndexKeyCodec(grid, settings);
        this.loader = new BulkLoader(grid, codec, gateway, settings);
        this.cellEngine = new CellQueryEngine(grid, codec, gateway);
        this.polygonEngine = new PolygonQueryEngine(grid, cellEngine, settings);
        log.info("City index ready: resolutions {}..{}, separator '{}', query parallelism {}",
                 settings.minResolution(), settings.maxResolution(), settings.separator(),
                 settings.queryParallelism());
    }

    /** H3 grid over the RocksDB store at {@code store.path}. */
    public static CityIndex open(IndexSettings settings) {
        return new CityIndex(settings, H3HexGrid.create(), new RocksDbStorageGateway(settings.storePath()));
    }

    /** H3 grid over a heap table; nothing survives the process. */
    public static CityIndex inMemory(IndexSettings settings) {
        return new CityIndex(settings, H3HexGrid.create(), new InMemoryStorageGateway());
    }

    public IndexSettings settings() {
        return settings;
    }

    public HexGrid grid() {
        return grid;
    }

    public StorageGateway gateway() {
        return gateway;
    }

    public IndexKeyCodec codec() {
        return codec;
    }

    public BulkLoader loader() {
        return loader;
    }

    public CellQueryEngine cellEngine() {
        return cellEngine;
    }

    public PolygonQueryEngine polygonEngine() {
        return polygonEngine;
    }

    @Override
    public void close() {
        try {
            polygonEngine.close();
        } finally {
            gateway.close();
        }
    }
}
