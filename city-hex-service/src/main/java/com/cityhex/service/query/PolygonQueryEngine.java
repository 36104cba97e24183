package com.cityhex.service.query;

import com.cityhex.common.config.IndexSettings;
import com.cityhex.common.error.CityIndexException;
import com.cityhex.common.error.InvalidResolutionException;
import com.cityhex.common.error.StorageUnavailableException;
import com.cityhex.common.geo.AreaGeometry;
import com.cityhex.common.grid.HexGrid;
import com.cityhex.common.model.CityMatch;
import com.cityhex.common.model.IndexRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Tiles a polygon, fans one {@link CellQueryEngine#lookup} per cell out to a bounded
 * worker pool and unions the answers.
 *
 * Failure policy: the first failed lookup fails the whole query and cancels the
 * lookups still in flight. A polygon answer missing arbitrary sub-regions would be
 * wrong, not degraded.
 */
public class PolygonQueryEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(PolygonQueryEngine.class);

    private final HexGrid grid;
    private final CellQueryEngine cellEngine;
    private final int minResolution;
    private final int maxResolution;
    private final ExecutorService executor;
    private final Duration timeout;

    public PolygonQueryEngine(HexGrid grid, CellQueryEngine cellEngine, IndexSettings settings) {
        this(grid, cellEngine, settings.minResolution(), settings.maxResolution(),
             Executors.newFixedThreadPool(settings.queryParallelism(), new QueryThreadFactory()),
             Duration.ofMillis(settings.queryTimeoutMillis()));
    }

    PolygonQueryEngine(HexGrid grid, CellQueryEngine cellEngine, int minResolution, int maxResolution,
                       ExecutorService executor, Duration timeout) {
        this.grid = grid;
        this.cellEngine = cellEngine;
        this.minResolution = minResolution;
        this.maxResolution = maxResolution;
        this.executor = executor;
        this.timeout = timeout;
    }

    /** Distinct city names anywhere inside {@code geometry}. */
    public Set<String> queryPolygon(AreaGeometry geometry, int resolution, boolean compact) {
        var names = new LinkedHashSet<String>();
        for (CityMatch match : queryPolygonCities(geometry, resolution, compact)) {
            names.add(match.cityName());
        }
        return names;
    }

    /** Cities inside {@code geometry}, one entry per city id. */
    public List<CityMatch> queryPolygonCities(AreaGeometry geometry, int resolution, boolean compact) {
        long startTime = System.nanoTime();
        List<String> cells = planCells(geometry, resolution, compact);
        if (cells.isEmpty()) {
            log.debug("Polygon tiles to no cells at resolution {}", resolution);
            return List.of();
        }

        Map<String, CityMatch> byId = new LinkedHashMap<>();
        for (IndexRecord record : fanOut(cells)) {
            byId.putIfAbsent(record.cityId(), CityMatch.of(record));
        }

        long elapsedMs = (System.nanoTime() - startTime) / 1_000_000;
        log.info("Found {} cities in {}ms across {} cells (res {}, compact={})",
                 byId.size(), elapsedMs, cells.size(), resolution, compact);
        return new ArrayList<>(byId.values());
    }

    /**
     * Cells to look up for a polygon. Compacted cells coarser than the minimum index
     * resolution are expanded back to it; cells finer than the maximum are replaced by
     * their maximum-resolution ancestor, which is what the cell engine would scan anyway.
     */
    List<String> planCells(AreaGeometry geometry, int resolution, boolean compact) {
        int lowest = Math.max(minResolution, grid.minSupportedResolution());
        if (resolution < lowest || resolution > grid.maxSupportedResolution()) {
            throw new InvalidResolutionException(resolution, lowest, grid.maxSupportedResolution());
        }

        Set<String> tiles = grid.polygonToCells(geometry, resolution);
        if (compact && !tiles.isEmpty()) {
            int before = tiles.size();
            tiles = grid.compact(tiles);
            log.debug("Compacted {} cells to {}", before, tiles.size());
        }

        var plan = new LinkedHashSet<String>();
        for (String cell : tiles) {
            int r = grid.resolution(cell);
            if (r < minResolution) {
                plan.addAll(grid.cellToChildren(cell, minResolution));
            } else if (r > maxResolution) {
                plan.add(grid.cellToParent(cell, maxResolution));
            } else {
                plan.add(cell);
            }
        }
        return new ArrayList<>(plan);
    }

    private List<IndexRecord> fanOut(List<String> cells) {
        var completion = new ExecutorCompletionService<List<IndexRecord>>(executor);
        var futures = new ArrayList<Future<List<IndexRecord>>>(cells.size());
        for (String cell : cells) {
            futures.add(completion.submit(() -> cellEngine.lookup(cell)));
        }

        long deadline = System.nanoTime() + timeout.toNanos();
        var merged = new ArrayList<IndexRecord>();
        try {
            for (int answered = 0; answered < cells.size(); answered++) {
                Future<List<IndexRecord>> done = completion.poll(deadline - System.nanoTime(), TimeUnit.NANOSECONDS);
                if (done == null) {
                    throw new StorageUnavailableException("Polygon query timed out after " + timeout.toMillis()
                        + "ms with " + answered + " of " + cells.size() + " cells answered");
                }
                merged.addAll(done.get());
            }
            return merged;
        } catch (ExecutionException e) {
            throw propagate(e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StorageUnavailableException("Polygon query interrupted", e);
        } finally {
            // no-op for completed lookups; interrupts the rest
            futures.forEach(f -> f.cancel(true));
        }
    }

    private static RuntimeException propagate(Throwable cause) {
        if (cause instanceof CityIndexException indexError) {
            return indexError;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new StorageUnavailableException("Cell lookup failed: " + cause.getMessage(), cause);
    }

    @Override
    public void close() {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Polygon query workers did not stop within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static final class QueryThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            var thread = new Thread(task, "polygon-query-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
