package com.cityhex.common.key;

import com.cityhex.common.config.IndexSettings;
import com.cityhex.common.error.InvalidResolutionException;
import com.cityhex.common.grid.HexGrid;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps grid cells onto the table's key space.
 *
 * Sort key layout with min=2, max=8 and separator '#':
 * <pre>
 *   r2#r3#r4#r5#r6#r7#r8#cityId
 * </pre>
 * The first k segments are shared by every record under the same resolution
 * (min + k - 1) ancestor, so "all cities under cell X" is a single prefix scan
 * inside X's base-cell partition. The separator must never occur in a cell id.
 */
public final class IndexKeyCodec {

    private final HexGrid grid;
    private final int minResolution;
    private final int maxResolution;
    private final String separator;

    public IndexKeyCodec(HexGrid grid, IndexSettings settings) {
        this(grid, settings.minResolution(), settings.maxResolution(), settings.separator());
    }

    public IndexKeyCodec(HexGrid grid, int minResolution, int maxResolution, String separator) {
        this.grid = grid;
        this.minResolution = minResolution;
        this.maxResolution = maxResolution;
        this.separator = separator;
    }

    public StorageKey encode(int baseCell, List<String> parentChain, String entityId) {
        return new StorageKey(Integer.toString(baseCell),
                              String.join(separator, parentChain) + separator + entityId);
    }

    /** Encodes a leaf cell; the leaf must sit at the maximum index resolution. */
    public StorageKey encode(String leafCell, String entityId) {
        int resolution = grid.resolution(leafCell);
        if (resolution != maxResolution) {
            throw new InvalidResolutionException(resolution, maxResolution, maxResolution);
        }
        return encode(grid.baseCell(leafCell), parentChain(leafCell, maxResolution), entityId);
    }

    /** Ancestors of {@code cell} at every resolution from min up to {@code toResolution}. */
    public List<String> parentChain(String cell, int toResolution) {
        var chain = new ArrayList<String>(toResolution - minResolution + 1);
        for (int r = minResolution; r <= toResolution; r++) {
            chain.add(grid.cellToParent(cell, r));
        }
        return chain;
    }

    public QueryPrefix queryPrefix(String cell) {
        int resolution = grid.resolution(cell);
        if (resolution < minResolution || resolution > maxResolution) {
            throw new InvalidResolutionException(resolution, minResolution, maxResolution);
        }
        // trailing separator pins the segment boundary
        String prefix = String.join(separator, parentChain(cell, resolution)) + separator;
        return new QueryPrefix(Integer.toString(grid.baseCell(cell)), prefix, resolution);
    }

    public int minResolution() {
        return minResolution;
    }

    public int maxResolution() {
        return maxResolution;
    }

    public String separator() {
        return separator;
    }
}
