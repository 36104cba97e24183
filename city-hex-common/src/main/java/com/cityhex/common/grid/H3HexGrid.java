package com.cityhex.common.grid;

import com.cityhex.common.error.InvalidCellException;
import com.cityhex.common.error.InvalidResolutionException;
import com.cityhex.common.error.MalformedGeometryException;
import com.cityhex.common.geo.AreaGeometry;
import com.cityhex.common.geo.GeoPoint;
import com.cityhex.common.geo.GeoPolygon;
import com.uber.h3core.H3Core;
import com.uber.h3core.exceptions.H3Exception;
import com.uber.h3core.util.LatLng;

import java.io.IOException;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * {@link HexGrid} backed by Uber's H3 through its JNI binding.
 * H3Core is thread-safe, so one instance per JVM is enough.
 */
public final class H3HexGrid implements HexGrid {

    private static final int H3_MAX_RESOLUTION = 15;

    private final H3Core h3;

    public H3HexGrid(H3Core h3) {
        this.h3 = h3;
    }

    public static H3HexGrid create() {
        try {
            return new H3HexGrid(H3Core.newInstance());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to initialize H3Core", e);
        }
    }

    @Override
    public int minSupportedResolution() {
        return 0;
    }

    @Override
    public int maxSupportedResolution() {
        return H3_MAX_RESOLUTION;
    }

    @Override
    public Set<String> polygonToCells(AreaGeometry geometry, int resolution) {
        checkResolution(resolution);
        var cells = new LinkedHashSet<String>();
        for (GeoPolygon polygon : geometry.polygons()) {
            try {
                cells.addAll(h3.polygonToCellAddresses(toLatLng(polygon.shell()),
                                                       polygon.holes().stream().map(H3HexGrid::toLatLng).toList(),
                                                       resolution));
            } catch (H3Exception | IllegalArgumentException e) {
                throw new MalformedGeometryException("Polygon cannot be tiled at resolution " + resolution
                    + ": " + e.getMessage(), e);
            }
        }
        return cells;
    }

    @Override
    public String cellToParent(String cell, int resolution) {
        int own = resolution(cell);
        if (resolution < 0 || resolution > own) {
            throw new InvalidResolutionException(resolution, 0, own);
        }
        return h3.cellToParentAddress(cell, resolution);
    }

    @Override
    public List<String> cellToChildren(String cell, int resolution) {
        int own = resolution(cell);
        if (resolution < own || resolution > H3_MAX_RESOLUTION) {
            throw new InvalidResolutionException(resolution, own, H3_MAX_RESOLUTION);
        }
        return h3.cellToChildren(cell, resolution);
    }

    @Override
    public Set<String> compact(Collection<String> cells) {
        if (cells.isEmpty()) {
            return Set.of();
        }
        try {
            return new LinkedHashSet<>(h3.compactCellAddresses(cells));
        } catch (H3Exception e) {
            throw new MalformedGeometryException("Cell set cannot be compacted: " + e.getMessage(), e);
        }
    }

    @Override
    public int baseCell(String cell) {
        requireValid(cell);
        return h3.getBaseCellNumber(cell);
    }

    @Override
    public int resolution(String cell) {
        requireValid(cell);
        return h3.getResolution(cell);
    }

    @Override
    public boolean isValidCell(String cell) {
        if (cell == null || cell.isEmpty()) return false;
        try {
            return h3.isValidCell(cell);
        } catch (IllegalArgumentException e) {
            // not hexadecimal
            return false;
        }
    }

    private void requireValid(String cell) {
        if (!isValidCell(cell)) {
            throw new InvalidCellException(cell);
        }
    }

    private static void checkResolution(int resolution) {
        if (resolution < 0 || resolution > H3_MAX_RESOLUTION) {
            throw new InvalidResolutionException(resolution, 0, H3_MAX_RESOLUTION);
        }
    }

    private static List<LatLng> toLatLng(List<GeoPoint> ring) {
        return ring.stream().map(p -> new LatLng(p.lat(), p.lng())).toList();
    }
}
