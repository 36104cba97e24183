package com.cityhex.common.geo;

import java.util.List;

/**
 * Areal geometry handed to the grid for tiling. Point and line geometries carry no
 * area and are represented by {@link #empty()}.
 */
public record AreaGeometry(List<GeoPolygon> polygons) {

    private static final AreaGeometry EMPTY = new AreaGeometry(List.of());

    public AreaGeometry {
        polygons = List.copyOf(polygons);
    }

    public static AreaGeometry empty() {
        return EMPTY;
    }

    public static AreaGeometry of(GeoPolygon... polygons) {
        return new AreaGeometry(List.of(polygons));
    }

    public boolean isEmpty() {
        return polygons.isEmpty();
    }
}
