package com.cityhex.common.geo;

import java.util.List;

/**
 * One polygon: an outer ring plus zero or more holes.
 * Rings are implicitly closed; a repeated closing vertex is tolerated.
 */
public record GeoPolygon(List<GeoPoint> shell, List<List<GeoPoint>> holes) {

    public GeoPolygon {
        shell = List.copyOf(shell);
        holes = holes == null ? List.of() : holes.stream().map(List::copyOf).toList();
    }

    public static GeoPolygon of(List<GeoPoint> shell) {
        return new GeoPolygon(shell, List.of());
    }
}
