package com.cityhex.common.geo;

import com.cityhex.common.error.MalformedGeometryException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts GeoJSON geometry objects into {@link AreaGeometry}.
 *
 * Polygon and MultiPolygon become polygons; Point, MultiPoint, LineString and
 * MultiLineString are valid but have no area, so they map to the empty geometry.
 * Anything else fails with {@link MalformedGeometryException}.
 */
public final class GeoJsonGeometryParser {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private GeoJsonGeometryParser() {}

    public static AreaGeometry parse(String json) {
        try {
            return parse(MAPPER.readTree(json));
        } catch (JsonProcessingException e) {
            throw new MalformedGeometryException("Geometry is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    public static AreaGeometry parse(JsonNode geometry) {
        if (geometry == null || geometry.isNull() || !geometry.isObject()) {
            throw new MalformedGeometryException("Geometry must be a GeoJSON object");
        }
        String type = geometry.path("type").asText("");
        JsonNode coordinates = geometry.get("coordinates");

        return switch (type) {
            case "Polygon" -> AreaGeometry.of(polygon(requireArray(coordinates, type)));
            case "MultiPolygon" -> {
                var polygons = new ArrayList<GeoPolygon>();
                for (JsonNode poly : requireArray(coordinates, type)) {
                    polygons.add(polygon(requireArray(poly, type)));
                }
                yield new AreaGeometry(polygons);
            }
            case "Point", "MultiPoint", "LineString", "MultiLineString" -> {
                requireArray(coordinates, type);
                yield AreaGeometry.empty();
            }
            case "" -> throw new MalformedGeometryException("Geometry has no type");
            default -> throw new MalformedGeometryException("Unsupported geometry type: " + type);
        };
    }

    private static GeoPolygon polygon(JsonNode rings) {
        if (rings.isEmpty()) {
            throw new MalformedGeometryException("Polygon has no rings");
        }
        List<GeoPoint> shell = ring(rings.get(0));
        var holes = new ArrayList<List<GeoPoint>>();
        for (int i = 1; i < rings.size(); i++) {
            holes.add(ring(rings.get(i)));
        }
        return new GeoPolygon(shell, holes);
    }

    private static List<GeoPoint> ring(JsonNode positions) {
        requireArray(positions, "ring");
        if (positions.size() < 3) {
            throw new MalformedGeometryException("Linear ring needs at least 3 positions, got " + positions.size());
        }
        var points = new ArrayList<GeoPoint>(positions.size());
        for (JsonNode position : positions) {
            if (!position.isArray() || position.size() < 2
                    || !position.get(0).isNumber() || !position.get(1).isNumber()) {
                throw new MalformedGeometryException("Position must be [lng, lat], got " + position);
            }
            double lng = position.get(0).asDouble();
            double lat = position.get(1).asDouble();
            if (lat < -90 || lat > 90 || lng < -180 || lng > 180) {
                throw new MalformedGeometryException("Position out of range: " + position);
            }
            points.add(GeoPoint.fromGeoJson(lng, lat));
        }
        return points;
    }

    private static JsonNode requireArray(JsonNode node, String context) {
        if (node == null || !node.isArray()) {
            throw new MalformedGeometryException(context + " coordinates must be an array");
        }
        return node;
    }
}
