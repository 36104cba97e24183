package com.cityhex.common.geo;

public record GeoPoint(double lat, double lng) {

    /** GeoJSON positions are [longitude, latitude]. */
    public static GeoPoint fromGeoJson(double lng, double lat) {
        return new GeoPoint(lat, lng);
    }
}
