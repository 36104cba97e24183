package com.cityhex.service.loader;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One feature of the source FeatureCollection.
 *
 * @param id       the feature's position in the collection, as a decimal string
 * @param name     value of the configured name property; null when absent
 * @param geometry raw GeoJSON geometry, parsed lazily so one bad feature cannot stop the read
 */
public record CityFeature(String id, String name, JsonNode geometry) {

    public boolean hasName() {
        return name != null && !name.isBlank();
    }
}
