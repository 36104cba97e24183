package com.cityhex.service;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Body of a polygon query: {@code {"geometry": {...}, "resolution": 6, "compact": true}}.
 * {@code resolution} is required; {@code compact} defaults to false.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PolygonQueryRequest(
    @JsonProperty("geometry") JsonNode geometry,
    @JsonProperty("resolution") Integer resolution,
    @JsonProperty("compact") boolean compact
) {}
