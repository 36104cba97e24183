package com.cityhex.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One stored row per (leaf cell, city) pair.
 *
 * @param partitionKey base cell number of the leaf cell, as a decimal string
 * @param sortKey      parent chain min..max resolution, separator, then the city id
 * @param cityName     display name from the source feature
 * @param cityId       position of the feature in the source FeatureCollection
 */
public record IndexRecord(
    @JsonProperty("ParentCell") String partitionKey,
    @JsonProperty("CellLocationIndex") String sortKey,
    @JsonProperty("CityName") String cityName,
    @JsonProperty("CityID") String cityId
) {}
