package com.cityhex.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record CityMatch(
    @JsonProperty("id") String cityId,
    @JsonProperty("name") String cityName
) {
    public static CityMatch of(IndexRecord record) {
        return new CityMatch(record.cityId(), record.cityName());
    }
}
