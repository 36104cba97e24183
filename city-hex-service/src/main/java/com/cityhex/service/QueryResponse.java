package com.cityhex.service;

import com.cityhex.common.error.CityIndexException;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collection;
import java.util.List;

/**
 * Status-coded response envelope:
 * <pre>
 *   {"statusCode": 200, "body": {"cities": ["Oakland", "San Francisco"]}}
 *   {"statusCode": 400, "body": {"error": "INVALID_RESOLUTION", "message": "..."}}
 * </pre>
 */
@JsonPropertyOrder({"statusCode", "body"})
public record QueryResponse(
    @JsonProperty("statusCode") int statusCode,
    @JsonProperty("body") Body body
) {
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonPropertyOrder({"cities", "error", "message"})
    public record Body(
        @JsonProperty("cities") List<String> cities,
        @JsonProperty("error") String error,
        @JsonProperty("message") String message
    ) {}

    /** Names sorted so identical answers serialize identically. */
    public static QueryResponse ok(Collection<String> cities) {
        return new QueryResponse(200, new Body(cities.stream().sorted().toList(), null, null));
    }

    public static QueryResponse failure(CityIndexException e) {
        return new QueryResponse(e.code().status(), new Body(null, e.code().name(), e.getMessage()));
    }
}
