package com.cityhex.service;

import com.cityhex.common.error.CityIndexException;
import com.cityhex.common.error.InvalidRequestException;
import com.cityhex.common.geo.AreaGeometry;
import com.cityhex.common.geo.GeoJsonGeometryParser;
import com.cityhex.service.loader.LoadReport;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;

/**
 * Request-level entry points. Query handlers never throw index errors: every
 * {@link CityIndexException} becomes a status-coded {@link QueryResponse}.
 */
public class CityIndexHandlers {
    private static final Logger log = LoggerFactory.getLogger(CityIndexHandlers.class);
    // "resolution": 6.9 is a bad request, not resolution 6
    private static final ObjectMapper MAPPER = new ObjectMapper()
        .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT);

    private final CityIndex index;

    public CityIndexHandlers(CityIndex index) {
        this.index = index;
    }

    /** Loads the configured dataset. Safe to run again over a populated store. */
    public LoadReport loadCities() {
        return index.loader().loadDataset(index.settings().datasetPath());
    }

    /** Empties the table, then loads. */
    public LoadReport reloadCities() {
        log.info("Truncating table before reload");
        index.gateway().truncate();
        return loadCities();
    }

    public QueryResponse queryCell(String address) {
        try {
            Set<String> names = index.cellEngine().queryCell(address);
            return QueryResponse.ok(names);
        } catch (CityIndexException e) {
            return fail("cell " + address, e);
        }
    }

    public QueryResponse queryPolygon(PolygonQueryRequest request) {
        try {
            if (request == null || request.geometry() == null || request.geometry().isNull()) {
                throw new InvalidRequestException("Request must carry a 'geometry' object");
            }
            if (request.resolution() == null) {
                throw new InvalidRequestException("Request must carry an integer 'resolution'");
            }
            AreaGeometry geometry = GeoJsonGeometryParser.parse(request.geometry());
            Set<String> names = index.polygonEngine().queryPolygon(geometry, request.resolution(), request.compact());
            return QueryResponse.ok(names);
        } catch (CityIndexException e) {
            return fail("polygon", e);
        }
    }

    /** JSON in, JSON out; the shape a function-style deployment would expose. */
    public String queryPolygonJson(String body) {
        PolygonQueryRequest request;
        try {
            request = MAPPER.readValue(body, PolygonQueryRequest.class);
        } catch (JsonProcessingException e) {
            return toJson(fail("polygon", new InvalidRequestException(
                "Request body is not a valid polygon query: " + e.getOriginalMessage(), e)));
        }
        return toJson(queryPolygon(request));
    }

    public static String toJson(QueryResponse response) {
        try {
            return MAPPER.writeValueAsString(response);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize response", e);
        }
    }

    private static QueryResponse fail(String what, CityIndexException e) {
        if (e.code().isClientError()) {
            log.warn("Rejected {} query: {} {}", what, e.code(), e.getMessage());
        } else {
            log.error("Failed {} query: {}", what, e.code(), e);
        }
        return QueryResponse.failure(e);
    }
}
