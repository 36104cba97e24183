package com.cityhex.service;

import com.cityhex.common.config.IndexSettings;
import com.cityhex.common.error.StorageUnavailableException;
import com.cityhex.common.grid.H3HexGrid;
import com.cityhex.common.model.IndexRecord;
import com.cityhex.service.loader.LoadReport;
import com.cityhex.store.InMemoryStorageGateway;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.uber.h3core.H3Core;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CityIndexHandlersTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String BAY_POLYGON = """
        {"type": "Polygon", "coordinates": [[[-122.7, 37.55], [-122.0, 37.55], [-122.0, 38.0], [-122.7, 38.0], [-122.7, 37.55]]]}""";

    private static H3Core h3;

    private InMemoryStorageGateway store;
    private CityIndex index;
    private CityIndexHandlers handlers;

    @BeforeAll
    static void initH3() throws IOException {
        h3 = H3Core.newInstance();
    }

    @BeforeEach
    void setUp() {
        store = new InMemoryStorageGateway();
        index = new CityIndex(IndexSettings.defaults().withDatasetPath(CityHexApp.SAMPLE_DATASET),
                              new H3HexGrid(h3), store);
        handlers = new CityIndexHandlers(index);
    }

    @AfterEach
    void tearDown() {
        index.close();
    }

    @Test
    void emptyStoreAnswersWithNoCities() {
        String json = handlers.queryPolygonJson("""
            {"geometry": %s, "resolution": 5}""".formatted(BAY_POLYGON));
        assertEquals("{\"statusCode\":200,\"body\":{\"cities\":[]}}", json);
    }

    @Test
    void geometryWithoutAreaAnswersWithNoCities() {
        handlers.loadCities();
        String json = handlers.queryPolygonJson("""
            {"geometry": {"type": "Point", "coordinates": [-122.44, 37.76]}, "resolution": 6, "compact": true}""");
        assertEquals("{\"statusCode\":200,\"body\":{\"cities\":[]}}", json);
    }

    @Test
    void polygonAnswerIsSortedAndDistinct() throws IOException {
        handlers.loadCities();
        JsonNode response = MAPPER.readTree(handlers.queryPolygonJson("""
            {"geometry": %s, "resolution": 6, "compact": true}""".formatted(BAY_POLYGON)));

        assertEquals(200, response.get("statusCode").asInt());
        List<String> cities = MAPPER.convertValue(response.at("/body/cities"),
            MAPPER.getTypeFactory().constructCollectionType(List.class, String.class));
        assertEquals(cities.stream().sorted().distinct().toList(), cities);
        assertTrue(cities.containsAll(List.of("Berkeley", "Oakland", "San Francisco", "Sausalito")), cities.toString());
        assertFalse(response.get("body").has("error"));
    }

    @Test
    void cellQueryAnswersNames() {
        handlers.loadCities();
        QueryResponse response = handlers.queryCell(h3.latLngToCellAddress(37.76, -122.445, 7));

        assertEquals(200, response.statusCode());
        assertEquals(List.of("San Francisco"), response.body().cities());
    }

    @Test
    void reloadStartsFromAnEmptyTable() {
        LoadReport first = handlers.loadCities();
        store.put(new IndexRecord("0", "stale#9", "Stale", "9"));

        LoadReport second = handlers.reloadCities();
        assertEquals(first.recordsWritten(), second.recordsWritten());
        assertEquals(first.recordsWritten(), store.size());
    }

    @Test
    void invalidCellIsAClientError() throws IOException {
        assertFailure(CityIndexHandlers.toJson(handlers.queryCell("not-a-cell")), 400, "INVALID_CELL");
    }

    @Test
    void coarseCellIsAClientError() throws IOException {
        String coarse = h3.latLngToCellAddress(37.76, -122.445, 1);
        assertFailure(CityIndexHandlers.toJson(handlers.queryCell(coarse)), 400, "INVALID_RESOLUTION");
    }

    @Test
    void resolutionOutOfRangeIsAClientError() throws IOException {
        assertFailure(handlers.queryPolygonJson("""
            {"geometry": %s, "resolution": 1}""".formatted(BAY_POLYGON)), 400, "INVALID_RESOLUTION");
        assertFailure(handlers.queryPolygonJson("""
            {"geometry": %s, "resolution": 16}""".formatted(BAY_POLYGON)), 400, "INVALID_RESOLUTION");
    }

    @Test
    void malformedGeometryIsAClientError() throws IOException {
        assertFailure(handlers.queryPolygonJson("""
            {"geometry": {"type": "Circle", "coordinates": [0, 0]}, "resolution": 5}"""), 400, "MALFORMED_GEOMETRY");
        assertFailure(handlers.queryPolygonJson("""
            {"geometry": {"type": "Polygon", "coordinates": [[[0, 0], [1, 1]]]}, "resolution": 5}"""),
            400, "MALFORMED_GEOMETRY");
    }

    @Test
    void fractionalResolutionIsAClientError() throws IOException {
        assertFailure(handlers.queryPolygonJson("""
            {"geometry": %s, "resolution": 6.9}""".formatted(BAY_POLYGON)), 400, "INVALID_REQUEST");
        assertFailure(handlers.queryPolygonJson("""
            {"geometry": %s, "resolution": 6.0}""".formatted(BAY_POLYGON)), 400, "INVALID_REQUEST");
    }

    @Test
    void unreadableRequestIsAClientError() throws IOException {
        assertFailure(handlers.queryPolygonJson("not json"), 400, "INVALID_REQUEST");
        assertFailure(handlers.queryPolygonJson("""
            {"geometry": %s}""".formatted(BAY_POLYGON)), 400, "INVALID_REQUEST");
        assertFailure(handlers.queryPolygonJson("""
            {"resolution": 5}"""), 400, "INVALID_REQUEST");
    }

    @Test
    void storageOutageIsAServerError() throws IOException {
        var broken = new InMemoryStorageGateway() {
            @Override
            public List<IndexRecord> query(String partitionKey, String sortKeyPrefix) {
                throw new StorageUnavailableException("connection refused");
            }
        };
        try (var brokenIndex = new CityIndex(IndexSettings.defaults(), new H3HexGrid(h3), broken)) {
            var brokenHandlers = new CityIndexHandlers(brokenIndex);

            String cell = h3.latLngToCellAddress(37.76, -122.445, 5);
            assertFailure(CityIndexHandlers.toJson(brokenHandlers.queryCell(cell)), 503, "STORAGE_UNAVAILABLE");
            assertFailure(brokenHandlers.queryPolygonJson("""
                {"geometry": %s, "resolution": 5}""".formatted(BAY_POLYGON)), 503, "STORAGE_UNAVAILABLE");
        }
    }

    private static void assertFailure(String json, int status, String code) throws IOException {
        JsonNode response = MAPPER.readTree(json);
        assertEquals(status, response.get("statusCode").asInt(), json);
        assertEquals(code, response.at("/body/error").asText(), json);
        assertTrue(response.at("/body/message").isTextual(), json);
        assertFalse(response.get("body").has("cities"), json);
    }
}
