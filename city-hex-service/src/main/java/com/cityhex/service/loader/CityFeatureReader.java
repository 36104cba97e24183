package com.cityhex.service.loader;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.function.Consumer;

/**
 * Streams the {@code features} array of a GeoJSON FeatureCollection one feature at a
 * time, so a large dataset is never held in memory as a single tree.
 * An element of {@code features} that is not an object is delivered as a feature with
 * no name and no geometry, so it is counted rather than silently dropped.
 */
public class CityFeatureReader {
    private static final Logger log = LoggerFactory.getLogger(CityFeatureReader.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String nameProperty;

    public CityFeatureReader(String nameProperty) {
        this.nameProperty = nameProperty;
    }

    /** @return number of features delivered to {@code sink} */
    public long read(InputStream in, Consumer<CityFeature> sink) throws IOException {
        try (JsonParser parser = MAPPER.getFactory().createParser(in)) {
            if (parser.nextToken() != JsonToken.START_OBJECT) {
                throw new IOException("Expected a GeoJSON FeatureCollection object");
            }
            long index = 0;
            while (parser.nextToken() == JsonToken.FIELD_NAME) {
                String field = parser.currentName();
                JsonToken value = parser.nextToken();
                if (!"features".equals(field)) {
                    parser.skipChildren();
                    continue;
                }
                if (value != JsonToken.START_ARRAY) {
                    throw new IOException("'features' must be an array");
                }
                JsonToken element;
                while ((element = parser.nextToken()) != JsonToken.END_ARRAY) {
                    if (element == null) {
                        throw new IOException("'features' array is not terminated");
                    }
                    if (element == JsonToken.START_OBJECT) {
                        sink.accept(toFeature(index++, MAPPER.readTree(parser)));
                    } else {
                        // keeps positional ids stable; the loader counts it as skipped
                        log.warn("Feature {} is {} rather than an object", index, element);
                        parser.skipChildren();
                        sink.accept(new CityFeature(Long.toString(index++), null, null));
                    }
                }
            }
            return index;
        }
    }

    private CityFeature toFeature(long index, JsonNode feature) {
        JsonNode name = feature.path("properties").get(nameProperty);
        return new CityFeature(
            Long.toString(index),
            name == null || name.isNull() ? null : name.asText(),
            feature.get("geometry")
        );
    }
}
