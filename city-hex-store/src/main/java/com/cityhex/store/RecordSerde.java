package com.cityhex.store;

import com.cityhex.common.model.IndexRecord;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * JSON value encoding for stored records.
 * Uses the same attribute names as the record's {@code @JsonProperty} mapping.
 */
final class RecordSerde {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private RecordSerde() {}

    static byte[] serialize(IndexRecord record) {
        try {
            return MAPPER.writeValueAsBytes(record);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to serialize: " + record, e);
        }
    }

    static IndexRecord deserialize(byte[] data) {
        try {
            return MAPPER.readValue(data, IndexRecord.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to deserialize index record", e);
        }
    }
}
