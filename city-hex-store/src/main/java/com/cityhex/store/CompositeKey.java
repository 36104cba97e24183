package com.cityhex.store;

/**
 * Flattens (partitionKey, sortKey) into one ordered key: {@code partition:sort}.
 * Partition keys are base-cell numbers and never contain the delimiter.
 */
final class CompositeKey {
    static final char DELIMITER = ':';

    private CompositeKey() {}

    static String of(String partitionKey, String sortKey) {
        if (partitionKey == null || partitionKey.isEmpty() || partitionKey.indexOf(DELIMITER) >= 0) {
            throw new IllegalArgumentException("Invalid partition key: " + partitionKey);
        }
        return partitionKey + DELIMITER + (sortKey == null ? "" : sortKey);
    }
}
