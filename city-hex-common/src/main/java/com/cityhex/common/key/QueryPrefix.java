package com.cityhex.common.key;

/**
 * Range-scan target: every record in {@code partitionKey} whose sort key starts
 * with {@code sortKeyPrefix} descends from the cell the prefix was built for.
 */
public record QueryPrefix(String partitionKey, String sortKeyPrefix, int resolution) {}
