package com.cityhex.common.key;

public record StorageKey(String partitionKey, String sortKey) {}
