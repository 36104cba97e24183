package com.cityhex.service.loader;

public record LoadReport(
    long featuresRead,
    long featuresIndexed,
    long featuresSkipped,
    long recordsWritten,
    long recordsFailed,
    long elapsedMs
) {
    public boolean complete() {
        return recordsFailed == 0;
    }
}
