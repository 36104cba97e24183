package com.cityhex.common.error;

/**
 * Failure categories surfaced by the query entry points.
 * The status splits "bad input" (4xx) from "backend unavailable" (5xx).
 */
public enum ErrorCode {
    INVALID_RESOLUTION(400),
    INVALID_CELL(400),
    MALFORMED_GEOMETRY(400),
    INVALID_REQUEST(400),
    STORAGE_UNAVAILABLE(503);

    private final int status;

    ErrorCode(int status) {
        this.status = status;
    }

    public int status() {
        return status;
    }

    public boolean isClientError() {
        return status >= 400 && status < 500;
    }
}
