package com.cityhex.common.error;

/**
 * Base for every failure the index raises. Unchecked, like the H3 library's own
 * exceptions, so it passes through executor futures and lambdas untouched.
 */
public abstract class CityIndexException extends RuntimeException {

    private final ErrorCode code;

    protected CityIndexException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    protected CityIndexException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode code() {
        return code;
    }
}
