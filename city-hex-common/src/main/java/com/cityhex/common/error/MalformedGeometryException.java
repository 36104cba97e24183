package com.cityhex.common.error;

public class MalformedGeometryException extends CityIndexException {

    public MalformedGeometryException(String message) {
        super(ErrorCode.MALFORMED_GEOMETRY, message);
    }

    public MalformedGeometryException(String message, Throwable cause) {
        super(ErrorCode.MALFORMED_GEOMETRY, message, cause);
    }
}
