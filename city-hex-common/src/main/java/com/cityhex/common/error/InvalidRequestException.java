package com.cityhex.common.error;

/** A request body that cannot be read, or that lacks a required field. */
public class InvalidRequestException extends CityIndexException {

    public InvalidRequestException(String message) {
        super(ErrorCode.INVALID_REQUEST, message);
    }

    public InvalidRequestException(String message, Throwable cause) {
        super(ErrorCode.INVALID_REQUEST, message, cause);
    }
}
