package com.cityhex.common.error;

/** Raised when the key-value store cannot serve a read or write (I/O, timeout, closed). */
public class StorageUnavailableException extends CityIndexException {

    public StorageUnavailableException(String message) {
        super(ErrorCode.STORAGE_UNAVAILABLE, message);
    }

    public StorageUnavailableException(String message, Throwable cause) {
        super(ErrorCode.STORAGE_UNAVAILABLE, message, cause);
    }
}
