package com.cityhex.common.error;

public class InvalidCellException extends CityIndexException {

    public InvalidCellException(String address) {
        super(ErrorCode.INVALID_CELL, "Not a valid H3 cell address: " + address);
    }
}
