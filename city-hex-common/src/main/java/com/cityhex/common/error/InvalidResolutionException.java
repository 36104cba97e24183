package com.cityhex.common.error;

public class InvalidResolutionException extends CityIndexException {

    private final int resolution;

    public InvalidResolutionException(int resolution, int min, int max) {
        super(ErrorCode.INVALID_RESOLUTION,
              "Resolution " + resolution + " outside supported range [" + min + ", " + max + "]");
        this.resolution = resolution;
    }

    public int resolution() {
        return resolution;
    }
}
