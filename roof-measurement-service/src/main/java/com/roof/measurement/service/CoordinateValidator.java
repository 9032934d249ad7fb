package com.roof.measurement.service;

/**
 * Input checks applied before any provider is called.
 */
public final class CoordinateValidator {

    private CoordinateValidator() {}

    /**
     * @throws IllegalArgumentException when either coordinate is missing, not finite or out of range
     */
    public static void validate(Double lat, Double lng) {
        if (lat == null || lng == null) {
            throw new IllegalArgumentException("Latitude and longitude are required");
        }
        if (!Double.isFinite(lat) || lat < -90.0 || lat > 90.0) {
            throw new IllegalArgumentException("Latitude must be between -90 and 90: " + lat);
        }
        if (!Double.isFinite(lng) || lng < -180.0 || lng > 180.0) {
            throw new IllegalArgumentException("Longitude must be between -180 and 180: " + lng);
        }
    }
}
