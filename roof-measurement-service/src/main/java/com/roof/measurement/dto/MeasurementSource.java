package com.roof.measurement.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Origin of a measurement. Trust weight orders candidates when several sources disagree.
 */
public enum MeasurementSource {
    INSTANT_ROOFER("instant-roofer", 0.98, true),
    GOOGLE_SOLAR("google-solar", 0.90, false),
    MANUAL("manual", 0.85, false),
    OPENSTREETMAP("osm", 0.60, false),
    ADDRESS_ESTIMATE("address-estimate", 0.50, false);

    private final String id;
    private final double trustWeight;
    private final boolean lidarBacked;

    MeasurementSource(String id, double trustWeight, boolean lidarBacked) {
        this.id = id;
        this.trustWeight = trustWeight;
        this.lidarBacked = lidarBacked;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    public double getTrustWeight() {
        return trustWeight;
    }

    public boolean isLidarBacked() {
        return lidarBacked;
    }

    @JsonCreator
    public static MeasurementSource fromId(String id) {
        for (MeasurementSource source : values()) {
            if (source.id.equalsIgnoreCase(id) || source.name().equalsIgnoreCase(id)) {
                return source;
            }
        }
        throw new IllegalArgumentException("Unknown measurement source: " + id);
    }
}
