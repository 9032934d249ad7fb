package com.roof.measurement.tier;

import com.roof.measurement.dto.TierDescriptor;

/**
 * The measurement tiers, in resolution order. Tier numbers double as accuracy rank: lower is
 * expected to be more accurate.
 */
public enum TierType {
    LIDAR(1, "LiDAR (Instant Roofer)", "95-98%"),
    SOLAR_HIGH(2, "Google Solar API (HIGH quality)", "92-95%"),
    SOLAR_MEDIUM(3, "Google Solar API (MEDIUM quality)", "85-90%"),
    SOLAR_LOW(4, "Google Solar API (LOW quality)", "75-85%"),
    FOOTPRINT(5, "OpenStreetMap + Estimated Pitch", "50-70%"),
    ADDRESS_ESTIMATE(6, "Address-Based Historical Estimate", "40-60%"),
    MANUAL(7, "Manual Polygon Tracing", "85-95%");

    private final TierDescriptor descriptor;

    TierType(int tierNumber, String name, String accuracy) {
        this.descriptor = new TierDescriptor(tierNumber, name, accuracy);
    }

    public TierDescriptor descriptor() {
        return descriptor;
    }

    public int tierNumber() {
        return descriptor.tierNumber();
    }
}
