package com.roof.measurement.algorithm.util;

import java.util.Locale;

/**
 * Typical roof pitch by OpenStreetMap {@code building} tag, used when only a footprint is known.
 */
public enum BuildingType {
    HOUSE(18.4, "house", "residential", "yes"),
    DETACHED(22.0, "detached"),
    GARAGE(18.4, "garage"),
    APARTMENTS(15.0, "apartments"),
    SHED(15.0, "shed"),
    COMMERCIAL(5.0, "commercial", "retail"),
    INDUSTRIAL(3.0, "industrial", "warehouse"),
    UNKNOWN(18.4);

    private final double typicalPitchDegrees;
    private final String[] tags;

    BuildingType(double typicalPitchDegrees, String... tags) {
        this.typicalPitchDegrees = typicalPitchDegrees;
        this.tags = tags;
    }

    public double getTypicalPitchDegrees() {
        return typicalPitchDegrees;
    }

    /**
     * Resolve a building tag value; unrecognised or missing tags map to {@link #UNKNOWN}.
     */
    public static BuildingType fromTag(String tag) {
        if (tag == null) {
            return UNKNOWN;
        }
        String normalized = tag.trim().toLowerCase(Locale.ROOT);
        for (BuildingType type : values()) {
            for (String candidate : type.tags) {
                if (candidate.equals(normalized)) {
                    return type;
                }
            }
        }
        return UNKNOWN;
    }
}
