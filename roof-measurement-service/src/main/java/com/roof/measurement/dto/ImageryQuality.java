package com.roof.measurement.dto;

import java.util.Locale;

/**
 * Imagery quality grade reported by the solar imagery provider.
 */
public enum ImageryQuality {
    HIGH(3),
    MEDIUM(2),
    LOW(1),
    UNKNOWN(0);

    private final int rank;

    ImageryQuality(int rank) {
        this.rank = rank;
    }

    /**
     * Whether imagery of this grade satisfies a tier's quality floor. UNKNOWN is graded as LOW.
     */
    public boolean meets(ImageryQuality floor) {
        return effectiveRank() >= floor.effectiveRank();
    }

    private int effectiveRank() {
        return this == UNKNOWN ? LOW.rank : rank;
    }

    public static ImageryQuality fromString(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
