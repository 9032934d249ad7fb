package com.roof.measurement.dto;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Roof complexity derived from the number of planar faces.
 */
public enum RoofComplexity {
    SIMPLE("simple", 4),
    MODERATE("moderate", 8),
    COMPLEX("complex", Integer.MAX_VALUE);

    private final String label;
    private final int maxSegments;

    RoofComplexity(String label, int maxSegments) {
        this.label = label;
        this.maxSegments = maxSegments;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public static RoofComplexity fromSegmentCount(int segmentCount) {
        if (segmentCount <= SIMPLE.maxSegments) {
            return SIMPLE;
        } else if (segmentCount <= MODERATE.maxSegments) {
            return MODERATE;
        }
        return COMPLEX;
    }
}
