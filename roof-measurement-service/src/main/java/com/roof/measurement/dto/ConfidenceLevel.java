package com.roof.measurement.dto;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ConfidenceLevel {
    LOW("low"),
    MODERATE("moderate"),
    HIGH("high");

    /** Lowest score classified as moderate. */
    public static final int MODERATE_THRESHOLD = 60;

    /** Lowest score classified as high. */
    public static final int HIGH_THRESHOLD = 75;

    private final String label;

    ConfidenceLevel(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public static ConfidenceLevel fromScore(int score) {
        if (score >= HIGH_THRESHOLD) {
            return HIGH;
        } else if (score >= MODERATE_THRESHOLD) {
            return MODERATE;
        }
        return LOW;
    }
}
