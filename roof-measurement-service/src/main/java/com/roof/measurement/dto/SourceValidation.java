package com.roof.measurement.dto;

import java.util.List;

/**
 * Secondary sources checked against the primary measurement.
 */
public record SourceValidation(
        MeasurementSource primarySource,
        Status status,
        List<SourceComparison> comparisons,
        List<String> warnings) {

    public enum Status {
        VALIDATED,
        UNVALIDATED,
        DISCREPANCY_DETECTED
    }

    public enum Variance {
        AGREES,
        MINOR_VARIANCE,
        SIGNIFICANT_VARIANCE
    }

    /**
     * @param variancePercent |secondary − primary| / primary, in percent
     */
    public record SourceComparison(MeasurementSource source, double areaSqFt, double variancePercent, Variance variance) {}

    public SourceValidation {
        comparisons = comparisons == null ? List.of() : List.copyOf(comparisons);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
