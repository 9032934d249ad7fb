package com.roof.measurement.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/**
 * User-traced roof area.
 *
 * @param manualArea traced footprint area in square feet
 * @param manualPitch pitch in degrees, defaults to 20 when absent
 */
public record ManualMeasurementRequest(
        @DecimalMin("-90.0") @DecimalMax("90.0") Double lat,
        @DecimalMin("-180.0") @DecimalMax("180.0") Double lng,
        String address,
        @NotNull(message = "manualArea is required") @Positive(message = "manualArea must be positive") Double manualArea,
        @DecimalMin("0.0") @DecimalMax(value = "90.0", inclusive = false) Double manualPitch) {}
