package com.roof.measurement.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.util.List;

/**
 * Complete answer for one measurement request.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MeasurementReport(
        Double latitude,
        Double longitude,
        String address,
        MeasurementResult measurement,
        SourceInfo source,
        ConfidenceResult confidence,
        CrossValidationResult crossValidation,
        SourceValidation sourceValidation,
        GafCalibrationResult gafCalibration,
        String pitchCategory,
        String standardPitch,
        List<MeasurementResult> candidates,
        List<TierFailure> higherTierFailures,
        List<String> fallbacksAvailable,
        boolean manualTracingRequired,
        List<String> recommendations) {}
