package com.roof.measurement.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Builder;

/**
 * Quality signals fed to the confidence scorer. Nullable signals are simply not scored.
 *
 * @param imageryQuality imagery grade, null when no imagery was used
 * @param imageryAgeYears age of the imagery in years, null when unknown
 * @param segmentCount roof faces measured
 * @param pitchDegrees representative pitch
 * @param sourceCount independent sources that produced a measurement
 * @param sourceAgreement agreement score 0-100 across sources, null when not compared
 * @param hasCalibration whether historical calibration data exists for the location
 * @param exactCalibration whether the calibration is an exact report match for this building
 * @param lidarData whether LiDAR data was used
 * @param manualInput whether the area was traced by the user
 */
@Builder(toBuilder = true)
public record ConfidenceSignals(
        ImageryQuality imageryQuality,
        @DecimalMin("0.0") Double imageryAgeYears,
        @Min(0) int segmentCount,
        @DecimalMin("0.0") @DecimalMax(value = "90.0", inclusive = false) double pitchDegrees,
        @Min(1) int sourceCount,
        @DecimalMin("0.0") @DecimalMax("100.0") Double sourceAgreement,
        boolean hasCalibration,
        boolean exactCalibration,
        boolean lidarData,
        boolean manualInput) {}
