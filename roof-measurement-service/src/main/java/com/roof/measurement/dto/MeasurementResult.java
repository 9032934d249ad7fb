package com.roof.measurement.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.roof.measurement.algorithm.util.PitchCalculator;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Builder;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * One source's roof measurement.
 *
 * <p>Invariants: adjustedAreaSqFt = rawAreaSqFt × pitchMultiplier and squares = adjustedAreaSqFt /
 * 100. Values are never mutated; calibration and annotation produce new instances.
 *
 * @param rawAreaSqM horizontal footprint area in square metres
 * @param rawAreaSqFt horizontal footprint area in square feet
 * @param adjustedAreaSqFt pitch-corrected surface area in square feet
 * @param squares roofing squares (100 sq ft each)
 * @param pitchDegrees representative roof pitch
 * @param pitchMultiplier area correction factor for {@code pitchDegrees}
 * @param segmentCount number of roof faces
 * @param complexity classification derived from segment count
 * @param source measurement origin
 * @param confidence source-level confidence, 0 to 100
 * @param imageryQuality imagery grade, null for sources without imagery
 * @param imageryDate capture date of the underlying imagery, null when unknown
 * @param lidarData whether the measurement is LiDAR-backed
 * @param calibrationFactor cumulative calibration factor applied, 1.0 when uncalibrated
 * @param warnings caveats to surface to the user
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MeasurementResult(
        double rawAreaSqM,
        double rawAreaSqFt,
        @PositiveOrZero(message = "Adjusted area cannot be negative") double adjustedAreaSqFt,
        double squares,
        double pitchDegrees,
        double pitchMultiplier,
        int segmentCount,
        RoofComplexity complexity,
        @NotNull(message = "Measurement source is required") MeasurementSource source,
        int confidence,
        ImageryQuality imageryQuality,
        LocalDate imageryDate,
        boolean lidarData,
        double calibrationFactor,
        List<String> warnings) {

    public static final String MANUAL_TRACING_WARNING =
        "Manual tracing required - trace the roof outline to calculate area";

    public MeasurementResult {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        if (complexity == null) {
            complexity = RoofComplexity.fromSegmentCount(segmentCount);
        }
        if (calibrationFactor <= 0) {
            calibrationFactor = 1.0;
        }
    }

    /**
     * Starts a measurement from a horizontal footprint; the sloped area is derived from the pitch.
     */
    public static MeasurementResultBuilder fromFootprint(
            MeasurementSource source, double rawAreaSqFt, double pitchDegrees, int segmentCount) {
        double multiplier = PitchCalculator.pitchMultiplierFromDegrees(pitchDegrees);
        double adjusted = rawAreaSqFt * multiplier;
        return builder()
            .source(source)
            .rawAreaSqFt(rawAreaSqFt)
            .rawAreaSqM(PitchCalculator.squareFeetToSquareMeters(rawAreaSqFt))
            .adjustedAreaSqFt(adjusted)
            .squares(PitchCalculator.areaToSquares(adjusted))
            .pitchDegrees(pitchDegrees)
            .pitchMultiplier(multiplier)
            .segmentCount(segmentCount)
            .complexity(RoofComplexity.fromSegmentCount(segmentCount))
            .calibrationFactor(1.0);
    }

    /**
     * Starts a measurement from an already pitch-corrected surface area. The footprint is backed
     * out from the pitch so the area invariant still holds.
     */
    public static MeasurementResultBuilder fromSlopedArea(
            MeasurementSource source, double slopedAreaSqFt, double pitchDegrees, int segmentCount) {
        double multiplier = PitchCalculator.pitchMultiplierFromDegrees(pitchDegrees);
        double raw = slopedAreaSqFt / multiplier;
        return builder()
            .source(source)
            .rawAreaSqFt(raw)
            .rawAreaSqM(PitchCalculator.squareFeetToSquareMeters(raw))
            .adjustedAreaSqFt(slopedAreaSqFt)
            .squares(PitchCalculator.areaToSquares(slopedAreaSqFt))
            .pitchDegrees(pitchDegrees)
            .pitchMultiplier(multiplier)
            .segmentCount(segmentCount)
            .complexity(RoofComplexity.fromSegmentCount(segmentCount))
            .calibrationFactor(1.0);
    }

    /**
     * Zero-area stand-in returned when no automated source produced a measurement.
     */
    public static MeasurementResult manualTracingPlaceholder() {
        return builder()
            .source(MeasurementSource.MANUAL)
            .pitchMultiplier(1.0)
            .complexity(RoofComplexity.SIMPLE)
            .calibrationFactor(1.0)
            .warnings(List.of(MANUAL_TRACING_WARNING))
            .build();
    }

    /**
     * Scales the areas by a calibration factor and recomputes squares. A factor of exactly 1.0
     * returns this instance.
     *
     * @throws IllegalArgumentException when the factor is not a positive finite number
     */
    public MeasurementResult withCalibrationFactor(double factor) {
        if (factor == 1.0) {
            return this;
        }
        if (!Double.isFinite(factor) || factor <= 0) {
            throw new IllegalArgumentException("Calibration factor must be positive: " + factor);
        }
        double adjusted = adjustedAreaSqFt * factor;
        return toBuilder()
            .rawAreaSqM(rawAreaSqM * factor)
            .rawAreaSqFt(rawAreaSqFt * factor)
            .adjustedAreaSqFt(adjusted)
            .squares(PitchCalculator.areaToSquares(adjusted))
            .calibrationFactor(calibrationFactor * factor)
            .build();
    }

    public MeasurementResult withWarning(String warning) {
        List<String> combined = new ArrayList<>(warnings);
        combined.add(warning);
        return toBuilder().warnings(combined).build();
    }

    public boolean hasArea() {
        return adjustedAreaSqFt > 0;
    }
}
