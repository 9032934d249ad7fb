package com.roof.measurement.algorithm.util;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Pure pitch and area conversions used by every measurement source.
 *
 * <p>Pitch Multiplier Formula: multiplier = sqrt(tan(θ)² + 1) = 1 / cos(θ)
 *
 * <p>Where: - θ: roof pitch angle in degrees, 0 ≤ θ < 90 - multiplier: ratio of sloped surface area
 * to horizontal footprint area
 *
 * <p>A roofing "square" is 100 sq ft of sloped surface.
 */
public final class PitchCalculator {

    /** Square feet in one square meter. */
    public static final double SQ_FEET_PER_SQ_METER = 10.7639;

    /** Square feet in one roofing square. */
    public static final double SQ_FEET_PER_SQUARE = 100.0;

    /** Pitch assumed when a manual measurement does not state one. */
    public static final double DEFAULT_MANUAL_PITCH_DEGREES = 20.0;

    /** Run length of the rise:run pitch notation. */
    private static final double PITCH_RUN = 12.0;

    private static final double MAX_PITCH_DEGREES = 90.0;

    // Category upper bounds in degrees
    private static final double FLAT_MAX = 5.0;
    private static final double LOW_SLOPE_MAX = 18.5;
    private static final double MEDIUM_SLOPE_MAX = 33.7;
    private static final double STEEP_SLOPE_MAX = 45.0;

    /** Industry table of common pitches (rise per 12 of run) and their area multipliers. */
    private static final Map<String, Double> STANDARD_PITCH_MULTIPLIERS = buildStandardPitchTable();

    private PitchCalculator() {}

    /**
     * Maps a pitch angle to its area correction factor. Returns exactly 1.0 at 0° and is strictly
     * increasing on [0, 90).
     *
     * @param degrees pitch angle in degrees
     * @return multiplier to convert footprint area to sloped surface area
     * @throws IllegalArgumentException when degrees is negative, not finite, or at least 90
     */
    public static double pitchMultiplierFromDegrees(double degrees) {
        validateDegrees(degrees);
        if (degrees == 0.0) {
            return 1.0;
        }
        double slope = Math.tan(Math.toRadians(degrees));
        return Math.sqrt(slope * slope + 1.0);
    }

    /**
     * Multiplier for a rise:12 pitch, e.g. 6 for a 6:12 roof.
     */
    public static double pitchMultiplierFromRatio(double rise) {
        if (rise < 0 || !Double.isFinite(rise)) {
            throw new IllegalArgumentException("Pitch rise must be a non-negative number: " + rise);
        }
        double slope = rise / PITCH_RUN;
        return Math.sqrt(slope * slope + 1.0);
    }

    public static double ratioToDegrees(double rise) {
        if (rise < 0 || !Double.isFinite(rise)) {
            throw new IllegalArgumentException("Pitch rise must be a non-negative number: " + rise);
        }
        return Math.toDegrees(Math.atan(rise / PITCH_RUN));
    }

    public static double degreesToRatio(double degrees) {
        validateDegrees(degrees);
        return Math.tan(Math.toRadians(degrees)) * PITCH_RUN;
    }

    /**
     * Formats a pitch angle as the nearest whole "rise:12" label from the standard table range.
     */
    public static String nearestStandardPitch(double degrees) {
        long rise = Math.round(degreesToRatio(degrees));
        long clamped = Math.min(rise, 18L);
        return clamped + ":12";
    }

    /**
     * @return unmodifiable table of "rise:12" labels to area multipliers, 0:12 through 18:12
     */
    public static Map<String, Double> standardPitchMultipliers() {
        return STANDARD_PITCH_MULTIPLIERS;
    }

    /**
     * Converts an area to roofing squares. Exactly {@code areaSqFt / 100}; rounding is a display
     * concern handled by {@link #roundSquares(double)}.
     */
    public static double areaToSquares(double areaSqFt) {
        return areaSqFt / SQ_FEET_PER_SQUARE;
    }

    /** Rounds squares to two decimals for display. */
    public static double roundSquares(double squares) {
        return Math.round(squares * 100.0) / 100.0;
    }

    public static double squareMetersToSquareFeet(double areaSqM) {
        return areaSqM * SQ_FEET_PER_SQ_METER;
    }

    public static double squareFeetToSquareMeters(double areaSqFt) {
        return areaSqFt / SQ_FEET_PER_SQ_METER;
    }

    /** Footprint area corrected for pitch. */
    public static double adjustedArea(double footprintAreaSqFt, double pitchDegrees) {
        return footprintAreaSqFt * pitchMultiplierFromDegrees(pitchDegrees);
    }

    public static PitchCategory categorize(double degrees) {
        validateDegrees(degrees);
        if (degrees <= FLAT_MAX) {
            return PitchCategory.FLAT;
        } else if (degrees <= LOW_SLOPE_MAX) {
            return PitchCategory.LOW_SLOPE;
        } else if (degrees <= MEDIUM_SLOPE_MAX) {
            return PitchCategory.MEDIUM_SLOPE;
        } else if (degrees <= STEEP_SLOPE_MAX) {
            return PitchCategory.STEEP_SLOPE;
        }
        return PitchCategory.VERY_STEEP;
    }

    /**
     * Area-weighted average pitch across roof segments.
     *
     * <p>Formula: θ_avg = Σ(θ_i × A_i) / Σ(A_i)
     *
     * @return weighted average in degrees, 0 when the segments carry no area
     */
    public static double weightedAveragePitch(Collection<RoofSegment> segments) {
        if (segments == null || segments.isEmpty()) {
            return 0.0;
        }
        double totalArea = 0.0;
        double weightedSum = 0.0;
        for (RoofSegment segment : segments) {
            totalArea += segment.areaSqM();
            weightedSum += segment.pitchDegrees() * segment.areaSqM();
        }
        return totalArea > 0 ? weightedSum / totalArea : 0.0;
    }

    private static void validateDegrees(double degrees) {
        if (!Double.isFinite(degrees) || degrees < 0 || degrees >= MAX_PITCH_DEGREES) {
            throw new IllegalArgumentException(
                "Pitch must be between 0 (inclusive) and 90 (exclusive) degrees: " + degrees);
        }
    }

    private static Map<String, Double> buildStandardPitchTable() {
        Map<String, Double> table = new LinkedHashMap<>();
        for (int rise = 0; rise <= 18; rise++) {
            table.put(rise + ":12", Math.round(pitchMultiplierFromRatio(rise) * 1000.0) / 1000.0);
        }
        return Collections.unmodifiableMap(table);
    }

    /** One planar roof face as reported by imagery providers. */
    public record RoofSegment(double pitchDegrees, double areaSqM) {}

    /** Coarse pitch classification. */
    public enum PitchCategory {
        FLAT("Flat"),
        LOW_SLOPE("Low Slope"),
        MEDIUM_SLOPE("Medium Slope"),
        STEEP_SLOPE("Steep Slope"),
        VERY_STEEP("Very Steep");

        private final String label;

        PitchCategory(String label) {
            this.label = label;
        }

        public String getLabel() {
            return label;
        }
    }
}
