package com.roof.measurement.algorithm.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Pitch Calculator Tests")
class PitchCalculatorTest {

    private static final double DELTA = 0.001;

    @Nested
    @DisplayName("Pitch multiplier")
    class PitchMultiplierTests {

        @Test
        @DisplayName("Flat roof has multiplier exactly 1.0")
        void flatRoofIsExactlyOne() {
            assertEquals(1.0, PitchCalculator.pitchMultiplierFromDegrees(0.0));
        }

        @ParameterizedTest
        @CsvSource({
            "18.43, 1.054",
            "26.57, 1.118",
            "45.0, 1.414",
            "30.0, 1.155"
        })
        @DisplayName("Known pitches map to known multipliers")
        void knownPitches(double degrees, double expected) {
            assertEquals(expected, PitchCalculator.pitchMultiplierFromDegrees(degrees), DELTA);
        }

        @Test
        @DisplayName("Multiplier is strictly increasing")
        void strictlyIncreasing() {
            double previous = PitchCalculator.pitchMultiplierFromDegrees(0.0);
            for (double degrees = 0.5; degrees < 89.0; degrees += 0.5) {
                double current = PitchCalculator.pitchMultiplierFromDegrees(degrees);
                assertTrue(current > previous, "Multiplier should grow at " + degrees);
                previous = current;
            }
        }

        @ParameterizedTest
        @ValueSource(doubles = {-1.0, 90.0, 120.0, Double.NaN, Double.POSITIVE_INFINITY})
        @DisplayName("Out-of-range pitch is rejected")
        void invalidPitchRejected(double degrees) {
            assertThrows(IllegalArgumentException.class, () -> PitchCalculator.pitchMultiplierFromDegrees(degrees));
        }

        @Test
        @DisplayName("Ratio and degree forms agree")
        void ratioMatchesDegrees() {
            double degrees = PitchCalculator.ratioToDegrees(6.0);
            assertEquals(26.565, degrees, DELTA);
            assertEquals(PitchCalculator.pitchMultiplierFromRatio(6.0),
                PitchCalculator.pitchMultiplierFromDegrees(degrees), 1e-9);
            assertEquals(6.0, PitchCalculator.degreesToRatio(degrees), 1e-9);
        }
    }

    @Nested
    @DisplayName("Standard pitches")
    class StandardPitchTests {

        @Test
        void tableCoversZeroThroughEighteen() {
            Map<String, Double> table = PitchCalculator.standardPitchMultipliers();
            assertEquals(19, table.size());
            assertEquals(1.0, table.get("0:12"));
            assertEquals(1.118, table.get("6:12"));
            assertEquals(1.414, table.get("12:12"));
            assertThrows(UnsupportedOperationException.class, () -> table.put("19:12", 2.0));
        }

        @Test
        void nearestStandardPitch() {
            assertEquals("0:12", PitchCalculator.nearestStandardPitch(0.0));
            assertEquals("6:12", PitchCalculator.nearestStandardPitch(26.0));
            assertEquals("12:12", PitchCalculator.nearestStandardPitch(45.0));
            assertEquals("18:12", PitchCalculator.nearestStandardPitch(80.0));
        }
    }

    @Nested
    @DisplayName("Area conversions")
    class AreaTests {

        @Test
        void squaresAreExactHundredths() {
            assertEquals(18.5, PitchCalculator.areaToSquares(1850.0));
            assertEquals(12.35, PitchCalculator.roundSquares(PitchCalculator.areaToSquares(1234.567)));
        }

        @Test
        void squareMetersRoundTrip() {
            assertEquals(107.639, PitchCalculator.squareMetersToSquareFeet(10.0), DELTA);
            assertEquals(10.0, PitchCalculator.squareFeetToSquareMeters(107.639), DELTA);
        }

        @Test
        void adjustedAreaAppliesMultiplier() {
            assertEquals(1500.0 * 1.1547, PitchCalculator.adjustedArea(1500.0, 30.0), 0.1);
        }
    }

    @Nested
    @DisplayName("Categories and averages")
    class CategoryTests {

        @ParameterizedTest
        @CsvSource({
            "0, FLAT",
            "5, FLAT",
            "10, LOW_SLOPE",
            "18.5, LOW_SLOPE",
            "26.6, MEDIUM_SLOPE",
            "40, STEEP_SLOPE",
            "60, VERY_STEEP"
        })
        void categorize(double degrees, PitchCalculator.PitchCategory expected) {
            assertEquals(expected, PitchCalculator.categorize(degrees));
        }

        @Test
        void weightedAveragePitchUsesArea() {
            List<PitchCalculator.RoofSegment> segments = List.of(
                new PitchCalculator.RoofSegment(20.0, 100.0),
                new PitchCalculator.RoofSegment(40.0, 300.0));

            assertEquals(35.0, PitchCalculator.weightedAveragePitch(segments), DELTA);
        }

        @Test
        void weightedAveragePitchOfNothingIsZero() {
            assertEquals(0.0, PitchCalculator.weightedAveragePitch(List.of()));
            assertEquals(0.0, PitchCalculator.weightedAveragePitch(
                List.of(new PitchCalculator.RoofSegment(30.0, 0.0))));
        }
    }
}
