package com.roof.measurement.algorithm.util;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the free-text pitch field of field reports: "6:12", "6/12", "26.5 degrees", "26.5°" or a
 * bare number of degrees.
 */
public final class PitchInfoParser {

    private static final Pattern RATIO = Pattern.compile("(\\d+(?:\\.\\d+)?)\\s*[:/]\\s*12");
    private static final Pattern DEGREES = Pattern.compile("(\\d+(?:\\.\\d+)?)\\s*(?:degrees?|°)",
        Pattern.CASE_INSENSITIVE);
    private static final Pattern PLAIN = Pattern.compile("^\\s*(\\d+(?:\\.\\d+)?)");

    private PitchInfoParser() {}

    /**
     * @return pitch in degrees, empty when the text is blank, unparseable or not a valid roof pitch
     */
    public static Optional<Double> parseDegrees(String pitchInfo) {
        if (pitchInfo == null || pitchInfo.isBlank()) {
            return Optional.empty();
        }

        Matcher ratio = RATIO.matcher(pitchInfo);
        if (ratio.find()) {
            return Optional.of(PitchCalculator.ratioToDegrees(Double.parseDouble(ratio.group(1))));
        }

        Matcher degrees = DEGREES.matcher(pitchInfo);
        if (degrees.find()) {
            return validPitch(Double.parseDouble(degrees.group(1)));
        }

        Matcher plain = PLAIN.matcher(pitchInfo);
        if (plain.find()) {
            return validPitch(Double.parseDouble(plain.group(1)));
        }
        return Optional.empty();
    }

    private static Optional<Double> validPitch(double degrees) {
        return degrees < 90.0 ? Optional.of(degrees) : Optional.empty();
    }
}
