package com.roof.measurement.dto;

import java.time.LocalDate;

/**
 * Roof measurement as returned by the LiDAR provider.
 *
 * @param footprintAreaSqFt horizontal roof area
 * @param pitchDegrees predominant pitch
 * @param segmentCount roof faces detected
 * @param captureDate LiDAR capture date, null when not reported
 */
public record LidarMeasurement(double footprintAreaSqFt, double pitchDegrees, int segmentCount, LocalDate captureDate) {}
