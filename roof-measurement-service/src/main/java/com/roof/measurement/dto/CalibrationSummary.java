package com.roof.measurement.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Calibration available at a location.
 *
 * @param calibration applicable calibration, null when none
 * @param nearbyReportCount verified reports within the regional radius
 * @param calibratedAreaSqFt candidate area after calibration, null without a candidate or calibration
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CalibrationSummary(
        double latitude,
        double longitude,
        String regionCode,
        GafCalibrationResult calibration,
        int nearbyReportCount,
        Double calibratedAreaSqFt) {}
