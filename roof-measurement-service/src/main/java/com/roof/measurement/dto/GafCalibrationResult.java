package com.roof.measurement.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Calibration derived from verified field reports.
 *
 * @param calibrationFactor verified area / estimated area, 1.0 means no adjustment
 * @param basedOnReports number of reports that contributed
 * @param lastCalibrated newest contributing report or bucket update
 * @param exactMatch whether a report for this exact building was found
 * @param regionCode 0.1° bucket of the location
 * @param referenceAreaSqFt verified roof area of the exactly matching report, null otherwise
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GafCalibrationResult(
        double calibrationFactor,
        int basedOnReports,
        Instant lastCalibrated,
        boolean exactMatch,
        String regionCode,
        Double referenceAreaSqFt) {}
