package com.roof.measurement.dto;

/**
 * Calculated roof area compared with a verified report.
 *
 * @param differencePercent (calculated − verified) / verified, in percent
 * @param calibratedAreaSqFt calculated area after regional calibration, null when none applies
 */
public record GafComparison(
        String reportId,
        double calculatedAreaSqFt,
        double verifiedAreaSqFt,
        double differenceSqFt,
        double differencePercent,
        Double calibratedAreaSqFt) {}
