package com.roof.measurement.dto;

import java.time.LocalDate;

/**
 * A verified GAF measurement report submitted by a user.
 *
 * @param totalSquares verified roof squares
 * @param estimatedAreaSqFt this service's estimate for the same building, when known; enables
 *     the report to calibrate future estimates
 */
public record GafReportRequest(
        String userId,
        String address,
        Double lat,
        Double lng,
        Double totalSquares,
        String pitchInfo,
        Integer facetCount,
        Double wasteFactor,
        LocalDate reportDate,
        String pdfUrl,
        Double estimatedAreaSqFt) {}
