package com.roof.measurement.dto;

/**
 * A pair of candidates whose adjusted areas differ by more than the discrepancy threshold.
 *
 * @param differencePercent |a − b| relative to the pair mean, in percent
 */
public record Discrepancy(
        MeasurementSource firstSource,
        double firstAreaSqFt,
        MeasurementSource secondSource,
        double secondAreaSqFt,
        double differencePercent) {}
