package com.roof.measurement.repository;

import com.roof.measurement.dto.GafReport;
import com.roof.measurement.dto.RegionalCalibration;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;

import java.util.List;
import java.util.Optional;

/**
 * Store of verified field reports and the regional calibration buckets derived from them.
 */
public interface CalibrationStore {

    /**
     * Find a report for the same building: same normalized address and within
     * {@code toleranceMiles} of the point. The closest such report wins.
     */
    Optional<GafReport> findExactReport(String normalizedAddress, double lat, double lng, double toleranceMiles);

    /**
     * Find the calibration bucket covering a point.
     */
    Optional<RegionalCalibration> findRegionalCalibration(double lat, double lng);

    /**
     * Reports within {@code radiusMiles} of a point, nearest first.
     */
    List<GafReport> findNearby(double lat, double lng, double radiusMiles);

    /**
     * All reports stored in one region bucket.
     */
    List<GafReport> findReportsInRegion(String regionCode);

    Optional<GafReport> findReportById(String reportId);

    List<GafReport> findReportsByUser(String userId);

    List<RegionalCalibration> findAllRegionalCalibrations();

    void saveReport(GafReport report);

    void saveRegionalCalibration(RegionalCalibration calibration);

    /**
     * Validates table accessibility and measures response time for health checks.
     *
     * @throws ResourceNotFoundException if a table does not exist
     * @throws DynamoDbException if there are connectivity or permission issues
     */
    HealthCheckResult validateTableHealth();

    /**
     * Result object for health check operations containing metrics and validation results.
     */
    record HealthCheckResult(
            boolean isHealthy,
            long responseTimeMs,
            String tableName,
            long itemCount,
            String statusMessage
    ) {}
}
