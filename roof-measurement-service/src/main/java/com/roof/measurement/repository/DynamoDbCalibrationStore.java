package com.roof.measurement.repository;

import com.roof.measurement.algorithm.util.GeoMath;
import com.roof.measurement.dto.GafReport;
import com.roof.measurement.dto.RegionalCalibration;
import com.roof.measurement.exception.MeasurementProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbIndex;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.model.DescribeTableEnhancedResponse;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryConditional;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryEnhancedRequest;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * DynamoDB implementation of {@link CalibrationStore}.
 *
 * <p>Reports are indexed by region bucket, normalized address and user. Proximity queries
 * enumerate the 0.1° buckets covering the search circle and filter by great-circle distance.
 */
@Repository
@Profile("!test")
public class DynamoDbCalibrationStore implements CalibrationStore {

    // === HEALTH CHECK CONSTANTS ===

    /** Describe-table latency above which the store is reported unhealthy. */
    private static final long LATENCY_THRESHOLD_MS = 1_000L;

    private static final long NANOS_TO_MILLIS = 1_000_000L;

    private static final String HEALTHY_STATUS_MESSAGE = "Table is accessible and healthy";

    private static final String SLOW_RESPONSE_STATUS_MESSAGE = "Table response time exceeds threshold";

    private static final Logger logger = LoggerFactory.getLogger(DynamoDbCalibrationStore.class);

    private final DynamoDbTable<GafReport> reportTable;
    private final DynamoDbTable<RegionalCalibration> calibrationTable;
    private final String reportTableName;

    public DynamoDbCalibrationStore(DynamoDbTable<GafReport> reportTable,
            DynamoDbTable<RegionalCalibration> calibrationTable) {
        this.reportTable = reportTable;
        this.calibrationTable = calibrationTable;
        this.reportTableName = reportTable.tableName();
        logger.info("Initialized calibration store with tables: {}, {}", reportTableName, calibrationTable.tableName());
    }

    // === PUBLIC API LAYER ===

    @Override
    public Optional<GafReport> findExactReport(String normalizedAddress, double lat, double lng,
            double toleranceMiles) {
        if (normalizedAddress == null || normalizedAddress.isBlank()) {
            return Optional.empty();
        }
        try {
            return queryIndex(GafReport.ADDRESS_INDEX, normalizedAddress).stream()
                .filter(report -> hasLocation(report))
                .filter(report -> distanceTo(report, lat, lng) <= toleranceMiles)
                .min(Comparator.comparingDouble(report -> distanceTo(report, lat, lng)));
        } catch (DynamoDbException e) {
            logger.error("Error finding exact report for address: {}", normalizedAddress, e);
            throw new MeasurementProcessingException("Failed to look up exact report", e);
        }
    }

    @Override
    public Optional<RegionalCalibration> findRegionalCalibration(double lat, double lng) {
        String regionCode = GeoMath.regionCode(lat, lng);
        try {
            return Optional.ofNullable(calibrationTable.getItem(Key.builder().partitionValue(regionCode).build()));
        } catch (DynamoDbException e) {
            logger.error("Error reading regional calibration for region: {}", regionCode, e);
            throw new MeasurementProcessingException("Failed to read regional calibration", e);
        }
    }

    @Override
    public List<GafReport> findNearby(double lat, double lng, double radiusMiles) {
        List<String> regions = GeoMath.coveringRegionCodes(lat, lng, radiusMiles);
        logger.debug("Searching {} region bucket(s) within {} miles of ({}, {})", regions.size(), radiusMiles, lat, lng);
        try {
            return regions.stream()
                .flatMap(region -> queryIndex(GafReport.REGION_INDEX, region).stream())
                .filter(report -> hasLocation(report))
                .filter(report -> distanceTo(report, lat, lng) <= radiusMiles)
                .sorted(Comparator.comparingDouble(report -> distanceTo(report, lat, lng)))
                .toList();
        } catch (DynamoDbException e) {
            logger.error("Error finding reports near ({}, {})", lat, lng, e);
            throw new MeasurementProcessingException("Failed to find nearby reports", e);
        }
    }

    @Override
    public List<GafReport> findReportsInRegion(String regionCode) {
        try {
            return queryIndex(GafReport.REGION_INDEX, regionCode);
        } catch (DynamoDbException e) {
            logger.error("Error reading reports for region: {}", regionCode, e);
            throw new MeasurementProcessingException("Failed to read region reports", e);
        }
    }

    @Override
    public Optional<GafReport> findReportById(String reportId) {
        try {
            return Optional.ofNullable(reportTable.getItem(Key.builder().partitionValue(reportId).build()));
        } catch (DynamoDbException e) {
            logger.error("Error reading report: {}", reportId, e);
            throw new MeasurementProcessingException("Failed to read report", e);
        }
    }

    @Override
    public List<GafReport> findReportsByUser(String userId) {
        try {
            return queryIndex(GafReport.USER_INDEX, userId).stream()
                .sorted(Comparator.comparing(GafReport::getUploadedAt,
                    Comparator.nullsLast(Comparator.reverseOrder())))
                .toList();
        } catch (DynamoDbException e) {
            logger.error("Error reading reports for user: {}", userId, e);
            throw new MeasurementProcessingException("Failed to read user reports", e);
        }
    }

    @Override
    public List<RegionalCalibration> findAllRegionalCalibrations() {
        try {
            return calibrationTable.scan().items().stream().toList();
        } catch (DynamoDbException e) {
            logger.error("Error scanning regional calibrations", e);
            throw new MeasurementProcessingException("Failed to list regional calibrations", e);
        }
    }

    @Override
    public void saveReport(GafReport report) {
        try {
            reportTable.putItem(report);
            logger.debug("Saved report {} in region {}", report.getReportId(), report.getRegionCode());
        } catch (DynamoDbException e) {
            logger.error("Error saving report: {}", report.getReportId(), e);
            throw new MeasurementProcessingException("Failed to save report", e);
        }
    }

    @Override
    public void saveRegionalCalibration(RegionalCalibration calibration) {
        try {
            calibrationTable.putItem(calibration);
            logger.debug("Saved regional calibration {} (factor {}, samples {})",
                calibration.getRegionCode(), calibration.getCalibrationFactor(), calibration.getSampleCount());
        } catch (DynamoDbException e) {
            logger.error("Error saving regional calibration: {}", calibration.getRegionCode(), e);
            throw new MeasurementProcessingException("Failed to save regional calibration", e);
        }
    }

    @Override
    public HealthCheckResult validateTableHealth() {
        logger.debug("Starting table health validation for: {}", reportTableName);
        long startTime = System.nanoTime();

        try {
            DescribeTableEnhancedResponse response = reportTable.describeTable();
            long itemCount = response.table().itemCount() != null ? response.table().itemCount() : 0L;

            long responseTimeMs = (System.nanoTime() - startTime) / NANOS_TO_MILLIS;
            boolean isHealthy = responseTimeMs < LATENCY_THRESHOLD_MS;
            String statusMessage = isHealthy ? HEALTHY_STATUS_MESSAGE : SLOW_RESPONSE_STATUS_MESSAGE;

            logger.debug("Table health check completed - Table: {}, Response time: {}ms, Healthy: {}",
                reportTableName, responseTimeMs, isHealthy);

            return new HealthCheckResult(isHealthy, responseTimeMs, reportTableName, itemCount, statusMessage);
        } catch (ResourceNotFoundException e) {
            logger.warn("Table not found during health check: {}", reportTableName);
            throw e;
        } catch (DynamoDbException e) {
            logger.error("DynamoDB error during health check: {}", e.getMessage());
            throw e;
        }
    }

    // === IMPLEMENTATION LAYER ===

    private List<GafReport> queryIndex(String indexName, String partitionValue) {
        DynamoDbIndex<GafReport> index = reportTable.index(indexName);
        QueryEnhancedRequest request = QueryEnhancedRequest.builder()
            .queryConditional(QueryConditional.keyEqualTo(Key.builder().partitionValue(partitionValue).build()))
            .build();
        return index.query(request).stream()
            .flatMap(page -> page.items().stream())
            .toList();
    }

    // === UTILITY LAYER ===

    private static boolean hasLocation(GafReport report) {
        return report.getLatitude() != null && report.getLongitude() != null;
    }

    private static double distanceTo(GafReport report, double lat, double lng) {
        return GeoMath.distanceMiles(lat, lng, report.getLatitude(), report.getLongitude());
    }
}
