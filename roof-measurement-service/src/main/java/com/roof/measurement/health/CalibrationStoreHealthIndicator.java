package com.roof.measurement.health;

import java.time.Instant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import com.roof.measurement.repository.CalibrationStore;

import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;

/**
 * Readiness of the calibration store holding verified GAF reports.
 *
 * <p>Returns UP when the store reports a healthy, responsive table; DOWN when the table is slow,
 * missing or unreachable; OUT_OF_SERVICE for unexpected errors.
 *
 * <p>Measurement requests still succeed while the store is down (calibration is simply skipped),
 * but GAF report uploads fail.
 */
@Component("calibrationStoreReadiness")
public class CalibrationStoreHealthIndicator implements HealthIndicator {

  private static final Logger logger =
      LoggerFactory.getLogger(CalibrationStoreHealthIndicator.class);

  // Database Information Constants
  private static final String DATABASE_TYPE = "DynamoDB";

  // Health Status Messages
  private static final String STORE_ACCESSIBLE_MESSAGE = "Calibration store is accessible";
  private static final String STORE_NOT_ACCESSIBLE_MESSAGE = "Calibration store is not accessible";
  private static final String TABLE_NOT_FOUND_MESSAGE = "Calibration table not found";
  private static final String STORE_NOT_CONFIGURED_MESSAGE = "Calibration store not configured";
  private static final String UNEXPECTED_ERROR_MESSAGE = "Unexpected error during health check";

  // Health Check Detail Keys
  static final String STATUS_KEY = "status";
  static final String DATABASE_KEY = "database";
  static final String TABLE_NAME_KEY = "tableName";
  static final String LAST_CHECKED_KEY = "lastChecked";
  static final String RESPONSE_TIME_KEY = "responseTimeMs";
  static final String ITEM_COUNT_KEY = "itemCount";
  static final String ERROR_KEY = "error";

  private static final long NANOS_TO_MILLIS = 1_000_000L;

  private final CalibrationStore calibrationStore;

  public CalibrationStoreHealthIndicator(CalibrationStore calibrationStore) {
    this.calibrationStore = calibrationStore;
  }

  @Override
  public Health health() {
    Instant lastChecked = Instant.now();

    if (calibrationStore == null) {
      logger.error("CalibrationStore is null");
      return Health.down()
          .withDetail(STATUS_KEY, STORE_NOT_CONFIGURED_MESSAGE)
          .withDetail(DATABASE_KEY, DATABASE_TYPE)
          .withDetail(LAST_CHECKED_KEY, lastChecked)
          .build();
    }

    long startTime = System.nanoTime();

    try {
      CalibrationStore.HealthCheckResult result = calibrationStore.validateTableHealth();

      Health.Builder builder = result.isHealthy() ? Health.up() : Health.down();
      if (result.isHealthy()) {
        logger.debug(
            "Calibration store healthy - Table: {}, Response time: {}ms, Item count: {}",
            result.tableName(),
            result.responseTimeMs(),
            result.itemCount());
      } else {
        logger.warn(
            "Calibration store responding slowly - Table: {}, Response time: {}ms, Status: {}",
            result.tableName(),
            result.responseTimeMs(),
            result.statusMessage());
      }

      return builder
          .withDetail(
              STATUS_KEY, result.isHealthy() ? STORE_ACCESSIBLE_MESSAGE : result.statusMessage())
          .withDetail(DATABASE_KEY, DATABASE_TYPE)
          .withDetail(TABLE_NAME_KEY, result.tableName())
          .withDetail(LAST_CHECKED_KEY, lastChecked)
          .withDetail(RESPONSE_TIME_KEY, result.responseTimeMs())
          .withDetail(ITEM_COUNT_KEY, result.itemCount())
          .build();

    } catch (ResourceNotFoundException e) {
      long responseTimeMs = elapsedMs(startTime);
      logger.warn("Calibration table not found (response time: {}ms)", responseTimeMs);
      return failure(Health.down(), TABLE_NOT_FOUND_MESSAGE, lastChecked, responseTimeMs, e);

    } catch (DynamoDbException e) {
      long responseTimeMs = elapsedMs(startTime);
      logger.error(
          "Calibration store connection error (response time: {}ms)", responseTimeMs, e);
      return failure(Health.down(), STORE_NOT_ACCESSIBLE_MESSAGE, lastChecked, responseTimeMs, e);

    } catch (Exception e) {
      long responseTimeMs = elapsedMs(startTime);
      logger.error(
          "Unexpected error during calibration store health check (response time: {}ms)",
          responseTimeMs,
          e);
      return failure(
          Health.outOfService(), UNEXPECTED_ERROR_MESSAGE, lastChecked, responseTimeMs, e);
    }
  }

  private static Health failure(
      Health.Builder builder, String status, Instant lastChecked, long responseTimeMs, Exception e) {
    return builder
        .withDetail(STATUS_KEY, status)
        .withDetail(DATABASE_KEY, DATABASE_TYPE)
        .withDetail(LAST_CHECKED_KEY, lastChecked)
        .withDetail(RESPONSE_TIME_KEY, responseTimeMs)
        .withDetail(ERROR_KEY, String.valueOf(e.getMessage()))
        .build();
  }

  private static long elapsedMs(long startTime) {
    return (System.nanoTime() - startTime) / NANOS_TO_MILLIS;
  }
}
