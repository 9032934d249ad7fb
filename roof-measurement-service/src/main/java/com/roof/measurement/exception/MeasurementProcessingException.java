package com.roof.measurement.exception;

/**
 * Internal failure while processing a measurement or report, e.g. the calibration store is
 * unreachable during report ingestion.
 */
public class MeasurementProcessingException extends RuntimeException {

    public MeasurementProcessingException(String message) {
        super(message);
    }

    public MeasurementProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
