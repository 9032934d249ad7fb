package com.roof.measurement.exception;

/**
 * Thrown when the all-sources mode cannot accept more work.
 */
public class ParallelMeasurementUnavailableException extends RuntimeException {

    public ParallelMeasurementUnavailableException(String message) {
        super(message);
    }

    public ParallelMeasurementUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
