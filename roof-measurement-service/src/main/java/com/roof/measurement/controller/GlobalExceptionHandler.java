package com.roof.measurement.controller;

import com.roof.measurement.exception.MeasurementProcessingException;
import com.roof.measurement.exception.ParallelMeasurementUnavailableException;
import com.roof.measurement.exception.ReportNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Global exception handler for the measurement service.
 * Provides consistent error responses and logging.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    private static final String TIMESTAMP = "timestamp";
    private static final String STATUS = "status";
    private static final String ERROR = "error";
    private static final String MESSAGE = "message";

    /**
     * Handles validation errors from @Valid annotations.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidationErrors(MethodArgumentNotValidException ex) {
        Map<String, String> fieldErrors = new HashMap<>();
        ex.getBindingResult().getAllErrors().forEach(error -> {
            String fieldName = error instanceof FieldError fieldError ? fieldError.getField() : error.getObjectName();
            fieldErrors.put(fieldName, error.getDefaultMessage());
        });

        Map<String, Object> errorResponse = body(HttpStatus.BAD_REQUEST, "Validation Failed", "Request validation failed");
        errorResponse.put("fieldErrors", fieldErrors);

        log.warn("Validation error: {}", fieldErrors);
        return ResponseEntity.badRequest().body(errorResponse);
    }

    /**
     * Handles missing, mistyped and unreadable request input.
     */
    @ExceptionHandler({
        MissingServletRequestParameterException.class,
        MethodArgumentTypeMismatchException.class,
        HttpMessageNotReadableException.class
    })
    public ResponseEntity<Map<String, Object>> handleMalformedRequest(Exception ex) {
        String message = ex instanceof HttpMessageNotReadableException
            ? "Malformed request body"
            : ex.getMessage();
        log.warn("Malformed request: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(body(HttpStatus.BAD_REQUEST, "Bad Request", message));
    }

    /**
     * Handles illegal argument exceptions (business validation errors).
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgumentException(IllegalArgumentException ex) {
        log.warn("Business validation error: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(body(HttpStatus.BAD_REQUEST, "Bad Request", ex.getMessage()));
    }

    @ExceptionHandler(ReportNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleReportNotFoundException(ReportNotFoundException ex) {
        log.info("{}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(body(HttpStatus.NOT_FOUND, "Not Found", ex.getMessage()));
    }

    /**
     * Handles parallel measurement rejections (queue full, service overloaded).
     */
    @ExceptionHandler(ParallelMeasurementUnavailableException.class)
    public ResponseEntity<Map<String, Object>> handleParallelMeasurementUnavailableException(
            ParallelMeasurementUnavailableException ex) {
        Map<String, Object> errorResponse = body(HttpStatus.SERVICE_UNAVAILABLE, "Service Unavailable", ex.getMessage());
        errorResponse.put("suggestedAction", "Try again later or use the tiered measurement endpoint");

        log.warn("Parallel measurement unavailable: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(errorResponse);
    }

    /**
     * Handles measurement processing exceptions (internal processing errors).
     */
    @ExceptionHandler(MeasurementProcessingException.class)
    public ResponseEntity<Map<String, Object>> handleMeasurementProcessingException(MeasurementProcessingException ex) {
        log.error("Measurement processing error: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(body(HttpStatus.INTERNAL_SERVER_ERROR, "Measurement Processing Error", ex.getMessage()));
    }

    /**
     * Handles all other unexpected exceptions.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        log.error("Unexpected error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(body(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "An unexpected error occurred"));
    }

    private static Map<String, Object> body(HttpStatus status, String error, String message) {
        Map<String, Object> errorResponse = new HashMap<>();
        errorResponse.put(TIMESTAMP, Instant.now());
        errorResponse.put(STATUS, status.value());
        errorResponse.put(ERROR, error);
        errorResponse.put(MESSAGE, message);
        return errorResponse;
    }
}
