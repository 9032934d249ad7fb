package com.roof.measurement.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public record CrossValidationRequest(
        @NotEmpty(message = "At least one candidate is required")
        List<@NotNull(message = "Candidate must not be null") @Valid MeasurementResult> candidates,
        GafCalibrationResult calibration) {}
