package com.roof.measurement.controller;

import com.roof.measurement.config.MeasurementProperties;
import com.roof.measurement.dto.ConfidenceResult;
import com.roof.measurement.dto.ConfidenceSignals;
import com.roof.measurement.dto.CrossValidationRequest;
import com.roof.measurement.dto.CrossValidationResult;
import com.roof.measurement.dto.ManualMeasurementRequest;
import com.roof.measurement.dto.MeasurementReport;
import com.roof.measurement.dto.ProviderCredentials;
import com.roof.measurement.service.MeasurementResolutionEngine;
import com.roof.measurement.service.RoofMeasurementService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for roof measurements.
 *
 * <p>Provider API keys are read from configuration here and passed into the engine explicitly.
 */
@Slf4j
@RestController
@RequestMapping("/api/measurements")
@Validated
@RequiredArgsConstructor
@Tag(name = "Roof Measurements", description = "Tiered roof area and pitch measurement")
public class MeasurementController {

    private final RoofMeasurementService roofMeasurementService;
    private final MeasurementResolutionEngine engine;
    private final MeasurementProperties properties;

    @Operation(summary = "Measure a roof",
        description = "Walks the measurement tiers from most to least accurate and reports the first that succeeds")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Measurement report, possibly requiring manual tracing"),
        @ApiResponse(responseCode = "400", description = "Invalid coordinates")
    })
    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<MeasurementReport> measure(
            @RequestParam double lat,
            @RequestParam double lng,
            @RequestParam(required = false) String address) {
        return ResponseEntity.ok(roofMeasurementService.measure(lat, lng, address, credentials()));
    }

    @Operation(summary = "Measure from all sources",
        description = "Queries every automated source concurrently and cross-validates the results")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Cross-validated measurement report"),
        @ApiResponse(responseCode = "400", description = "Invalid coordinates"),
        @ApiResponse(responseCode = "503", description = "Parallel measurement capacity exhausted")
    })
    @GetMapping(value = "/all-sources", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<MeasurementReport> measureAllSources(
            @RequestParam double lat,
            @RequestParam double lng,
            @RequestParam(required = false) String address) {
        return ResponseEntity.ok(roofMeasurementService.measureAllSources(lat, lng, address, credentials()));
    }

    @Operation(summary = "Manual measurement", description = "Builds a report from a user-traced roof area")
    @PostMapping(value = "/manual", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<MeasurementReport> measureManual(@Valid @RequestBody ManualMeasurementRequest request) {
        return ResponseEntity.ok(roofMeasurementService.measureManual(request));
    }

    @Operation(summary = "Score confidence", description = "Scores a set of measurement quality signals")
    @PostMapping(value = "/confidence", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ConfidenceResult> scoreConfidence(@Valid @RequestBody ConfidenceSignals signals) {
        return ResponseEntity.ok(engine.scoreConfidence(signals));
    }

    @Operation(summary = "Cross-validate candidates",
        description = "Compares candidate measurements and selects the final one")
    @PostMapping(value = "/cross-validation", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<CrossValidationResult> crossValidate(@Valid @RequestBody CrossValidationRequest request) {
        return ResponseEntity.ok(engine.crossValidate(request.candidates(), request.calibration()));
    }

    private ProviderCredentials credentials() {
        MeasurementProperties.Providers providers = properties.getProviders();
        return new ProviderCredentials(providers.getLidar().getApiKey(), providers.getSolar().getApiKey());
    }
}
