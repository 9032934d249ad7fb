package com.roof.measurement.controller;

import com.roof.measurement.dto.GafComparison;
import com.roof.measurement.dto.GafReport;
import com.roof.measurement.dto.GafReportRequest;
import com.roof.measurement.service.GafReportService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for verified GAF measurement reports.
 */
@Slf4j
@RestController
@RequestMapping("/api/gaf-reports")
@RequiredArgsConstructor
@Tag(name = "GAF Reports", description = "Upload and look up verified measurement reports")
public class GafReportController {

    private final GafReportService gafReportService;

    @Operation(summary = "Upload a GAF report",
        description = "Stores a verified report and refreshes the calibration of its region")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "201", description = "Report stored"),
        @ApiResponse(responseCode = "400", description = "Invalid report"),
        @ApiResponse(responseCode = "500", description = "Report could not be stored")
    })
    @PostMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<GafReport> createReport(@RequestBody GafReportRequest request) {
        log.info("Received GAF report upload for user {}", request.userId());
        return ResponseEntity.status(HttpStatus.CREATED).body(gafReportService.createReport(request));
    }

    @Operation(summary = "Get a GAF report")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Report found"),
        @ApiResponse(responseCode = "404", description = "Unknown report id")
    })
    @GetMapping(value = "/{reportId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<GafReport> getReport(@PathVariable String reportId) {
        return ResponseEntity.ok(gafReportService.getReport(reportId));
    }

    @Operation(summary = "List a user's GAF reports")
    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<GafReport>> getReportsForUser(@RequestParam String userId) {
        return ResponseEntity.ok(gafReportService.getReportsForUser(userId));
    }

    @Operation(summary = "Compare a calculated area with a GAF report")
    @GetMapping(value = "/{reportId}/comparison", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<GafComparison> compare(
            @PathVariable String reportId,
            @RequestParam double calculatedArea) {
        return ResponseEntity.ok(gafReportService.compare(reportId, calculatedArea));
    }
}
