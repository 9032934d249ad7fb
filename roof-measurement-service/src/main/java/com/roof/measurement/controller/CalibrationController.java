package com.roof.measurement.controller;

import com.roof.measurement.dto.CalibrationSummary;
import com.roof.measurement.dto.RegionalCalibration;
import com.roof.measurement.service.GafReportService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/calibration")
@RequiredArgsConstructor
@Tag(name = "Calibration", description = "Calibration derived from verified GAF reports")
public class CalibrationController {

    private final GafReportService gafReportService;

    @Operation(summary = "Calibration at a location",
        description = "Returns the applicable calibration and, when a candidate area is given, the calibrated area")
    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<CalibrationSummary> getCalibration(
            @RequestParam double lat,
            @RequestParam double lng,
            @RequestParam(required = false) Double candidateArea,
            @RequestParam(required = false) String address) {
        return ResponseEntity.ok(gafReportService.summarize(lat, lng, address, candidateArea));
    }

    @Operation(summary = "Regional calibration buckets")
    @GetMapping(value = "/regions", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<RegionalCalibration>> getRegions() {
        return ResponseEntity.ok(gafReportService.getRegionalCalibrations());
    }
}
