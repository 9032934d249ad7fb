package com.roof.measurement.service;

import com.roof.measurement.algorithm.calibration.CalibrationEngine;
import com.roof.measurement.algorithm.util.GeoMath;
import com.roof.measurement.algorithm.util.PitchCalculator;
import com.roof.measurement.algorithm.util.PitchInfoParser;
import com.roof.measurement.config.MeasurementProperties;
import com.roof.measurement.dto.CalibrationSummary;
import com.roof.measurement.dto.GafCalibrationResult;
import com.roof.measurement.dto.GafComparison;
import com.roof.measurement.dto.GafReport;
import com.roof.measurement.dto.GafReportRequest;
import com.roof.measurement.dto.RegionalCalibration;
import com.roof.measurement.exception.MeasurementProcessingException;
import com.roof.measurement.exception.ReportNotFoundException;
import com.roof.measurement.repository.CalibrationStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Ingests verified GAF reports and keeps the regional calibration buckets current.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GafReportService {

    private final CalibrationStore calibrationStore;
    private final CalibrationEngine calibrationEngine;
    private final MeasurementProperties properties;
    private final Clock clock;

    /**
     * Validates and stores a report, then rebuilds the calibration bucket of its region.
     *
     * @throws IllegalArgumentException listing every validation error
     * @throws MeasurementProcessingException when the store cannot be written
     */
    public GafReport createReport(GafReportRequest request) {
        List<String> errors = validate(request);
        if (!errors.isEmpty()) {
            throw new IllegalArgumentException("Invalid GAF report: " + String.join("; ", errors));
        }

        Instant now = clock.instant();
        GafReport report = GafReport.builder()
            .reportId(UUID.randomUUID().toString())
            .userId(request.userId())
            .address(request.address().trim())
            .normalizedAddress(CalibrationEngine.normalizeAddress(request.address()))
            .latitude(request.lat())
            .longitude(request.lng())
            .regionCode(GeoMath.regionCode(request.lat(), request.lng()))
            .totalSquares(request.totalSquares())
            .totalAreaSqFt(request.totalSquares() * PitchCalculator.SQ_FEET_PER_SQUARE)
            .estimatedAreaSqFt(request.estimatedAreaSqFt())
            .pitchInfo(request.pitchInfo())
            .pitchDegrees(PitchInfoParser.parseDegrees(request.pitchInfo()).orElse(null))
            .facetCount(request.facetCount())
            .wasteFactor(request.wasteFactor())
            .reportDate(request.reportDate())
            .uploadedAt(now)
            .pdfUrl(request.pdfUrl())
            .build();

        try {
            calibrationStore.saveReport(report);
            refreshRegion(report.getRegionCode(), now);
        } catch (MeasurementProcessingException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new MeasurementProcessingException("Failed to store GAF report", e);
        }

        log.info("Stored GAF report {} for region {} ({} squares)", report.getReportId(), report.getRegionCode(),
            report.getTotalSquares());
        return report;
    }

    public GafReport getReport(String reportId) {
        return calibrationStore.findReportById(reportId)
            .orElseThrow(() -> new ReportNotFoundException(reportId));
    }

    public List<GafReport> getReportsForUser(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
        return calibrationStore.findReportsByUser(userId);
    }

    public List<RegionalCalibration> getRegionalCalibrations() {
        return calibrationStore.findAllRegionalCalibrations();
    }

    /**
     * Compares a calculated roof area with a stored report.
     */
    public GafComparison compare(String reportId, double calculatedAreaSqFt) {
        if (!(calculatedAreaSqFt > 0)) {
            throw new IllegalArgumentException("Calculated area must be positive: " + calculatedAreaSqFt);
        }
        GafReport report = getReport(reportId);
        double verified = report.getTotalAreaSqFt();
        double difference = calculatedAreaSqFt - verified;

        Optional<GafCalibrationResult> calibration = calibrationEngine.findCalibration(
            report.getLatitude(), report.getLongitude(), null, calculatedAreaSqFt);
        Double calibrated = calibration
            .filter(c -> c.calibrationFactor() != 1.0)
            .map(c -> calculatedAreaSqFt * c.calibrationFactor())
            .orElse(null);

        return new GafComparison(reportId, calculatedAreaSqFt, verified, difference,
            difference / verified * 100.0, calibrated);
    }

    /**
     * Calibration summary for a location, optionally applied to a candidate area.
     */
    public CalibrationSummary summarize(double lat, double lng, String address, Double candidateAreaSqFt) {
        CoordinateValidator.validate(lat, lng);
        int nearby = calibrationStore.findNearby(lat, lng, properties.getCalibration().getRegionalRadiusMiles()).size();

        // The bucket factor does not depend on the area; use unit area when no candidate was given
        double area = candidateAreaSqFt != null && candidateAreaSqFt > 0 ? candidateAreaSqFt : 1.0;
        GafCalibrationResult calibration = calibrationEngine.findCalibration(lat, lng,
            candidateAreaSqFt != null ? address : null, area).orElse(null);
        Double calibrated = calibration != null && candidateAreaSqFt != null && candidateAreaSqFt > 0
            ? candidateAreaSqFt * calibration.calibrationFactor()
            : null;

        return new CalibrationSummary(lat, lng, GeoMath.regionCode(lat, lng), calibration, nearby, calibrated);
    }

    // ===== HELPERS =====

    private void refreshRegion(String regionCode, Instant now) {
        List<GafReport> regionReports = calibrationStore.findReportsInRegion(regionCode);
        calibrationEngine.aggregateRegion(regionCode, regionReports, now)
            .ifPresent(calibration -> {
                calibrationStore.saveRegionalCalibration(calibration);
                log.info("Updated regional calibration {} - factor {}, samples {}", regionCode,
                    calibration.getCalibrationFactor(), calibration.getSampleCount());
            });
    }

    static List<String> validate(GafReportRequest request) {
        List<String> errors = new ArrayList<>();
        if (request == null) {
            errors.add("Report is required");
            return errors;
        }
        if (request.address() == null || request.address().isBlank()) {
            errors.add("Address is required");
        }
        if (request.lat() == null || !Double.isFinite(request.lat()) || request.lat() < -90 || request.lat() > 90) {
            errors.add("Valid latitude is required");
        }
        if (request.lng() == null || !Double.isFinite(request.lng()) || request.lng() < -180 || request.lng() > 180) {
            errors.add("Valid longitude is required");
        }
        if (request.totalSquares() == null || !(request.totalSquares() > 0)) {
            errors.add("Total squares must be a positive number");
        }
        if (request.reportDate() == null) {
            errors.add("Report date is required");
        }
        if (request.estimatedAreaSqFt() != null && !(request.estimatedAreaSqFt() > 0)) {
            errors.add("Estimated area must be a positive number when provided");
        }
        return errors;
    }
}
