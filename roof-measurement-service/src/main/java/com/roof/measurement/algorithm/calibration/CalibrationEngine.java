package com.roof.measurement.algorithm.calibration;

import com.roof.measurement.algorithm.util.GeoMath;
import com.roof.measurement.config.MeasurementProperties;
import com.roof.measurement.dto.GafCalibrationResult;
import com.roof.measurement.dto.GafReport;
import com.roof.measurement.dto.MeasurementResult;
import com.roof.measurement.dto.RegionalCalibration;
import com.roof.measurement.repository.CalibrationStore;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Derives calibration factors from verified field reports.
 *
 * <p>Lookup order:
 *
 * <ol>
 *   <li>exact match: a report with the same normalized address within the exact-match tolerance;
 *       factor = verified area / candidate area
 *   <li>stored regional bucket covering the point, if built from enough samples
 *   <li>nearby reports carrying the service's original estimate, aggregated on the fly
 * </ol>
 *
 * <p>Nearby Aggregation Formula: factor = Σ(w_i × r_i) / Σ(w_i), r_i = verified_i / estimated_i,
 * w_i = 1 / (1 + distance_i in miles), after discarding ratios more than k standard deviations
 * from the mean.
 *
 * <p>Absence of calibration is the common case and is returned as an empty Optional.
 */
@Component
public class CalibrationEngine {

    private static final Logger logger = LoggerFactory.getLogger(CalibrationEngine.class);

    private final CalibrationStore calibrationStore;
    private final MeasurementProperties.Calibration settings;

    public CalibrationEngine(CalibrationStore calibrationStore, MeasurementProperties properties) {
        this.calibrationStore = calibrationStore;
        this.settings = properties.getCalibration();
    }

    // ===== LOOKUP =====

    /**
     * Finds the calibration for a candidate area at a location.
     *
     * @param address street address, may be null; required for an exact match
     * @param candidateAreaSqFt the adjusted area to be calibrated
     * @return calibration, or empty when there is not enough history or the candidate has no area
     */
    public Optional<GafCalibrationResult> findCalibration(double lat, double lng, String address,
            double candidateAreaSqFt) {
        if (!(candidateAreaSqFt > 0) || !Double.isFinite(candidateAreaSqFt)) {
            return Optional.empty();
        }
        String regionCode = GeoMath.regionCode(lat, lng);

        try {
            Optional<GafCalibrationResult> exact = findExactMatch(lat, lng, address, candidateAreaSqFt, regionCode);
            if (exact.isPresent()) {
                return exact;
            }

            Optional<GafCalibrationResult> regional = findStoredRegion(lat, lng, regionCode);
            if (regional.isPresent()) {
                return regional;
            }

            return aggregateNearby(lat, lng, regionCode);
        } catch (RuntimeException e) {
            logger.warn("Calibration lookup failed for ({}, {}), continuing without calibration: {}",
                lat, lng, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Applies a calibration to a measurement. Returns the measurement unchanged when there is no
     * calibration or its factor is 1.0.
     */
    public MeasurementResult apply(MeasurementResult measurement, GafCalibrationResult calibration) {
        if (calibration == null) {
            return measurement;
        }
        return measurement.withCalibrationFactor(calibration.calibrationFactor());
    }

    // ===== REGION AGGREGATION =====

    /**
     * Builds the calibration bucket for a region from its reports.
     *
     * @return bucket, or empty when fewer than the minimum number of reports carry an estimate
     */
    public Optional<RegionalCalibration> aggregateRegion(String regionCode, List<GafReport> reports, Instant now) {
        List<Double> ratios = reports.stream()
            .filter(GafReport::hasCalibrationPair)
            .map(report -> report.getTotalAreaSqFt() / report.getEstimatedAreaSqFt())
            .toList();
        if (ratios.size() < settings.getMinSampleCount()) {
            logger.debug("Region {} has {} calibration sample(s), need {}", regionCode, ratios.size(),
                settings.getMinSampleCount());
            return Optional.empty();
        }

        DescriptiveStatistics stats = new DescriptiveStatistics();
        DescriptiveStatistics variance = new DescriptiveStatistics();
        for (double ratio : ratios) {
            stats.addValue(ratio);
            variance.addValue(Math.abs(ratio - 1.0) * 100.0);
        }

        return Optional.of(RegionalCalibration.builder()
            .regionCode(regionCode)
            .calibrationFactor(stats.getMean())
            .sampleCount(ratios.size())
            .averageVariancePercent(variance.getMean())
            .lastUpdated(now)
            .build());
    }

    /**
     * Lower-cased, trimmed, whitespace-collapsed address used as the exact-match key.
     */
    public static String normalizeAddress(String address) {
        if (address == null) {
            return null;
        }
        String normalized = address.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
        return normalized.isEmpty() ? null : normalized;
    }

    // ===== HELPERS =====

    private Optional<GafCalibrationResult> findExactMatch(double lat, double lng, String address,
            double candidateAreaSqFt, String regionCode) {
        String normalized = normalizeAddress(address);
        if (normalized == null) {
            return Optional.empty();
        }
        return calibrationStore
            .findExactReport(normalized, lat, lng, settings.getExactMatchToleranceMiles())
            .filter(report -> report.getTotalAreaSqFt() != null && report.getTotalAreaSqFt() > 0)
            .map(report -> {
                logger.info("Exact report match {} for '{}'", report.getReportId(), normalized);
                return new GafCalibrationResult(report.getTotalAreaSqFt() / candidateAreaSqFt, 1,
                    report.getUploadedAt(), true, regionCode, report.getTotalAreaSqFt());
            });
    }

    private Optional<GafCalibrationResult> findStoredRegion(double lat, double lng, String regionCode) {
        return calibrationStore.findRegionalCalibration(lat, lng)
            .filter(region -> region.getCalibrationFactor() != null && region.getCalibrationFactor() > 0)
            .filter(region -> region.getSampleCount() != null
                && region.getSampleCount() >= settings.getMinSampleCount())
            .map(region -> new GafCalibrationResult(region.getCalibrationFactor(), region.getSampleCount(),
                region.getLastUpdated(), false, regionCode, null));
    }

    private Optional<GafCalibrationResult> aggregateNearby(double lat, double lng, String regionCode) {
        List<GafReport> samples = calibrationStore.findNearby(lat, lng, settings.getRegionalRadiusMiles()).stream()
            .filter(GafReport::hasCalibrationPair)
            .filter(report -> report.getLatitude() != null && report.getLongitude() != null)
            .toList();
        if (samples.size() < settings.getMinSampleCount()) {
            return Optional.empty();
        }

        DescriptiveStatistics stats = new DescriptiveStatistics();
        samples.forEach(report -> stats.addValue(ratio(report)));
        double mean = stats.getMean();
        double limit = settings.getOutlierStdDevs() * stats.getStandardDeviation();

        List<GafReport> inliers = new ArrayList<>();
        for (GafReport report : samples) {
            if (limit == 0.0 || Math.abs(ratio(report) - mean) <= limit) {
                inliers.add(report);
            }
        }
        if (inliers.size() < settings.getMinSampleCount()) {
            logger.debug("Only {} inlier report(s) near ({}, {}) after outlier removal", inliers.size(), lat, lng);
            return Optional.empty();
        }

        double weightedSum = 0.0;
        double weightTotal = 0.0;
        for (GafReport report : inliers) {
            double weight = 1.0 / (1.0 + GeoMath.distanceMiles(lat, lng, report.getLatitude(), report.getLongitude()));
            weightedSum += weight * ratio(report);
            weightTotal += weight;
        }
        Instant lastCalibrated = inliers.stream()
            .map(GafReport::getUploadedAt)
            .filter(Objects::nonNull)
            .max(Instant::compareTo)
            .orElse(null);

        logger.debug("Aggregated calibration from {} nearby report(s) ({} outlier(s) removed)",
            inliers.size(), samples.size() - inliers.size());
        return Optional.of(new GafCalibrationResult(weightedSum / weightTotal, inliers.size(), lastCalibrated,
            false, regionCode, null));
    }

    private static double ratio(GafReport report) {
        return report.getTotalAreaSqFt() / report.getEstimatedAreaSqFt();
    }
}
