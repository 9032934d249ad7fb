package com.roof.measurement.algorithm.validation;

import com.roof.measurement.config.MeasurementProperties;
import com.roof.measurement.dto.CrossValidationResult;
import com.roof.measurement.dto.Discrepancy;
import com.roof.measurement.dto.GafCalibrationResult;
import com.roof.measurement.dto.MeasurementResult;
import com.roof.measurement.dto.SourceValidation;
import com.roof.measurement.dto.SourceValidation.SourceComparison;
import com.roof.measurement.dto.SourceValidation.Variance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Compares measurement candidates, scores their agreement and selects the final measurement.
 *
 * <p>Pairwise Deviation Formula: d(a, b) = |a − b| / ((a + b) / 2) × 100
 *
 * <p>Agreement Score: agreement = max(0, 100 − max d(a, b)) over all candidate pairs
 *
 * <p>Selection is by source trust, never by averaging. When an exact verified report exists the
 * candidate closest to its area wins instead.
 */
@Component
public class CrossValidator {

    private static final Logger logger = LoggerFactory.getLogger(CrossValidator.class);

    /** Secondary variance at or below which a source agrees with the primary. */
    static final double AGREEMENT_VARIANCE_PERCENT = 5.0;

    /** Secondary variance at or below which the difference is minor. */
    static final double MINOR_VARIANCE_PERCENT = 15.0;

    private static final double FULL_AGREEMENT = 100.0;

    /** Trust first, then LiDAR backing, then source confidence. */
    private static final Comparator<MeasurementResult> BY_TRUST =
        Comparator.comparingDouble((MeasurementResult m) -> m.source().getTrustWeight())
            .thenComparing((MeasurementResult m) -> m.lidarData() || m.source().isLidarBacked())
            .thenComparingInt(MeasurementResult::confidence);

    private final MeasurementProperties properties;

    public CrossValidator(MeasurementProperties properties) {
        this.properties = properties;
    }

    /**
     * Cross-validates candidates.
     *
     * @param candidates one or more measurements, in tier order
     * @param calibration calibration for the location, may be null
     * @throws IllegalArgumentException when there are no candidates or a candidate has no source
     */
    public CrossValidationResult crossValidate(List<MeasurementResult> candidates, GafCalibrationResult calibration) {
        if (candidates == null || candidates.isEmpty()) {
            throw new IllegalArgumentException("At least one measurement candidate is required");
        }
        for (MeasurementResult candidate : candidates) {
            if (candidate == null || candidate.source() == null) {
                throw new IllegalArgumentException("Every measurement candidate needs a source");
            }
        }

        if (candidates.size() == 1) {
            MeasurementResult only = candidates.get(0);
            return new CrossValidationResult(only, FULL_AGREEMENT, 1, List.of(),
                "Single source measurement from " + only.source().getId() + "; no cross-validation performed.");
        }

        double threshold = properties.getCrossValidation().getDiscrepancyThresholdPercent();
        List<Discrepancy> discrepancies = new ArrayList<>();
        double maxDeviation = 0.0;

        for (int i = 0; i < candidates.size(); i++) {
            for (int j = i + 1; j < candidates.size(); j++) {
                MeasurementResult a = candidates.get(i);
                MeasurementResult b = candidates.get(j);
                double deviation = relativeDifferencePercent(a.adjustedAreaSqFt(), b.adjustedAreaSqFt());
                maxDeviation = Math.max(maxDeviation, deviation);
                if (deviation > threshold) {
                    discrepancies.add(new Discrepancy(a.source(), a.adjustedAreaSqFt(),
                        b.source(), b.adjustedAreaSqFt(), deviation));
                }
            }
        }

        double agreement = Math.max(0.0, FULL_AGREEMENT - maxDeviation);
        boolean groundTruth = hasReferenceArea(calibration);
        MeasurementResult selected = groundTruth
            ? closestTo(candidates, calibration.referenceAreaSqFt())
            : mostTrusted(candidates);

        logger.debug("Cross-validated {} candidates - agreement: {}, discrepancies: {}, selected: {}",
            candidates.size(), agreement, discrepancies.size(), selected.source());

        return new CrossValidationResult(selected, agreement, candidates.size(), discrepancies,
            narrate(candidates.size(), agreement, maxDeviation, threshold, selected, groundTruth));
    }

    /**
     * Checks secondary sources against a primary measurement.
     *
     * @return VALIDATED when every secondary agrees or varies only slightly, DISCREPANCY_DETECTED when
     *     any varies by more than 15%, UNVALIDATED when there are no secondaries
     */
    public SourceValidation validateAgainstPrimary(MeasurementResult primary, List<MeasurementResult> secondaries) {
        if (secondaries == null || secondaries.isEmpty() || !primary.hasArea()) {
            return new SourceValidation(primary.source(), SourceValidation.Status.UNVALIDATED, List.of(),
                List.of("No secondary sources available to validate against"));
        }

        List<SourceComparison> comparisons = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        boolean significant = false;

        for (MeasurementResult secondary : secondaries) {
            double variance = Math.abs(secondary.adjustedAreaSqFt() - primary.adjustedAreaSqFt())
                / primary.adjustedAreaSqFt() * 100.0;
            Variance level;
            if (variance <= AGREEMENT_VARIANCE_PERCENT) {
                level = Variance.AGREES;
            } else if (variance <= MINOR_VARIANCE_PERCENT) {
                level = Variance.MINOR_VARIANCE;
            } else {
                level = Variance.SIGNIFICANT_VARIANCE;
                significant = true;
                warnings.add(String.format(Locale.ROOT, "%s differs from %s by %.1f%%",
                    secondary.source().getId(), primary.source().getId(), variance));
            }
            comparisons.add(new SourceComparison(secondary.source(), secondary.adjustedAreaSqFt(), variance, level));
        }

        SourceValidation.Status status = significant
            ? SourceValidation.Status.DISCREPANCY_DETECTED
            : SourceValidation.Status.VALIDATED;
        return new SourceValidation(primary.source(), status, comparisons, warnings);
    }

    static double relativeDifferencePercent(double a, double b) {
        double mean = (a + b) / 2.0;
        if (mean <= 0) {
            return 0.0;
        }
        return Math.abs(a - b) / mean * 100.0;
    }

    private static boolean hasReferenceArea(GafCalibrationResult calibration) {
        return calibration != null && calibration.exactMatch()
            && calibration.referenceAreaSqFt() != null && calibration.referenceAreaSqFt() > 0;
    }

    private static MeasurementResult closestTo(List<MeasurementResult> candidates, double referenceArea) {
        MeasurementResult best = candidates.get(0);
        for (MeasurementResult candidate : candidates) {
            if (Math.abs(candidate.adjustedAreaSqFt() - referenceArea)
                    < Math.abs(best.adjustedAreaSqFt() - referenceArea)) {
                best = candidate;
            }
        }
        return best;
    }

    private static MeasurementResult mostTrusted(List<MeasurementResult> candidates) {
        // Earlier candidates win ties
        MeasurementResult best = candidates.get(0);
        for (MeasurementResult candidate : candidates) {
            if (BY_TRUST.compare(candidate, best) > 0) {
                best = candidate;
            }
        }
        return best;
    }

    private static String narrate(int count, double agreement, double maxDeviation, double threshold,
            MeasurementResult selected, boolean groundTruth) {
        String basis = groundTruth
            ? "closest to the verified report for this building"
            : "most trusted source";
        if (maxDeviation > threshold) {
            return String.format(Locale.ROOT,
                "%d sources disagree by up to %.1f%%; using %s measurement (%s). "
                    + "Review the discrepancies before ordering materials.",
                count, maxDeviation, selected.source().getId(), basis);
        }
        return String.format(Locale.ROOT,
            "%d sources agree within %.1f%% (agreement %.1f); using %s measurement (%s).",
            count, threshold, agreement, selected.source().getId(), basis);
    }
}
