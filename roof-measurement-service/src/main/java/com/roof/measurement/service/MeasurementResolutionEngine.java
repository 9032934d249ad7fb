package com.roof.measurement.service;

import com.roof.measurement.algorithm.calibration.CalibrationEngine;
import com.roof.measurement.algorithm.confidence.ConfidenceScorer;
import com.roof.measurement.algorithm.util.PitchCalculator;
import com.roof.measurement.algorithm.validation.CrossValidator;
import com.roof.measurement.dto.ConfidenceResult;
import com.roof.measurement.dto.ConfidenceSignals;
import com.roof.measurement.dto.CrossValidationResult;
import com.roof.measurement.dto.GafCalibrationResult;
import com.roof.measurement.dto.MeasurementResult;
import com.roof.measurement.dto.MeasurementSource;
import com.roof.measurement.dto.ProviderCredentials;
import com.roof.measurement.dto.SourceValidation;
import com.roof.measurement.dto.TieredMeasurementResult;
import com.roof.measurement.tier.ResolutionContext;
import com.roof.measurement.tier.TierResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Entry points of the measurement resolution engine. Credentials are passed in explicitly; the
 * engine reads no environment state.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MeasurementResolutionEngine {

    static final int MANUAL_CONFIDENCE = 85;

    private final TierResolver tierResolver;
    private final CrossValidator crossValidator;
    private final ConfidenceScorer confidenceScorer;
    private final CalibrationEngine calibrationEngine;

    /**
     * Resolves the most accurate available measurement by walking the tiers in order.
     *
     * @throws IllegalArgumentException for invalid coordinates
     */
    public TieredMeasurementResult resolveTiered(double lat, double lng, String address,
            ProviderCredentials credentials) {
        CoordinateValidator.validate(lat, lng);
        return tierResolver.resolve(new ResolutionContext(lat, lng, address, credentials));
    }

    public CrossValidationResult crossValidate(List<MeasurementResult> candidates, GafCalibrationResult calibration) {
        return crossValidator.crossValidate(candidates, calibration);
    }

    /**
     * Checks secondary candidates against the primary one (legacy all-sources mode).
     */
    public SourceValidation validateAgainstPrimary(MeasurementResult primary, List<MeasurementResult> secondaries) {
        return crossValidator.validateAgainstPrimary(primary, secondaries);
    }

    public ConfidenceResult scoreConfidence(ConfidenceSignals signals) {
        return confidenceScorer.score(signals);
    }

    public Optional<GafCalibrationResult> getCalibration(double lat, double lng, double candidateAreaSqFt) {
        return getCalibration(lat, lng, null, candidateAreaSqFt);
    }

    /**
     * Calibration for a candidate area; an address enables exact report matching.
     */
    public Optional<GafCalibrationResult> getCalibration(double lat, double lng, String address,
            double candidateAreaSqFt) {
        CoordinateValidator.validate(lat, lng);
        return calibrationEngine.findCalibration(lat, lng, address, candidateAreaSqFt);
    }

    /**
     * Applies a calibration; a missing calibration or a factor of 1.0 returns the measurement unchanged.
     */
    public MeasurementResult applyCalibration(MeasurementResult measurement, GafCalibrationResult calibration) {
        return calibrationEngine.apply(measurement, calibration);
    }

    /**
     * Builds a measurement from a user-traced footprint.
     *
     * @param areaSqFt traced footprint area, must be positive
     * @param pitchDegrees pitch, 20° when null
     * @throws IllegalArgumentException for a non-positive area or a pitch outside [0, 90)
     */
    public MeasurementResult manualMeasurement(double areaSqFt, Double pitchDegrees) {
        if (!Double.isFinite(areaSqFt) || areaSqFt <= 0) {
            throw new IllegalArgumentException("Manual area must be a positive number: " + areaSqFt);
        }
        double pitch = pitchDegrees != null ? pitchDegrees : PitchCalculator.DEFAULT_MANUAL_PITCH_DEGREES;
        log.debug("Manual measurement - area: {} sq ft, pitch: {}°", areaSqFt, pitch);
        return MeasurementResult.fromFootprint(MeasurementSource.MANUAL, areaSqFt, pitch, 1)
            .confidence(MANUAL_CONFIDENCE)
            .build();
    }
}
