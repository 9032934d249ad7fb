package com.roof.measurement.service;

import com.roof.measurement.algorithm.util.PitchCalculator;
import com.roof.measurement.config.MeasurementProperties;
import com.roof.measurement.dto.ConfidenceFactor;
import com.roof.measurement.dto.ConfidenceLevel;
import com.roof.measurement.dto.ConfidenceResult;
import com.roof.measurement.dto.ConfidenceSignals;
import com.roof.measurement.dto.CrossValidationResult;
import com.roof.measurement.dto.GafCalibrationResult;
import com.roof.measurement.dto.ManualMeasurementRequest;
import com.roof.measurement.dto.MeasurementReport;
import com.roof.measurement.dto.MeasurementResult;
import com.roof.measurement.dto.MeasurementSource;
import com.roof.measurement.dto.ProviderCredentials;
import com.roof.measurement.dto.SourceInfo;
import com.roof.measurement.dto.SourceValidation;
import com.roof.measurement.dto.TierDescriptor;
import com.roof.measurement.dto.TierFailure;
import com.roof.measurement.dto.TieredMeasurementResult;
import com.roof.measurement.exception.ParallelMeasurementUnavailableException;
import com.roof.measurement.tier.MeasurementTier;
import com.roof.measurement.tier.ResolutionContext;
import com.roof.measurement.tier.TierOutcome;
import com.roof.measurement.tier.TierResolver;
import com.roof.measurement.tier.TierType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Builds measurement reports from the resolution engine.
 *
 * <p>Tiered flow: resolve → look up calibration for the candidate → cross-validate → apply
 * calibration → score confidence → narrate.
 */
@Slf4j
@Service
public class RoofMeasurementServiceImpl implements RoofMeasurementService {

    private static final double DAYS_PER_YEAR = 365.25;

    private final MeasurementResolutionEngine engine;
    private final TierResolver tierResolver;
    private final RecommendationGenerator recommendationGenerator;
    private final Executor measurementExecutor;
    private final MeasurementProperties properties;
    private final Clock clock;

    public RoofMeasurementServiceImpl(MeasurementResolutionEngine engine,
            TierResolver tierResolver,
            RecommendationGenerator recommendationGenerator,
            @Qualifier("measurementExecutor") Executor measurementExecutor,
            MeasurementProperties properties,
            Clock clock) {
        this.engine = engine;
        this.tierResolver = tierResolver;
        this.recommendationGenerator = recommendationGenerator;
        this.measurementExecutor = measurementExecutor;
        this.properties = properties;
        this.clock = clock;
    }

    // ===== TIERED MODE =====

    @Override
    public MeasurementReport measure(double lat, double lng, String address, ProviderCredentials credentials) {
        logIncomingRequest("tiered", lat, lng, address);

        TieredMeasurementResult tiered = engine.resolveTiered(lat, lng, address, credentials);
        if (tiered.manualTracingRequired()) {
            return manualTracingReport(lat, lng, address, tiered.higherTierFailures());
        }

        MeasurementResult candidate = tiered.measurement();
        GafCalibrationResult calibration =
            engine.getCalibration(lat, lng, address, candidate.adjustedAreaSqFt()).orElse(null);
        CrossValidationResult crossValidation = engine.crossValidate(List.of(candidate), calibration);
        MeasurementResult calibrated = engine.applyCalibration(crossValidation.finalMeasurement(), calibration);

        ConfidenceResult confidence = engine.scoreConfidence(
            signalsFor(crossValidation.finalMeasurement(), 1, null, calibration, false));

        log.info("Measured ({}, {}) at tier {} - {} sq ft, confidence {} ({})", lat, lng, tiered.tierUsed(),
            Math.round(calibrated.adjustedAreaSqFt()), confidence.score(), confidence.level());

        return reportBuilder(lat, lng, address, calibrated)
            .source(new SourceInfo(tiered.tierUsed(), tiered.tierName(), tiered.tierAccuracy(), candidate.source()))
            .confidence(confidence)
            .crossValidation(crossValidation)
            .gafCalibration(calibration)
            .candidates(List.of(candidate))
            .higherTierFailures(tiered.higherTierFailures())
            .fallbacksAvailable(tiered.fallbacksAvailable())
            .manualTracingRequired(false)
            .recommendations(recommendationGenerator.generate(crossValidation, confidence, calibration,
                tiered.higherTierFailures()))
            .build();
    }

    // ===== ALL-SOURCES MODE =====

    @Override
    public MeasurementReport measureAllSources(double lat, double lng, String address,
            ProviderCredentials credentials) {
        logIncomingRequest("all-sources", lat, lng, address);
        CoordinateValidator.validate(lat, lng);

        ResolutionContext context = new ResolutionContext(lat, lng, address, credentials);
        List<TierOutcome> outcomes = collectOutcomes(submitAutomatedTiers(context));

        // One candidate per source, from its most accurate tier
        Map<MeasurementSource, TierOutcome> bySource = new LinkedHashMap<>();
        List<TierFailure> failures = new ArrayList<>();
        for (TierOutcome outcome : outcomes) {
            if (outcome.isSuccess()) {
                bySource.putIfAbsent(outcome.measurement().source(), outcome);
            } else {
                failures.add(outcome.toFailure());
            }
        }

        if (bySource.isEmpty()) {
            return manualTracingReport(lat, lng, address, failures);
        }

        List<MeasurementResult> candidates = bySource.values().stream()
            .map(TierOutcome::measurement)
            .toList();
        MeasurementResult primary = candidates.get(0);
        GafCalibrationResult calibration =
            engine.getCalibration(lat, lng, address, primary.adjustedAreaSqFt()).orElse(null);
        CrossValidationResult crossValidation = engine.crossValidate(candidates, calibration);
        MeasurementResult selected = crossValidation.finalMeasurement();
        if (calibration != null && selected.source() != primary.source()) {
            // The factor is relative to the area it was computed for
            calibration = engine.getCalibration(lat, lng, address, selected.adjustedAreaSqFt()).orElse(null);
        }
        SourceValidation sourceValidation = engine.validateAgainstPrimary(primary, candidates.subList(1, candidates.size()));
        MeasurementResult calibrated = engine.applyCalibration(selected, calibration);

        ConfidenceResult confidence = engine.scoreConfidence(signalsFor(selected, candidates.size(),
            crossValidation.agreementScore(), calibration, false));
        TierDescriptor selectedTier = bySource.get(selected.source()).tier();

        log.info("All-sources measurement for ({}, {}) - {} candidate(s), agreement {}, selected {}",
            lat, lng, candidates.size(), crossValidation.agreementScore(), selected.source());

        return reportBuilder(lat, lng, address, calibrated)
            .source(SourceInfo.of(selectedTier, selected.source()))
            .confidence(confidence)
            .crossValidation(crossValidation)
            .sourceValidation(sourceValidation)
            .gafCalibration(calibration)
            .candidates(candidates)
            .higherTierFailures(failures)
            .fallbacksAvailable(List.of(TierType.MANUAL.descriptor().name()))
            .manualTracingRequired(false)
            .recommendations(recommendationGenerator.generate(crossValidation, confidence, calibration, failures))
            .build();
    }

    // ===== MANUAL MODE =====

    @Override
    public MeasurementReport measureManual(ManualMeasurementRequest request) {
        if (request.manualArea() == null) {
            throw new IllegalArgumentException("Valid manual area is required");
        }
        if (request.lat() != null || request.lng() != null) {
            CoordinateValidator.validate(request.lat(), request.lng());
        }
        logIncomingRequest("manual", request.lat(), request.lng(), request.address());

        MeasurementResult measurement = engine.manualMeasurement(request.manualArea(), request.manualPitch());
        CrossValidationResult crossValidation = engine.crossValidate(List.of(measurement), null);
        ConfidenceResult confidence = engine.scoreConfidence(signalsFor(measurement, 1, null, null, true));

        return reportBuilder(request.lat(), request.lng(), request.address(), measurement)
            .source(SourceInfo.of(TierType.MANUAL.descriptor(), MeasurementSource.MANUAL))
            .confidence(confidence)
            .crossValidation(crossValidation)
            .candidates(List.of(measurement))
            .higherTierFailures(List.of())
            .fallbacksAvailable(List.of())
            .manualTracingRequired(false)
            .recommendations(recommendationGenerator.generate(crossValidation, confidence, null, List.of()))
            .build();
    }

    // ===== HELPERS =====

    private List<PendingAttempt> submitAutomatedTiers(ResolutionContext context) {
        List<PendingAttempt> pending = new ArrayList<>();
        try {
            for (MeasurementTier tier : tierResolver.getTiers()) {
                if (!tier.isTerminal()) {
                    pending.add(new PendingAttempt(tier, CompletableFuture.supplyAsync(
                        () -> tierResolver.attempt(tier, context), measurementExecutor)));
                }
            }
            return pending;
        } catch (ParallelMeasurementUnavailableException e) {
            pending.forEach(p -> p.future().cancel(true));
            throw e;
        } catch (RejectedExecutionException e) {
            pending.forEach(p -> p.future().cancel(true));
            throw new ParallelMeasurementUnavailableException("All-sources measurement rejected: " + e.getMessage(), e);
        }
    }

    private List<TierOutcome> collectOutcomes(List<PendingAttempt> pending) {
        long timeoutMs = properties.getParallel().getTimeoutMs();
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        List<TierOutcome> outcomes = new ArrayList<>();

        for (PendingAttempt attempt : pending) {
            TierDescriptor tier = attempt.tier().descriptor();
            try {
                long remaining = Math.max(0L, deadline - System.nanoTime());
                outcomes.add(attempt.future().get(remaining, TimeUnit.NANOSECONDS));
            } catch (TimeoutException e) {
                attempt.future().cancel(true);
                log.warn("Tier {} did not finish within {}ms", tier.tierNumber(), timeoutMs);
                outcomes.add(TierOutcome.failure(tier, "Timed out after " + timeoutMs + "ms"));
            } catch (ExecutionException e) {
                log.error("Tier {} failed unexpectedly", tier.tierNumber(), e.getCause());
                outcomes.add(TierOutcome.failure(tier, "Unexpected error: " + e.getCause().getMessage()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                outcomes.add(TierOutcome.failure(tier, "Interrupted"));
            }
        }
        return outcomes;
    }

    private MeasurementReport manualTracingReport(Double lat, Double lng, String address, List<TierFailure> failures) {
        log.info("No automated source available for ({}, {}); manual tracing required", lat, lng);
        MeasurementResult placeholder = MeasurementResult.manualTracingPlaceholder();
        ConfidenceResult confidence = new ConfidenceResult(0, ConfidenceLevel.LOW,
            List.of(new ConfidenceFactor("Manual tracing required", 0, "No automated measurement available")));

        return MeasurementReport.builder()
            .latitude(lat)
            .longitude(lng)
            .address(address)
            .measurement(placeholder)
            .source(SourceInfo.of(TierType.MANUAL.descriptor(), MeasurementSource.MANUAL))
            .confidence(confidence)
            .candidates(List.of())
            .higherTierFailures(failures)
            .fallbacksAvailable(List.of())
            .manualTracingRequired(true)
            .recommendations(recommendationGenerator.manualTracingRequired(failures))
            .build();
    }

    private MeasurementReport.MeasurementReportBuilder reportBuilder(Double lat, Double lng, String address,
            MeasurementResult measurement) {
        return MeasurementReport.builder()
            .latitude(lat)
            .longitude(lng)
            .address(address)
            .measurement(measurement)
            .pitchCategory(PitchCalculator.categorize(measurement.pitchDegrees()).getLabel())
            .standardPitch(PitchCalculator.nearestStandardPitch(measurement.pitchDegrees()));
    }

    private ConfidenceSignals signalsFor(MeasurementResult measurement, int sourceCount, Double agreement,
            GafCalibrationResult calibration, boolean manualInput) {
        return ConfidenceSignals.builder()
            .imageryQuality(measurement.imageryQuality())
            .imageryAgeYears(imageryAgeYears(measurement.imageryDate()))
            .segmentCount(measurement.segmentCount())
            .pitchDegrees(measurement.pitchDegrees())
            .sourceCount(sourceCount)
            .sourceAgreement(agreement)
            .hasCalibration(calibration != null)
            .exactCalibration(calibration != null && calibration.exactMatch())
            .lidarData(measurement.lidarData())
            .manualInput(manualInput)
            .build();
    }

    private Double imageryAgeYears(LocalDate imageryDate) {
        if (imageryDate == null) {
            return null;
        }
        long days = ChronoUnit.DAYS.between(imageryDate, LocalDate.now(clock));
        return Math.max(0L, days) / DAYS_PER_YEAR;
    }

    private void logIncomingRequest(String mode, Double lat, Double lng, String address) {
        log.info("Received {} measurement request - lat: {}, lng: {}, address present: {}",
            mode, lat, lng, address != null && !address.isBlank());
    }

    private record PendingAttempt(MeasurementTier tier, CompletableFuture<TierOutcome> future) {}
}
