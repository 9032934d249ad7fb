package com.roof.measurement.tier.impl;

import com.roof.measurement.config.MeasurementProperties;
import com.roof.measurement.dto.GafReport;
import com.roof.measurement.dto.MeasurementResult;
import com.roof.measurement.dto.MeasurementSource;
import com.roof.measurement.dto.TierDescriptor;
import com.roof.measurement.repository.CalibrationStore;
import com.roof.measurement.tier.MeasurementTier;
import com.roof.measurement.tier.ResolutionContext;
import com.roof.measurement.tier.TierOutcome;
import com.roof.measurement.tier.TierType;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Tier 6: rough estimate for an address from verified reports of nearby roofs.
 *
 * <p>Area is the median verified roof area of reports within the configured radius; pitch is the
 * mean of their pitches, or 18.4° (4:12) when none is known.
 */
@Component
public class AddressEstimateTier implements MeasurementTier {

    static final int ESTIMATE_CONFIDENCE = 45;

    static final double DEFAULT_PITCH_DEGREES = 18.4;

    static final String ESTIMATE_WARNING =
        "Area estimated from nearby verified roofs - trace the roof for an accurate measurement";

    private final CalibrationStore calibrationStore;
    private final MeasurementProperties.AddressEstimate settings;

    public AddressEstimateTier(CalibrationStore calibrationStore, MeasurementProperties properties) {
        this.calibrationStore = calibrationStore;
        this.settings = properties.getAddressEstimate();
    }

    @Override
    public TierDescriptor descriptor() {
        return TierType.ADDRESS_ESTIMATE.descriptor();
    }

    @Override
    public TierOutcome attempt(ResolutionContext context) {
        if (!context.hasAddress()) {
            return TierOutcome.failure(descriptor(), "No address provided for address-based estimate");
        }

        List<GafReport> nearby;
        try {
            nearby = calibrationStore.findNearby(context.getLatitude(), context.getLongitude(),
                settings.getRadiusMiles());
        } catch (RuntimeException e) {
            return TierOutcome.failure(descriptor(), "Historical report lookup failed: " + e.getMessage());
        }

        double[] areas = nearby.stream()
            .map(GafReport::getTotalAreaSqFt)
            .filter(Objects::nonNull)
            .mapToDouble(Double::doubleValue)
            .filter(area -> area > 0)
            .toArray();
        if (areas.length < settings.getMinSampleCount()) {
            return TierOutcome.failure(descriptor(), String.format(Locale.ROOT,
                "Only %d verified report(s) within %.1f miles (need %d)",
                areas.length, settings.getRadiusMiles(), settings.getMinSampleCount()));
        }

        double medianArea = new Median().evaluate(areas);
        double pitch = nearby.stream()
            .map(GafReport::getPitchDegrees)
            .filter(Objects::nonNull)
            .filter(degrees -> degrees >= 0 && degrees < 90)
            .mapToDouble(Double::doubleValue)
            .average()
            .orElse(DEFAULT_PITCH_DEGREES);

        MeasurementResult measurement = MeasurementResult
            .fromSlopedArea(MeasurementSource.ADDRESS_ESTIMATE, medianArea, pitch, 1)
            .confidence(ESTIMATE_CONFIDENCE)
            .warnings(List.of(ESTIMATE_WARNING))
            .build();
        return TierOutcome.success(descriptor(), measurement);
    }
}
