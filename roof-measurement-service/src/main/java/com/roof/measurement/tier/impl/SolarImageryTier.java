package com.roof.measurement.tier.impl;

import com.roof.measurement.algorithm.util.PitchCalculator;
import com.roof.measurement.client.SolarApiClient;
import com.roof.measurement.dto.ImageryQuality;
import com.roof.measurement.dto.MeasurementResult;
import com.roof.measurement.dto.MeasurementSource;
import com.roof.measurement.dto.ProviderResult;
import com.roof.measurement.dto.SolarBuildingInsight;
import com.roof.measurement.dto.TierDescriptor;
import com.roof.measurement.tier.MeasurementTier;
import com.roof.measurement.tier.ResolutionContext;
import com.roof.measurement.tier.TierOutcome;
import com.roof.measurement.tier.TierType;

/**
 * Tiers 2-4: solar imagery with a minimum imagery grade.
 *
 * <p>All three instances share one provider response per request through the resolution context.
 * Segment areas from the provider are already sloped, so the pitch multiplier is not applied again.
 */
public class SolarImageryTier implements MeasurementTier {

    static final String CACHE_KEY = "solar-building-insight";

    static final int BASE_CONFIDENCE = 85;
    static final int HIGH_QUALITY_BONUS = 5;
    static final int LOW_QUALITY_PENALTY = -10;

    private final TierType tierType;
    private final ImageryQuality qualityFloor;
    private final SolarApiClient client;

    public SolarImageryTier(TierType tierType, ImageryQuality qualityFloor, SolarApiClient client) {
        this.tierType = tierType;
        this.qualityFloor = qualityFloor;
        this.client = client;
    }

    @Override
    public TierDescriptor descriptor() {
        return tierType.descriptor();
    }

    public ImageryQuality getQualityFloor() {
        return qualityFloor;
    }

    @Override
    public TierOutcome attempt(ResolutionContext context) {
        if (!context.getCredentials().hasSolarKey()) {
            return TierOutcome.failure(descriptor(), "Solar imagery API key not configured");
        }

        ProviderResult<SolarBuildingInsight> result = context.fetchOnce(CACHE_KEY,
            () -> client.findClosestBuilding(context.getLatitude(), context.getLongitude(),
                context.getCredentials().solarApiKey()));

        if (result.isNoData()) {
            return TierOutcome.failure(descriptor(), "No building data available for this location");
        }
        if (!result.isSuccess()) {
            return TierOutcome.failure(descriptor(), "API error: " + result.errorMessage());
        }

        SolarBuildingInsight insight = result.body();
        if (!insight.imageryQuality().meets(qualityFloor)) {
            return TierOutcome.failure(descriptor(), String.format("Only %s quality imagery available (not %s)",
                insight.imageryQuality(), qualityFloor));
        }
        if (insight.segments().isEmpty() || !(insight.totalSlopedAreaSqM() > 0)) {
            return TierOutcome.failure(descriptor(), "No roof segments in imagery data");
        }

        double pitch = PitchCalculator.weightedAveragePitch(insight.segments());
        double slopedSqFt = PitchCalculator.squareMetersToSquareFeet(insight.totalSlopedAreaSqM());

        MeasurementResult measurement = MeasurementResult
            .fromSlopedArea(MeasurementSource.GOOGLE_SOLAR, slopedSqFt, pitch, insight.segments().size())
            .confidence(confidenceFor(insight.imageryQuality()))
            .imageryQuality(insight.imageryQuality())
            .imageryDate(insight.imageryDate())
            .build();
        return TierOutcome.success(descriptor(), measurement);
    }

    private static int confidenceFor(ImageryQuality quality) {
        if (quality == ImageryQuality.HIGH) {
            return BASE_CONFIDENCE + HIGH_QUALITY_BONUS;
        } else if (quality == ImageryQuality.MEDIUM) {
            return BASE_CONFIDENCE;
        }
        return BASE_CONFIDENCE + LOW_QUALITY_PENALTY;
    }
}
