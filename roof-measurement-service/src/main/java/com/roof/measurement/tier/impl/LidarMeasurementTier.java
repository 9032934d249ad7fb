package com.roof.measurement.tier.impl;

import com.roof.measurement.client.LidarMeasurementClient;
import com.roof.measurement.dto.LidarMeasurement;
import com.roof.measurement.dto.MeasurementResult;
import com.roof.measurement.dto.MeasurementSource;
import com.roof.measurement.dto.ProviderResult;
import com.roof.measurement.dto.TierDescriptor;
import com.roof.measurement.tier.MeasurementTier;
import com.roof.measurement.tier.ResolutionContext;
import com.roof.measurement.tier.TierOutcome;
import com.roof.measurement.tier.TierType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Tier 1: LiDAR elevation measurement.
 */
@Component
@RequiredArgsConstructor
public class LidarMeasurementTier implements MeasurementTier {

    static final int LIDAR_CONFIDENCE = 95;

    private final LidarMeasurementClient client;

    @Override
    public TierDescriptor descriptor() {
        return TierType.LIDAR.descriptor();
    }

    @Override
    public TierOutcome attempt(ResolutionContext context) {
        if (!context.getCredentials().hasLidarKey()) {
            return TierOutcome.failure(descriptor(), "LiDAR API key not configured");
        }

        ProviderResult<LidarMeasurement> result = client.fetchMeasurement(
            context.getLatitude(), context.getLongitude(), context.getCredentials().lidarApiKey());

        if (result.isNoData()) {
            return TierOutcome.failure(descriptor(), "No LiDAR coverage for this location");
        }
        if (!result.isSuccess()) {
            return TierOutcome.failure(descriptor(), "API error: " + result.errorMessage());
        }

        LidarMeasurement lidar = result.body();
        if (!(lidar.footprintAreaSqFt() > 0)) {
            return TierOutcome.failure(descriptor(), "LiDAR data contains no roof area");
        }
        if (lidar.pitchDegrees() < 0 || lidar.pitchDegrees() >= 90) {
            return TierOutcome.failure(descriptor(), "LiDAR pitch out of range: " + lidar.pitchDegrees());
        }

        MeasurementResult measurement = MeasurementResult
            .fromFootprint(MeasurementSource.INSTANT_ROOFER, lidar.footprintAreaSqFt(), lidar.pitchDegrees(),
                Math.max(1, lidar.segmentCount()))
            .confidence(LIDAR_CONFIDENCE)
            .lidarData(MeasurementSource.INSTANT_ROOFER.isLidarBacked())
            .imageryDate(lidar.captureDate())
            .build();
        return TierOutcome.success(descriptor(), measurement);
    }
}
