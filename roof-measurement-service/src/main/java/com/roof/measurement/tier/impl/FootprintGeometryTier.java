package com.roof.measurement.tier.impl;

import com.roof.measurement.algorithm.util.BuildingType;
import com.roof.measurement.algorithm.util.GeoMath;
import com.roof.measurement.algorithm.util.GeoMath.Coordinate;
import com.roof.measurement.algorithm.util.PitchCalculator;
import com.roof.measurement.client.OverpassFootprintClient;
import com.roof.measurement.dto.BuildingFootprint;
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

import java.util.Comparator;
import java.util.List;

/**
 * Tier 5: OpenStreetMap footprint area with pitch estimated from the building type.
 */
@Component
@RequiredArgsConstructor
public class FootprintGeometryTier implements MeasurementTier {

    static final int FOOTPRINT_CONFIDENCE = 60;

    static final String ESTIMATED_PITCH_WARNING =
        "Pitch estimated from building type - verify on site before ordering materials";

    private final OverpassFootprintClient client;

    @Override
    public TierDescriptor descriptor() {
        return TierType.FOOTPRINT.descriptor();
    }

    @Override
    public TierOutcome attempt(ResolutionContext context) {
        ProviderResult<List<BuildingFootprint>> result =
            client.findBuildings(context.getLatitude(), context.getLongitude());

        if (result.isNoData()) {
            return TierOutcome.failure(descriptor(), result.errorMessage());
        }
        if (!result.isSuccess()) {
            return TierOutcome.failure(descriptor(), "API error: " + result.errorMessage());
        }

        BuildingFootprint building = nearest(result.body(), context.getLatitude(), context.getLongitude());
        double areaSqM = GeoMath.footprintAreaSqM(building.outline());
        if (!(areaSqM > 0)) {
            return TierOutcome.failure(descriptor(), "Building footprint has no measurable area");
        }

        double pitch = BuildingType.fromTag(building.buildingTag()).getTypicalPitchDegrees();
        MeasurementResult measurement = MeasurementResult
            .fromFootprint(MeasurementSource.OPENSTREETMAP, PitchCalculator.squareMetersToSquareFeet(areaSqM), pitch, 1)
            .confidence(FOOTPRINT_CONFIDENCE)
            .warnings(List.of(ESTIMATED_PITCH_WARNING))
            .build();
        return TierOutcome.success(descriptor(), measurement);
    }

    private static BuildingFootprint nearest(List<BuildingFootprint> buildings, double lat, double lng) {
        return buildings.stream()
            .min(Comparator.comparingDouble(building -> {
                Coordinate center = GeoMath.centroid(building.outline());
                return GeoMath.distanceMiles(lat, lng, center.lat(), center.lng());
            }))
            .orElseThrow(() -> new IllegalStateException("Footprint result contained no buildings"));
    }
}
