package com.roof.measurement.tier.impl;

import com.roof.measurement.algorithm.util.PitchCalculator;
import com.roof.measurement.algorithm.util.PitchCalculator.RoofSegment;
import com.roof.measurement.client.SolarApiClient;
import com.roof.measurement.dto.ImageryQuality;
import com.roof.measurement.dto.MeasurementResult;
import com.roof.measurement.dto.MeasurementSource;
import com.roof.measurement.dto.ProviderCredentials;
import com.roof.measurement.dto.ProviderResult;
import com.roof.measurement.dto.SolarBuildingInsight;
import com.roof.measurement.tier.ResolutionContext;
import com.roof.measurement.tier.TierOutcome;
import com.roof.measurement.tier.TierType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("Solar Imagery Tier Tests")
class SolarImageryTierTest {

    private static final double LAT = 39.7392;
    private static final double LNG = -104.9903;
    private static final LocalDate IMAGERY_DATE = LocalDate.of(2023, 6, 15);
    private static final List<RoofSegment> SEGMENTS = List.of(new RoofSegment(20.0, 100.0), new RoofSegment(30.0, 100.0));

    @Mock
    private SolarApiClient client;

    private SolarImageryTier high;
    private SolarImageryTier medium;
    private SolarImageryTier low;
    private ResolutionContext context;

    @BeforeEach
    void setUp() {
        high = new SolarImageryTier(TierType.SOLAR_HIGH, ImageryQuality.HIGH, client);
        medium = new SolarImageryTier(TierType.SOLAR_MEDIUM, ImageryQuality.MEDIUM, client);
        low = new SolarImageryTier(TierType.SOLAR_LOW, ImageryQuality.LOW, client);
        context = new ResolutionContext(LAT, LNG, null, new ProviderCredentials(null, "solar-key"));
    }

    private void respondWith(ImageryQuality quality) {
        when(client.findClosestBuilding(LAT, LNG, "solar-key"))
            .thenReturn(ProviderResult.success(new SolarBuildingInsight(quality, IMAGERY_DATE, SEGMENTS), 5));
    }

    @Test
    @DisplayName("HIGH imagery succeeds at tier 2 with sloped area taken as-is")
    void highQualityImagery() {
        respondWith(ImageryQuality.HIGH);

        TierOutcome outcome = high.attempt(context);

        assertTrue(outcome.isSuccess());
        MeasurementResult measurement = outcome.measurement();
        assertEquals(MeasurementSource.GOOGLE_SOLAR, measurement.source());
        assertEquals(90, measurement.confidence());
        assertEquals(25.0, measurement.pitchDegrees(), 1e-9);
        assertEquals(200.0 * PitchCalculator.SQ_FEET_PER_SQ_METER, measurement.adjustedAreaSqFt(), 1e-6);
        assertEquals(measurement.adjustedAreaSqFt(), measurement.rawAreaSqFt() * measurement.pitchMultiplier(), 1e-6);
        assertEquals(2, measurement.segmentCount());
        assertEquals(ImageryQuality.HIGH, measurement.imageryQuality());
        assertEquals(IMAGERY_DATE, measurement.imageryDate());
    }

    @Test
    @DisplayName("MEDIUM imagery fails the HIGH floor but passes the MEDIUM floor from one provider call")
    void mediumImageryFallsThroughOnce() {
        respondWith(ImageryQuality.MEDIUM);

        TierOutcome highOutcome = high.attempt(context);
        TierOutcome mediumOutcome = medium.attempt(context);

        assertFalse(highOutcome.isSuccess());
        assertEquals("Only MEDIUM quality imagery available (not HIGH)", highOutcome.failureReason());
        assertTrue(mediumOutcome.isSuccess());
        assertEquals(85, mediumOutcome.measurement().confidence());
        verify(client, times(1)).findClosestBuilding(LAT, LNG, "solar-key");
    }

    @Test
    @DisplayName("UNKNOWN imagery is graded as LOW")
    void unknownImageryTreatedAsLow() {
        respondWith(ImageryQuality.UNKNOWN);

        assertFalse(medium.attempt(context).isSuccess());
        TierOutcome lowOutcome = low.attempt(context);
        assertTrue(lowOutcome.isSuccess());
        assertEquals(75, lowOutcome.measurement().confidence());
    }

    @Test
    void missingKeyFailsWithoutCallingProvider() {
        ResolutionContext noKey = new ResolutionContext(LAT, LNG, null, ProviderCredentials.none());

        TierOutcome outcome = high.attempt(noKey);

        assertEquals("Solar imagery API key not configured", outcome.failureReason());
        verifyNoInteractions(client);
    }

    @Test
    void noBuildingDataFails() {
        when(client.findClosestBuilding(anyDouble(), anyDouble(), anyString()))
            .thenReturn(ProviderResult.noData(404, "not found", 3));

        assertEquals("No building data available for this location", low.attempt(context).failureReason());
    }

    @Test
    void providerErrorIsReported() {
        when(client.findClosestBuilding(anyDouble(), anyDouble(), anyString()))
            .thenReturn(ProviderResult.error(500, "HTTP 500: Internal Server Error", 3));

        assertEquals("API error: HTTP 500: Internal Server Error", low.attempt(context).failureReason());
    }

    @Test
    void emptySegmentsFail() {
        when(client.findClosestBuilding(anyDouble(), anyDouble(), anyString()))
            .thenReturn(ProviderResult.success(new SolarBuildingInsight(ImageryQuality.HIGH, IMAGERY_DATE, List.of()), 3));

        assertEquals("No roof segments in imagery data", high.attempt(context).failureReason());
    }
}
