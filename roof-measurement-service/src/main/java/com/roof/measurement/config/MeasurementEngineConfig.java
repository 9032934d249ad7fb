package com.roof.measurement.config;

import com.roof.measurement.client.SolarApiClient;
import com.roof.measurement.dto.ImageryQuality;
import com.roof.measurement.tier.TierType;
import com.roof.measurement.tier.impl.SolarImageryTier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the imagery-quality tiers, which share one implementation, and the engine clock.
 */
@Configuration
public class MeasurementEngineConfig {

    @Bean
    public SolarImageryTier highQualitySolarTier(SolarApiClient solarApiClient) {
        return new SolarImageryTier(TierType.SOLAR_HIGH, ImageryQuality.HIGH, solarApiClient);
    }

    @Bean
    public SolarImageryTier mediumQualitySolarTier(SolarApiClient solarApiClient) {
        return new SolarImageryTier(TierType.SOLAR_MEDIUM, ImageryQuality.MEDIUM, solarApiClient);
    }

    @Bean
    public SolarImageryTier lowQualitySolarTier(SolarApiClient solarApiClient) {
        return new SolarImageryTier(TierType.SOLAR_LOW, ImageryQuality.LOW, solarApiClient);
    }

    @Bean
    public Clock measurementClock() {
        return Clock.systemUTC();
    }
}
