package com.roof.measurement.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the measurement service.
 * Maps to the 'measurement' section in application.yml.
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "measurement")
public class MeasurementProperties {

    @Valid
    private Providers providers = new Providers();
    @Valid
    private CrossValidation crossValidation = new CrossValidation();
    @Valid
    private Calibration calibration = new Calibration();
    @Valid
    private AddressEstimate addressEstimate = new AddressEstimate();
    @Valid
    private Parallel parallel = new Parallel();

    @Data
    public static class Providers {
        @Valid
        private Provider lidar = new Provider("https://api.instantroofer.com", "/v1/measurements");
        @Valid
        private Provider solar = new Provider("https://solar.googleapis.com", "/v1/buildingInsights:findClosest");
        @Valid
        private Provider footprint = new Provider("https://overpass-api.de", "/api/interpreter");
    }

    @Data
    public static class Provider {
        @NotBlank
        private String baseUrl;
        @NotBlank
        private String path;
        @Positive
        private long connectTimeoutMs = 2000;
        @Positive
        private long readTimeoutMs = 8000;
        /** Key used when the caller supplies none; blank disables the provider's tiers. */
        private String apiKey;

        public Provider() {
        }

        public Provider(String baseUrl, String path) {
            this.baseUrl = baseUrl;
            this.path = path;
        }
    }

    @Data
    public static class CrossValidation {
        /** Relative pairwise difference above which two candidates are reported as discrepant. */
        @DecimalMin(value = "0.0", inclusive = false)
        @DecimalMax("100.0")
        private double discrepancyThresholdPercent = 10.0;
    }

    @Data
    public static class Calibration {
        @DecimalMin(value = "0.0", inclusive = false)
        private double exactMatchToleranceMiles = 0.1;
        @DecimalMin(value = "0.0", inclusive = false)
        private double regionalRadiusMiles = 15.0;
        @Min(1)
        private int minSampleCount = 3;
        @DecimalMin(value = "0.0", inclusive = false)
        private double outlierStdDevs = 2.0;
    }

    @Data
    public static class AddressEstimate {
        @DecimalMin(value = "0.0", inclusive = false)
        private double radiusMiles = 5.0;
        @Min(1)
        private int minSampleCount = 3;
    }

    @Data
    public static class Parallel {
        @Min(1)
        private int workers = 4;
        @Min(1)
        private int queueCapacity = 100;
        @Positive
        private long timeoutMs = 10000;
    }
}
