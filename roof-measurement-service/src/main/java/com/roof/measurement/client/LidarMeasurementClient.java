package com.roof.measurement.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.roof.measurement.algorithm.util.PitchCalculator;
import com.roof.measurement.config.MeasurementProperties;
import com.roof.measurement.dto.LidarMeasurement;
import com.roof.measurement.dto.ProviderResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Duration;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * Client for the LiDAR roof measurement provider.
 * A 404 means the location has no LiDAR coverage.
 */
@Service
@Slf4j
public class LidarMeasurementClient {

    private final WebClient webClient;
    private final MeasurementProperties properties;

    public LidarMeasurementClient(@Qualifier("lidarWebClient") WebClient webClient,
            MeasurementProperties properties) {
        this.webClient = webClient;
        this.properties = properties;
    }

    /**
     * Fetches the LiDAR measurement for a point.
     *
     * @param apiKey bearer token for the provider
     * @return measurement, no-data when the point is not covered, or error
     */
    public ProviderResult<LidarMeasurement> fetchMeasurement(double lat, double lng, String apiKey) {
        log.debug("Requesting LiDAR measurement for ({}, {})", lat, lng);
        long startTime = System.nanoTime();

        try {
            URI uri = UriComponentsBuilder.fromHttpUrl(ProviderUrls.endpoint(properties.getProviders().getLidar()))
                .queryParam("lat", lat)
                .queryParam("lng", lng)
                .build()
                .toUri();

            JsonNode response = webClient
                .get()
                .uri(uri)
                .headers(headers -> headers.setBearerAuth(apiKey))
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(Duration.ofMillis(properties.getProviders().getLidar().getReadTimeoutMs()))
                .block();

            long latencyMs = ProviderUrls.elapsedMs(startTime);
            if (response == null || response.isEmpty()) {
                return ProviderResult.noData(200, "Empty LiDAR response", latencyMs);
            }

            log.debug("Received LiDAR measurement in {}ms", latencyMs);
            return ProviderResult.success(toMeasurement(response), latencyMs);

        } catch (WebClientResponseException e) {
            long latencyMs = ProviderUrls.elapsedMs(startTime);
            if (e.getStatusCode().value() == HttpStatus.NOT_FOUND.value()) {
                log.debug("No LiDAR coverage for ({}, {})", lat, lng);
                return ProviderResult.noData(404, "No LiDAR coverage for this location", latencyMs);
            }
            log.warn("LiDAR provider returned HTTP error {}: {}", e.getStatusCode().value(), e.getMessage());
            return ProviderResult.error(e.getStatusCode().value(),
                String.format("HTTP %d: %s", e.getStatusCode().value(), e.getStatusText()), latencyMs);

        } catch (WebClientRequestException e) {
            long latencyMs = ProviderUrls.elapsedMs(startTime);
            log.error("Failed to connect to LiDAR provider: {}", e.getMessage());
            return ProviderResult.error(null, "Connection failed: " + e.getMessage(), latencyMs);

        } catch (Exception e) {
            long latencyMs = ProviderUrls.elapsedMs(startTime);
            log.error("Unexpected error calling LiDAR provider: {}", e.getMessage(), e);
            return ProviderResult.error(null, "Unexpected error: " + e.getMessage(), latencyMs);
        }
    }

    private LidarMeasurement toMeasurement(JsonNode response) {
        double footprintSqFt;
        if (response.hasNonNull("totalAreaSqFt")) {
            footprintSqFt = response.get("totalAreaSqFt").asDouble();
        } else {
            footprintSqFt = PitchCalculator.squareMetersToSquareFeet(response.path("totalAreaSqM").asDouble(0.0));
        }
        return new LidarMeasurement(
            footprintSqFt,
            response.path("pitchDegrees").asDouble(0.0),
            response.path("segmentCount").asInt(1),
            parseDate(response.path("imageryDate").asText(null)));
    }

    private LocalDate parseDate(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(value.length() > 10 ? value.substring(0, 10) : value);
        } catch (DateTimeParseException e) {
            log.debug("Ignoring unparseable LiDAR capture date '{}'", value);
            return null;
        }
    }
}
