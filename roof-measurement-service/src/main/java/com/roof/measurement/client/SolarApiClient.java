package com.roof.measurement.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.roof.measurement.algorithm.util.PitchCalculator.RoofSegment;
import com.roof.measurement.config.MeasurementProperties;
import com.roof.measurement.dto.ImageryQuality;
import com.roof.measurement.dto.ProviderResult;
import com.roof.measurement.dto.SolarBuildingInsight;
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
import java.time.DateTimeException;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Client for the Google Solar building insights API.
 *
 * <p>Requests the closest building with {@code requiredQuality=LOW} so one call serves every
 * imagery-quality tier.
 */
@Service
@Slf4j
public class SolarApiClient {

    private final WebClient webClient;
    private final MeasurementProperties properties;

    public SolarApiClient(@Qualifier("solarWebClient") WebClient webClient, MeasurementProperties properties) {
        this.webClient = webClient;
        this.properties = properties;
    }

    public ProviderResult<SolarBuildingInsight> findClosestBuilding(double lat, double lng, String apiKey) {
        log.debug("Requesting solar building insights for ({}, {})", lat, lng);
        long startTime = System.nanoTime();

        try {
            URI uri = UriComponentsBuilder.fromHttpUrl(ProviderUrls.endpoint(properties.getProviders().getSolar()))
                .queryParam("location.latitude", lat)
                .queryParam("location.longitude", lng)
                .queryParam("requiredQuality", "LOW")
                .queryParam("key", apiKey)
                .build()
                .toUri();

            JsonNode response = webClient
                .get()
                .uri(uri)
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(Duration.ofMillis(properties.getProviders().getSolar().getReadTimeoutMs()))
                .block();

            long latencyMs = ProviderUrls.elapsedMs(startTime);
            if (response == null || response.isEmpty()) {
                return ProviderResult.noData(200, "No building data available for this location", latencyMs);
            }

            SolarBuildingInsight insight = toInsight(response);
            log.debug("Received solar insights in {}ms - quality: {}, segments: {}",
                latencyMs, insight.imageryQuality(), insight.segments().size());
            return ProviderResult.success(insight, latencyMs);

        } catch (WebClientResponseException e) {
            long latencyMs = ProviderUrls.elapsedMs(startTime);
            if (e.getStatusCode().value() == HttpStatus.NOT_FOUND.value()) {
                log.debug("Solar API has no building at ({}, {})", lat, lng);
                return ProviderResult.noData(404, "No building data available for this location", latencyMs);
            }
            // The response body may contain the API key in an echoed URL; log the status only
            log.warn("Solar API returned HTTP error {}", e.getStatusCode().value());
            return ProviderResult.error(e.getStatusCode().value(),
                String.format("HTTP %d: %s", e.getStatusCode().value(), e.getStatusText()), latencyMs);

        } catch (WebClientRequestException e) {
            long latencyMs = ProviderUrls.elapsedMs(startTime);
            log.error("Failed to connect to Solar API: {}", e.getClass().getSimpleName());
            return ProviderResult.error(null, "Connection failed: " + e.getMostSpecificCause().getMessage(), latencyMs);

        } catch (Exception e) {
            long latencyMs = ProviderUrls.elapsedMs(startTime);
            log.error("Unexpected error calling Solar API: {}", e.getMessage(), e);
            return ProviderResult.error(null, "Unexpected error: " + e.getMessage(), latencyMs);
        }
    }

    private SolarBuildingInsight toInsight(JsonNode response) {
        List<RoofSegment> segments = new ArrayList<>();
        for (JsonNode segment : response.path("solarPotential").path("roofSegmentStats")) {
            double area = segment.path("stats").path("areaMeters2").asDouble(0.0);
            double pitch = segment.path("pitchDegrees").asDouble(0.0);
            if (area > 0 && pitch >= 0 && pitch < 90) {
                segments.add(new RoofSegment(pitch, area));
            }
        }
        return new SolarBuildingInsight(
            ImageryQuality.fromString(response.path("imageryQuality").asText(null)),
            parseImageryDate(response.path("imageryDate")),
            segments);
    }

    private LocalDate parseImageryDate(JsonNode date) {
        if (date.isMissingNode() || !date.hasNonNull("year")) {
            return null;
        }
        try {
            return LocalDate.of(date.get("year").asInt(),
                Math.max(1, date.path("month").asInt(1)),
                Math.max(1, date.path("day").asInt(1)));
        } catch (DateTimeException e) {
            log.debug("Ignoring invalid imagery date {}", date);
            return null;
        }
    }
}
