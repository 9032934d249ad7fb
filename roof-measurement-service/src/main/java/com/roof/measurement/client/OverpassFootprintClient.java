package com.roof.measurement.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.roof.measurement.algorithm.util.GeoMath.Coordinate;
import com.roof.measurement.config.MeasurementProperties;
import com.roof.measurement.dto.BuildingFootprint;
import com.roof.measurement.dto.ProviderResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Client for the OpenStreetMap Overpass API. Returns building outlines near a point.
 */
@Service
@Slf4j
public class OverpassFootprintClient {

    /** Search radius around the point, in metres. */
    static final int SEARCH_RADIUS_METERS = 50;

    private final WebClient webClient;
    private final MeasurementProperties properties;

    public OverpassFootprintClient(@Qualifier("footprintWebClient") WebClient webClient,
            MeasurementProperties properties) {
        this.webClient = webClient;
        this.properties = properties;
    }

    public ProviderResult<List<BuildingFootprint>> findBuildings(double lat, double lng) {
        log.debug("Querying building footprints around ({}, {})", lat, lng);
        long startTime = System.nanoTime();

        try {
            JsonNode response = webClient
                .post()
                .uri(ProviderUrls.endpoint(properties.getProviders().getFootprint()))
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .accept(MediaType.APPLICATION_JSON)
                .body(BodyInserters.fromFormData("data", buildQuery(lat, lng)))
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(Duration.ofMillis(properties.getProviders().getFootprint().getReadTimeoutMs()))
                .block();

            long latencyMs = ProviderUrls.elapsedMs(startTime);
            List<BuildingFootprint> buildings = response == null ? List.of() : toFootprints(response);
            if (buildings.isEmpty()) {
                return ProviderResult.noData(200,
                    "No building footprint found within " + SEARCH_RADIUS_METERS + " m", latencyMs);
            }

            log.debug("Found {} building footprint(s) in {}ms", buildings.size(), latencyMs);
            return ProviderResult.success(buildings, latencyMs);

        } catch (WebClientResponseException e) {
            long latencyMs = ProviderUrls.elapsedMs(startTime);
            log.warn("Overpass API returned HTTP error {}: {}", e.getStatusCode().value(), e.getMessage());
            return ProviderResult.error(e.getStatusCode().value(),
                String.format("HTTP %d: %s", e.getStatusCode().value(), e.getStatusText()), latencyMs);

        } catch (WebClientRequestException e) {
            long latencyMs = ProviderUrls.elapsedMs(startTime);
            log.error("Failed to connect to Overpass API: {}", e.getMessage());
            return ProviderResult.error(null, "Connection failed: " + e.getMessage(), latencyMs);

        } catch (Exception e) {
            long latencyMs = ProviderUrls.elapsedMs(startTime);
            log.error("Unexpected error calling Overpass API: {}", e.getMessage(), e);
            return ProviderResult.error(null, "Unexpected error: " + e.getMessage(), latencyMs);
        }
    }

    static String buildQuery(double lat, double lng) {
        return String.format(Locale.ROOT,
            "[out:json];way(around:%d,%.7f,%.7f)[\"building\"];out geom;", SEARCH_RADIUS_METERS, lat, lng);
    }

    private List<BuildingFootprint> toFootprints(JsonNode response) {
        List<BuildingFootprint> footprints = new ArrayList<>();
        for (JsonNode element : response.path("elements")) {
            List<Coordinate> outline = new ArrayList<>();
            for (JsonNode point : element.path("geometry")) {
                if (point.hasNonNull("lat") && point.hasNonNull("lon")) {
                    outline.add(new Coordinate(point.get("lat").asDouble(), point.get("lon").asDouble()));
                }
            }
            if (outline.size() >= 3) {
                footprints.add(new BuildingFootprint(element.path("tags").path("building").asText(null), outline));
            }
        }
        return footprints;
    }
}
