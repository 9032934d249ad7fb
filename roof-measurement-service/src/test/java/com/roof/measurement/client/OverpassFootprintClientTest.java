package com.roof.measurement.client;

import com.roof.measurement.algorithm.util.GeoMath.Coordinate;
import com.roof.measurement.config.MeasurementProperties;
import com.roof.measurement.dto.BuildingFootprint;
import com.roof.measurement.dto.ProviderResult;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import java.io.IOException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for OverpassFootprintClient using MockWebServer.
 */
class OverpassFootprintClientTest {

    private MockWebServer mockWebServer;
    private OverpassFootprintClient client;

    @BeforeEach
    void setUp() throws IOException {
        mockWebServer = new MockWebServer();
        mockWebServer.start();

        MeasurementProperties properties = new MeasurementProperties();
        properties.getProviders().getFootprint().setBaseUrl(String.format("http://localhost:%s", mockWebServer.getPort()));
        properties.getProviders().getFootprint().setReadTimeoutMs(2000);

        client = new OverpassFootprintClient(WebClient.builder().build(), properties);
    }

    @AfterEach
    void tearDown() throws IOException {
        mockWebServer.shutdown();
    }

    @Test
    void findBuildings_ParsesWays() throws InterruptedException {
        mockWebServer.enqueue(new MockResponse()
            .setResponseCode(200)
            .setHeader("Content-Type", "application/json")
            .setBody("""
                {"elements": [
                  {"type": "way", "tags": {"building": "house"}, "geometry": [
                    {"lat": 39.7392, "lon": -104.9903},
                    {"lat": 39.7392, "lon": -104.9901},
                    {"lat": 39.7394, "lon": -104.9901},
                    {"lat": 39.7394, "lon": -104.9903},
                    {"lat": 39.7392, "lon": -104.9903}
                  ]},
                  {"type": "way", "tags": {}, "geometry": [
                    {"lat": 39.7390, "lon": -104.9900},
                    {"lat": 39.7391, "lon": -104.9900}
                  ]}
                ]}
                """));

        ProviderResult<List<BuildingFootprint>> result = client.findBuildings(39.7392, -104.9903);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.body()).hasSize(1);
        BuildingFootprint building = result.body().get(0);
        assertThat(building.buildingTag()).isEqualTo("house");
        assertThat(building.outline()).hasSize(5).startsWith(new Coordinate(39.7392, -104.9903));

        RecordedRequest request = mockWebServer.takeRequest();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getPath()).isEqualTo("/api/interpreter");
        assertThat(request.getHeader("Content-Type")).startsWith("application/x-www-form-urlencoded");
        String form = URLDecoder.decode(request.getBody().readUtf8(), StandardCharsets.UTF_8);
        assertThat(form).isEqualTo("data=" + OverpassFootprintClient.buildQuery(39.7392, -104.9903));
    }

    @Test
    void findBuildings_NoElements() {
        mockWebServer.enqueue(new MockResponse()
            .setResponseCode(200)
            .setHeader("Content-Type", "application/json")
            .setBody("{\"elements\":[]}"));

        ProviderResult<List<BuildingFootprint>> result = client.findBuildings(39.7392, -104.9903);

        assertThat(result.isNoData()).isTrue();
        assertThat(result.errorMessage()).isEqualTo("No building footprint found within 50 m");
    }

    @Test
    void findBuildings_RateLimited() {
        mockWebServer.enqueue(new MockResponse().setResponseCode(429).setBody("Too Many Requests"));

        ProviderResult<List<BuildingFootprint>> result = client.findBuildings(39.7392, -104.9903);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.httpStatus()).isEqualTo(429);
        assertThat(result.errorMessage()).startsWith("HTTP 429");
    }

    @Test
    void buildQuery_UsesSearchRadius() {
        assertThat(OverpassFootprintClient.buildQuery(39.7392, -104.9903))
            .isEqualTo("[out:json];way(around:50,39.7392000,-104.9903000)[\"building\"];out geom;");
    }
}
