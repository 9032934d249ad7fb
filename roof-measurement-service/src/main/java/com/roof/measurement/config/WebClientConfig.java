package com.roof.measurement.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * WebClients for the measurement providers, one per provider so each keeps its own timeouts.
 */
@Configuration
@RequiredArgsConstructor
public class WebClientConfig {

    /** Overpass answers can be large for dense areas. */
    private static final int MAX_IN_MEMORY_BYTES = 4 * 1024 * 1024;

    private final MeasurementProperties properties;

    @Bean
    public WebClient lidarWebClient() {
        return buildWebClient(properties.getProviders().getLidar());
    }

    @Bean
    public WebClient solarWebClient() {
        return buildWebClient(properties.getProviders().getSolar());
    }

    @Bean
    public WebClient footprintWebClient() {
        return buildWebClient(properties.getProviders().getFootprint());
    }

    private WebClient buildWebClient(MeasurementProperties.Provider provider) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) provider.getConnectTimeoutMs())
            .responseTimeout(Duration.ofMillis(provider.getReadTimeoutMs()))
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(
                    provider.getReadTimeoutMs(), TimeUnit.MILLISECONDS))
            );

        return WebClient.builder()
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_BYTES))
            .build();
    }
}
