package com.roof.measurement.client;

import com.roof.measurement.config.MeasurementProperties;

/**
 * Joins a provider's base URL and path.
 */
final class ProviderUrls {

    private static final String PATH_SEPARATOR = "/";

    private ProviderUrls() {}

    static String endpoint(MeasurementProperties.Provider provider) {
        String baseUrl = provider.getBaseUrl();
        String path = provider.getPath();

        // Ensure baseUrl doesn't end with slash and path starts with slash
        if (baseUrl.endsWith(PATH_SEPARATOR)) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }
        if (!path.startsWith(PATH_SEPARATOR)) {
            path = PATH_SEPARATOR + path;
        }
        return baseUrl + path;
    }

    static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
