package com.roof.measurement.tier;

import com.roof.measurement.dto.ProviderCredentials;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Per-request inputs shared by all tiers of one resolution.
 *
 * <p>Tiers backed by the same provider call share one provider response through
 * {@link #fetchOnce(String, Supplier)}, so the provider is called at most once per request.
 */
public final class ResolutionContext {

    private final double latitude;
    private final double longitude;
    private final String address;
    private final ProviderCredentials credentials;
    private final Map<String, Object> providerResponses = new ConcurrentHashMap<>();

    public ResolutionContext(double latitude, double longitude, String address, ProviderCredentials credentials) {
        this.latitude = latitude;
        this.longitude = longitude;
        this.address = address;
        this.credentials = credentials != null ? credentials : ProviderCredentials.none();
    }

    public double getLatitude() {
        return latitude;
    }

    public double getLongitude() {
        return longitude;
    }

    public String getAddress() {
        return address;
    }

    public boolean hasAddress() {
        return address != null && !address.isBlank();
    }

    public ProviderCredentials getCredentials() {
        return credentials;
    }

    /**
     * Returns the cached response for {@code key}, loading it on first use. The loader must not
     * return null.
     */
    @SuppressWarnings("unchecked")
    public <T> T fetchOnce(String key, Supplier<T> loader) {
        return (T) providerResponses.computeIfAbsent(key, k -> loader.get());
    }
}
