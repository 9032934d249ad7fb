package com.roof.measurement.dto;

/**
 * API keys for paid measurement providers, passed explicitly into each resolution.
 */
public record ProviderCredentials(String lidarApiKey, String solarApiKey) {

    public static ProviderCredentials none() {
        return new ProviderCredentials(null, null);
    }

    public boolean hasLidarKey() {
        return lidarApiKey != null && !lidarApiKey.isBlank();
    }

    public boolean hasSolarKey() {
        return solarApiKey != null && !solarApiKey.isBlank();
    }

    @Override
    public String toString() {
        return "ProviderCredentials[lidar=" + (hasLidarKey() ? "***" : "none")
            + ", solar=" + (hasSolarKey() ? "***" : "none") + "]";
    }
}
