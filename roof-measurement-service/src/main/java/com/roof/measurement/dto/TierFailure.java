package com.roof.measurement.dto;

/**
 * Why a tier did not produce a usable measurement.
 */
public record TierFailure(int tierNumber, String tierName, String reason) {

    public static TierFailure of(TierDescriptor tier, String reason) {
        return new TierFailure(tier.tierNumber(), tier.name(), reason);
    }
}
