package com.roof.measurement.dto;

/**
 * Which tier and provider a reported measurement came from.
 */
public record SourceInfo(int tier, String name, String accuracy, MeasurementSource provider) {

    public static SourceInfo of(TierDescriptor tier, MeasurementSource provider) {
        return new SourceInfo(tier.tierNumber(), tier.name(), tier.accuracy(), provider);
    }
}
