package com.roof.measurement.dto;

import java.util.List;

/**
 * Outcome of the tier waterfall.
 *
 * @param measurement measurement of the tier used
 * @param tierUsed lowest-numbered tier that succeeded
 * @param tierName name of that tier
 * @param tierAccuracy accuracy band of that tier
 * @param higherTierFailures failures of attempted tiers numbered below {@code tierUsed}, ascending
 * @param fallbacksAvailable names of lower-priority tiers that were not attempted
 * @param manualTracingRequired whether resolution ended at the manual tracing placeholder
 */
public record TieredMeasurementResult(
        MeasurementResult measurement,
        int tierUsed,
        String tierName,
        String tierAccuracy,
        List<TierFailure> higherTierFailures,
        List<String> fallbacksAvailable,
        boolean manualTracingRequired) {

    public TieredMeasurementResult {
        higherTierFailures = higherTierFailures == null ? List.of() : List.copyOf(higherTierFailures);
        fallbacksAvailable = fallbacksAvailable == null ? List.of() : List.copyOf(fallbacksAvailable);
    }
}
