package com.roof.measurement.tier;

import com.roof.measurement.dto.TierDescriptor;

/**
 * One ranked measurement source. Implementations translate provider answers into a
 * {@link TierOutcome} and report unusable data as a failure rather than throwing.
 */
public interface MeasurementTier {

    TierDescriptor descriptor();

    /**
     * Attempt a measurement for the context's location.
     *
     * @param context location, credentials and per-request provider cache
     * @return success with a viable measurement, or failure with a specific reason
     */
    TierOutcome attempt(ResolutionContext context);

    /**
     * Whether this tier ends the waterfall. A terminal tier always succeeds.
     */
    default boolean isTerminal() {
        return false;
    }

    default int tierNumber() {
        return descriptor().tierNumber();
    }
}
