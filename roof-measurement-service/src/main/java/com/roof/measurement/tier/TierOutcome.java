package com.roof.measurement.tier;

import com.roof.measurement.dto.MeasurementResult;
import com.roof.measurement.dto.TierDescriptor;
import com.roof.measurement.dto.TierFailure;

/**
 * Tagged result of one tier attempt: a measurement or a failure reason, never both.
 */
public record TierOutcome(TierDescriptor tier, MeasurementResult measurement, String failureReason) {

    public static TierOutcome success(TierDescriptor tier, MeasurementResult measurement) {
        if (measurement == null) {
            throw new IllegalArgumentException("Successful outcome requires a measurement");
        }
        return new TierOutcome(tier, measurement, null);
    }

    public static TierOutcome failure(TierDescriptor tier, String reason) {
        return new TierOutcome(tier, null, reason);
    }

    public boolean isSuccess() {
        return measurement != null;
    }

    public TierFailure toFailure() {
        return TierFailure.of(tier, failureReason);
    }
}
