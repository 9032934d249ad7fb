package com.roof.measurement.tier.impl;

import com.roof.measurement.dto.MeasurementResult;
import com.roof.measurement.dto.TierDescriptor;
import com.roof.measurement.tier.MeasurementTier;
import com.roof.measurement.tier.ResolutionContext;
import com.roof.measurement.tier.TierOutcome;
import com.roof.measurement.tier.TierType;
import org.springframework.stereotype.Component;

/**
 * Tier 7: always succeeds with a zero-area placeholder asking the user to trace the roof.
 */
@Component
public class ManualTracingTier implements MeasurementTier {

    @Override
    public TierDescriptor descriptor() {
        return TierType.MANUAL.descriptor();
    }

    @Override
    public TierOutcome attempt(ResolutionContext context) {
        return TierOutcome.success(descriptor(), MeasurementResult.manualTracingPlaceholder());
    }

    @Override
    public boolean isTerminal() {
        return true;
    }
}
