package com.roof.measurement.tier;

import com.roof.measurement.dto.MeasurementResult;
import com.roof.measurement.dto.TierDescriptor;
import com.roof.measurement.dto.TierFailure;
import com.roof.measurement.dto.TieredMeasurementResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Sequential waterfall over the measurement tiers.
 *
 * <p>Tiers are attempted in ascending tier number. The first success ends resolution and no
 * lower-priority tier is called. Every failure before it is kept, in order, in
 * {@code higherTierFailures}. The terminal tier (manual tracing) always succeeds, so resolution
 * never fails for a valid location.
 */
@Slf4j
@Component
public class TierResolver {

    private final List<MeasurementTier> tiers;

    public TierResolver(List<MeasurementTier> tiers) {
        List<MeasurementTier> ordered = new ArrayList<>(tiers);
        ordered.sort(Comparator.comparingInt(MeasurementTier::tierNumber));
        validateTiers(ordered);
        this.tiers = List.copyOf(ordered);
        log.info("Initialized tier resolver with tiers: {}",
            this.tiers.stream().map(t -> t.tierNumber() + "=" + t.descriptor().name()).toList());
    }

    // ===== PUBLIC API =====

    public TieredMeasurementResult resolve(ResolutionContext context) {
        List<TierFailure> failures = new ArrayList<>();

        for (int i = 0; i < tiers.size(); i++) {
            MeasurementTier tier = tiers.get(i);
            TierOutcome outcome = attempt(tier, context);

            if (outcome.isSuccess()) {
                log.info("Resolved measurement at tier {} ({}) after {} failed tier(s)",
                    tier.tierNumber(), tier.descriptor().name(), failures.size());
                return buildResult(outcome, failures, tiers.subList(i + 1, tiers.size()));
            }
            failures.add(outcome.toFailure());
        }

        // Only reachable if the terminal tier itself broke
        log.error("All tiers failed including the terminal tier; falling back to manual tracing placeholder");
        TierDescriptor terminal = tiers.get(tiers.size() - 1).descriptor();
        List<TierFailure> higher = failures.subList(0, failures.size() - 1);
        return new TieredMeasurementResult(MeasurementResult.manualTracingPlaceholder(),
            terminal.tierNumber(), terminal.name(), terminal.accuracy(), higher, List.of(), true);
    }

    /**
     * Attempts a single tier, converting any runtime exception into a failure outcome.
     */
    public TierOutcome attempt(MeasurementTier tier, ResolutionContext context) {
        TierDescriptor descriptor = tier.descriptor();
        log.debug("Attempting tier {} ({})", descriptor.tierNumber(), descriptor.name());
        try {
            TierOutcome outcome = tier.attempt(context);
            if (!outcome.isSuccess()) {
                log.warn("Tier {} ({}) failed: {}", descriptor.tierNumber(), descriptor.name(),
                    outcome.failureReason());
            }
            return outcome;
        } catch (RuntimeException e) {
            log.error("Unexpected error in tier {} ({}): {}", descriptor.tierNumber(), descriptor.name(),
                e.getMessage(), e);
            return TierOutcome.failure(descriptor, "Unexpected error: " + e.getMessage());
        }
    }

    /**
     * @return tiers in resolution order
     */
    public List<MeasurementTier> getTiers() {
        return tiers;
    }

    // ===== HELPERS =====

    private TieredMeasurementResult buildResult(TierOutcome outcome, List<TierFailure> failures,
            List<MeasurementTier> remaining) {
        TierDescriptor used = outcome.tier();
        List<String> fallbacks = remaining.stream().map(t -> t.descriptor().name()).toList();
        boolean manualRequired = isTerminal(used) && !outcome.measurement().hasArea();
        return new TieredMeasurementResult(outcome.measurement(), used.tierNumber(), used.name(),
            used.accuracy(), failures, fallbacks, manualRequired);
    }

    private boolean isTerminal(TierDescriptor descriptor) {
        return tiers.get(tiers.size() - 1).descriptor().equals(descriptor);
    }

    private static void validateTiers(List<MeasurementTier> ordered) {
        if (ordered.isEmpty()) {
            throw new IllegalStateException("At least one measurement tier is required");
        }
        for (int i = 1; i < ordered.size(); i++) {
            if (ordered.get(i).tierNumber() == ordered.get(i - 1).tierNumber()) {
                throw new IllegalStateException("Duplicate measurement tier number: " + ordered.get(i).tierNumber());
            }
        }
        MeasurementTier last = ordered.get(ordered.size() - 1);
        if (!last.isTerminal()) {
            throw new IllegalStateException("Last measurement tier must be terminal, found tier "
                + last.tierNumber());
        }
        for (int i = 0; i < ordered.size() - 1; i++) {
            if (ordered.get(i).isTerminal()) {
                throw new IllegalStateException("Only the last measurement tier may be terminal");
            }
        }
    }
}
