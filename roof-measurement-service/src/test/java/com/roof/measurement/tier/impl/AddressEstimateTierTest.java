package com.roof.measurement.tier.impl;

import com.roof.measurement.config.MeasurementProperties;
import com.roof.measurement.dto.GafReport;
import com.roof.measurement.dto.MeasurementResult;
import com.roof.measurement.dto.MeasurementSource;
import com.roof.measurement.repository.InMemoryCalibrationStore;
import com.roof.measurement.tier.ResolutionContext;
import com.roof.measurement.tier.TierOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("Address Estimate Tier Tests")
class AddressEstimateTierTest {

    private static final double LAT = 39.7392;
    private static final double LNG = -104.9903;
    private static final ResolutionContext CONTEXT =
        new ResolutionContext(LAT, LNG, "123 Main St, Denver, CO", null);

    private InMemoryCalibrationStore store;
    private AddressEstimateTier tier;

    @BeforeEach
    void setUp() {
        store = new InMemoryCalibrationStore();
        tier = new AddressEstimateTier(store, new MeasurementProperties());
    }

    private void addReport(double latOffset, Double areaSqFt, Double pitchDegrees) {
        store.saveReport(GafReport.builder()
            .reportId(UUID.randomUUID().toString())
            .latitude(LAT + latOffset)
            .longitude(LNG)
            .totalAreaSqFt(areaSqFt)
            .pitchDegrees(pitchDegrees)
            .build());
    }

    @Test
    @DisplayName("Median area and mean pitch of nearby verified reports")
    void medianOfNearbyReports() {
        addReport(0.001, 1800.0, 20.0);
        addReport(0.002, 2400.0, null);
        addReport(0.003, 2000.0, 30.0);
        addReport(0.004, 9000.0, 25.0);

        TierOutcome outcome = tier.attempt(CONTEXT);

        assertThat(outcome.isSuccess()).isTrue();
        MeasurementResult measurement = outcome.measurement();
        assertThat(measurement.source()).isEqualTo(MeasurementSource.ADDRESS_ESTIMATE);
        assertThat(measurement.adjustedAreaSqFt()).isCloseTo(2200.0, within(1e-9));
        assertThat(measurement.pitchDegrees()).isCloseTo(25.0, within(1e-9));
        assertThat(measurement.confidence()).isEqualTo(45);
        assertThat(measurement.warnings()).containsExactly(AddressEstimateTier.ESTIMATE_WARNING);
    }

    @Test
    void defaultPitchWhenNoneKnown() {
        addReport(0.001, 1800.0, null);
        addReport(0.002, 2000.0, null);
        addReport(0.003, 2200.0, null);

        TierOutcome outcome = tier.attempt(CONTEXT);

        assertThat(outcome.measurement().pitchDegrees()).isEqualTo(AddressEstimateTier.DEFAULT_PITCH_DEGREES);
        assertThat(outcome.measurement().adjustedAreaSqFt()).isCloseTo(2000.0, within(1e-9));
    }

    @Test
    void requiresAddress() {
        addReport(0.001, 1800.0, 20.0);

        TierOutcome outcome = tier.attempt(new ResolutionContext(LAT, LNG, "  ", null));

        assertThat(outcome.failureReason()).isEqualTo("No address provided for address-based estimate");
    }

    @Test
    @DisplayName("Reports outside the radius or without an area do not count")
    void tooFewSamples() {
        addReport(0.001, 1800.0, 20.0);
        addReport(0.002, null, 20.0);
        addReport(1.0, 2000.0, 20.0);

        TierOutcome outcome = tier.attempt(CONTEXT);

        assertThat(outcome.isSuccess()).isFalse();
        assertThat(outcome.failureReason()).isEqualTo("Only 1 verified report(s) within 5.0 miles (need 3)");
    }

    @Test
    void storeFailureBecomesTierFailure() {
        store.failWith(new IllegalStateException("table unavailable"));

        assertThat(tier.attempt(CONTEXT).failureReason())
            .isEqualTo("Historical report lookup failed: table unavailable");
    }
}
