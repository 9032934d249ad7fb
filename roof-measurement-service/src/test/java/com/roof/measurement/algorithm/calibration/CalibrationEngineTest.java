package com.roof.measurement.algorithm.calibration;

import com.roof.measurement.algorithm.util.GeoMath;
import com.roof.measurement.config.MeasurementProperties;
import com.roof.measurement.dto.GafCalibrationResult;
import com.roof.measurement.dto.GafReport;
import com.roof.measurement.dto.MeasurementResult;
import com.roof.measurement.dto.MeasurementSource;
import com.roof.measurement.dto.RegionalCalibration;
import com.roof.measurement.exception.MeasurementProcessingException;
import com.roof.measurement.repository.InMemoryCalibrationStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("Calibration Engine Tests")
class CalibrationEngineTest {

    private static final double LAT = 39.7392;
    private static final double LNG = -104.9903;
    private static final String ADDRESS = "123 Main St, Denver, CO";
    private static final Instant UPLOADED = Instant.parse("2024-05-01T12:00:00Z");

    private InMemoryCalibrationStore store;
    private CalibrationEngine engine;

    @BeforeEach
    void setUp() {
        store = new InMemoryCalibrationStore();
        engine = new CalibrationEngine(store, new MeasurementProperties());
    }

    private static GafReport report(String id, double lat, double lng, Double verified, Double estimated,
            String address) {
        return GafReport.builder()
            .reportId(id)
            .address(address)
            .normalizedAddress(CalibrationEngine.normalizeAddress(address))
            .latitude(lat)
            .longitude(lng)
            .regionCode(GeoMath.regionCode(lat, lng))
            .totalAreaSqFt(verified)
            .estimatedAreaSqFt(estimated)
            .uploadedAt(UPLOADED)
            .build();
    }

    @Nested
    @DisplayName("Exact match")
    class ExactMatchTests {

        @Test
        @DisplayName("Verified report for the same building gives verified / candidate")
        void exactMatchFactor() {
            store.saveReport(report("r1", LAT + 0.0001, LNG, 2100.0, null, ADDRESS));

            GafCalibrationResult result = engine.findCalibration(LAT, LNG, ADDRESS, 2000.0).orElseThrow();

            assertThat(result.exactMatch()).isTrue();
            assertThat(result.calibrationFactor()).isCloseTo(1.05, within(1e-9));
            assertThat(result.referenceAreaSqFt()).isEqualTo(2100.0);
            assertThat(result.basedOnReports()).isEqualTo(1);
            assertThat(result.lastCalibrated()).isEqualTo(UPLOADED);
        }

        @Test
        @DisplayName("Address comparison ignores case and spacing")
        void addressNormalized() {
            store.saveReport(report("r1", LAT, LNG, 2100.0, null, ADDRESS));

            assertThat(engine.findCalibration(LAT, LNG, "  123 MAIN   st, denver, co ", 2000.0))
                .get().extracting(GafCalibrationResult::exactMatch).isEqualTo(true);
        }

        @Test
        @DisplayName("Same address far away is not an exact match")
        void distantAddressIgnored() {
            store.saveReport(report("r1", LAT + 0.05, LNG, 2100.0, null, ADDRESS));

            assertThat(engine.findCalibration(LAT, LNG, ADDRESS, 2000.0)).isEmpty();
        }

        @Test
        void normalizeAddress() {
            assertThat(CalibrationEngine.normalizeAddress("  A  b\tC ")).isEqualTo("a b c");
            assertThat(CalibrationEngine.normalizeAddress("   ")).isNull();
            assertThat(CalibrationEngine.normalizeAddress(null)).isNull();
        }
    }

    @Nested
    @DisplayName("Regional calibration")
    class RegionalTests {

        @Test
        @DisplayName("Stored bucket with enough samples is used")
        void storedBucket() {
            store.saveRegionalCalibration(RegionalCalibration.builder()
                .regionCode(GeoMath.regionCode(LAT, LNG))
                .calibrationFactor(1.08)
                .sampleCount(5)
                .lastUpdated(UPLOADED)
                .build());

            GafCalibrationResult result = engine.findCalibration(LAT, LNG, null, 2000.0).orElseThrow();

            assertThat(result.exactMatch()).isFalse();
            assertThat(result.calibrationFactor()).isEqualTo(1.08);
            assertThat(result.basedOnReports()).isEqualTo(5);
            assertThat(result.referenceAreaSqFt()).isNull();
        }

        @Test
        @DisplayName("Sparse bucket is ignored")
        void sparseBucketIgnored() {
            store.saveRegionalCalibration(RegionalCalibration.builder()
                .regionCode(GeoMath.regionCode(LAT, LNG))
                .calibrationFactor(1.08)
                .sampleCount(2)
                .build());

            assertThat(engine.findCalibration(LAT, LNG, null, 2000.0)).isEmpty();
        }

        @Test
        @DisplayName("Nearby reports are aggregated with proximity weights")
        void nearbyAggregation() {
            store.saveReport(report("a", LAT + 0.01, LNG, 2200.0, 2000.0, "1 A St"));
            store.saveReport(report("b", LAT + 0.05, LNG, 1800.0, 2000.0, "2 B St"));
            store.saveReport(report("c", LAT - 0.02, LNG, 2000.0, 2000.0, "3 C St"));
            store.saveReport(report("no-estimate", LAT, LNG + 0.01, 5000.0, null, "4 D St"));

            GafCalibrationResult result = engine.findCalibration(LAT, LNG, null, 2000.0).orElseThrow();

            double wa = 1.0 / (1.0 + GeoMath.distanceMiles(LAT, LNG, LAT + 0.01, LNG));
            double wb = 1.0 / (1.0 + GeoMath.distanceMiles(LAT, LNG, LAT + 0.05, LNG));
            double wc = 1.0 / (1.0 + GeoMath.distanceMiles(LAT, LNG, LAT - 0.02, LNG));
            double expected = (wa * 1.1 + wb * 0.9 + wc * 1.0) / (wa + wb + wc);
            assertThat(result.calibrationFactor()).isCloseTo(expected, within(1e-9));
            assertThat(result.basedOnReports()).isEqualTo(3);
            assertThat(result.exactMatch()).isFalse();
        }

        @Test
        @DisplayName("Outliers beyond two standard deviations are dropped")
        void outlierRemoved() {
            for (int i = 0; i < 7; i++) {
                store.saveReport(report("in-" + i, LAT + 0.01 * (i + 1), LNG, 2000.0, 2000.0, i + " Elm St"));
            }
            store.saveReport(report("outlier", LAT - 0.01, LNG, 4000.0, 2000.0, "9 Oak St"));

            GafCalibrationResult result = engine.findCalibration(LAT, LNG, null, 2000.0).orElseThrow();

            assertThat(result.calibrationFactor()).isCloseTo(1.0, within(1e-9));
            assertThat(result.basedOnReports()).isEqualTo(7);
        }

        @Test
        @DisplayName("Too few nearby reports yields no calibration")
        void tooFewReports() {
            store.saveReport(report("a", LAT + 0.01, LNG, 2200.0, 2000.0, "1 A St"));
            store.saveReport(report("b", LAT + 0.02, LNG, 2200.0, 2000.0, "2 B St"));

            assertThat(engine.findCalibration(LAT, LNG, null, 2000.0)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Edge cases")
    class EdgeCaseTests {

        @Test
        @DisplayName("Candidate without area is never calibrated")
        void zeroCandidate() {
            store.saveReport(report("r1", LAT, LNG, 2100.0, null, ADDRESS));

            assertThat(engine.findCalibration(LAT, LNG, ADDRESS, 0.0)).isEmpty();
            assertThat(engine.findCalibration(LAT, LNG, ADDRESS, -10.0)).isEmpty();
        }

        @Test
        @DisplayName("Store failure is treated as no calibration")
        void storeFailure() {
            store.failWith(new MeasurementProcessingException("store down"));

            assertThat(engine.findCalibration(LAT, LNG, ADDRESS, 2000.0)).isEmpty();
        }

        @Test
        @DisplayName("Applying nothing returns the same measurement")
        void applyNothing() {
            MeasurementResult measurement =
                MeasurementResult.fromFootprint(MeasurementSource.GOOGLE_SOLAR, 1800.0, 22.0, 4).build();

            assertThat(engine.apply(measurement, null)).isSameAs(measurement);
            assertThat(engine.apply(measurement,
                new GafCalibrationResult(1.0, 4, null, false, "39.7,-105.0", null))).isSameAs(measurement);
            assertThat(engine.apply(measurement,
                new GafCalibrationResult(1.1, 4, null, false, "39.7,-105.0", null)).adjustedAreaSqFt())
                .isCloseTo(measurement.adjustedAreaSqFt() * 1.1, within(1e-9));
        }
    }

    @Nested
    @DisplayName("Region aggregation")
    class AggregationTests {

        @Test
        void aggregatesRatiosOfReportsWithEstimates() {
            List<GafReport> reports = new ArrayList<>(List.of(
                report("a", LAT, LNG, 2200.0, 2000.0, "1 A St"),
                report("b", LAT, LNG, 1800.0, 2000.0, "2 B St"),
                report("c", LAT, LNG, 2000.0, 2000.0, "3 C St"),
                report("d", LAT, LNG, 2500.0, null, "4 D St")));
            Instant now = Instant.parse("2024-06-01T00:00:00Z");

            Optional<RegionalCalibration> bucket = engine.aggregateRegion("39.7,-105.0", reports, now);

            assertThat(bucket).isPresent();
            assertThat(bucket.get().getCalibrationFactor()).isCloseTo(1.0, within(1e-9));
            assertThat(bucket.get().getSampleCount()).isEqualTo(3);
            assertThat(bucket.get().getAverageVariancePercent()).isCloseTo(20.0 / 3.0, within(1e-9));
            assertThat(bucket.get().getLastUpdated()).isEqualTo(now);
        }

        @Test
        void tooFewSamplesGivesNoBucket() {
            assertThat(engine.aggregateRegion("39.7,-105.0",
                List.of(report("a", LAT, LNG, 2200.0, 2000.0, "1 A St")), Instant.now())).isEmpty();
        }
    }
}
