package com.roof.measurement.algorithm.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("GeoMath Tests")
class GeoMathTest {

    @Test
    void distanceBetweenIdenticalPointsIsZero() {
        assertThat(GeoMath.distanceMiles(39.7392, -104.9903, 39.7392, -104.9903)).isZero();
    }

    @Test
    void distanceDenverToBoulder() {
        // ~24.2 miles great-circle
        double miles = GeoMath.distanceMiles(39.7392, -104.9903, 40.0150, -105.2705);
        assertThat(miles).isCloseTo(24.2, within(0.7));
    }

    @Test
    void regionCodeUsesTenthDegreeCells() {
        assertThat(GeoMath.regionCode(39.7392, -104.9903)).isEqualTo("39.7,-105.0");
        assertThat(GeoMath.regionCode(39.76, -104.94)).isEqualTo("39.8,-104.9");
    }

    @Test
    void coveringRegionsIncludeCenterCell() {
        List<String> codes = GeoMath.coveringRegionCodes(39.7392, -104.9903, 5.0);

        assertThat(codes).contains(GeoMath.regionCode(39.7392, -104.9903));
        assertThat(codes).contains(GeoMath.regionCode(39.7392 + 0.05, -104.9903));
        assertThat(codes).doesNotHaveDuplicates();
    }

    @Test
    void coveringRegionsWrapAcrossAntimeridian() {
        List<String> codes = GeoMath.coveringRegionCodes(0.0, 179.98, 10.0);

        assertThat(codes).contains("0.0,179.9", "0.0,-180.0", "0.0,-179.9");
        assertThat(codes).noneMatch(code -> code.endsWith(",180.0") || code.endsWith(",180.1"));
        assertThat(codes).doesNotHaveDuplicates();
        assertThat(GeoMath.regionCode(0.0, 179.97)).isEqualTo(GeoMath.regionCode(0.0, -179.97));
    }

    @Test
    void footprintAreaOfSquareAtEquator() {
        // 0.0001° x 0.0001° at the equator: 11.132 m x 11.054 m
        List<GeoMath.Coordinate> ring = List.of(
            new GeoMath.Coordinate(0.0, 0.0),
            new GeoMath.Coordinate(0.0, 0.0001),
            new GeoMath.Coordinate(0.0001, 0.0001),
            new GeoMath.Coordinate(0.0001, 0.0));

        assertThat(GeoMath.footprintAreaSqM(ring)).isCloseTo(123.05, within(0.1));
    }

    @Test
    void footprintAreaIgnoresWindingAndNeedsThreeVertices() {
        List<GeoMath.Coordinate> clockwise = List.of(
            new GeoMath.Coordinate(0.0, 0.0),
            new GeoMath.Coordinate(0.0001, 0.0),
            new GeoMath.Coordinate(0.0001, 0.0001),
            new GeoMath.Coordinate(0.0, 0.0001));

        assertThat(GeoMath.footprintAreaSqM(clockwise)).isCloseTo(123.05, within(0.1));
        assertThat(GeoMath.footprintAreaSqM(clockwise.subList(0, 2))).isZero();
        assertThat(GeoMath.footprintAreaSqM(null)).isZero();
    }

    @Test
    void centroidIsVertexMean() {
        GeoMath.Coordinate centroid = GeoMath.centroid(List.of(
            new GeoMath.Coordinate(1.0, 2.0),
            new GeoMath.Coordinate(3.0, 4.0)));

        assertThat(centroid.lat()).isEqualTo(2.0);
        assertThat(centroid.lng()).isEqualTo(3.0);
        assertThatThrownBy(() -> GeoMath.centroid(List.of())).isInstanceOf(IllegalArgumentException.class);
    }
}
