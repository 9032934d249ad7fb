package com.roof.measurement.dto;

import com.roof.measurement.algorithm.util.PitchCalculator.RoofSegment;

import java.time.LocalDate;
import java.util.List;

/**
 * Roof data of the building closest to a point, from the solar imagery provider. Segment areas are
 * sloped surface areas.
 */
public record SolarBuildingInsight(ImageryQuality imageryQuality, LocalDate imageryDate, List<RoofSegment> segments) {

    public SolarBuildingInsight {
        segments = segments == null ? List.of() : List.copyOf(segments);
    }

    public double totalSlopedAreaSqM() {
        return segments.stream().mapToDouble(RoofSegment::areaSqM).sum();
    }
}
