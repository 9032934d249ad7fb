package com.roof.measurement.dto;

import com.roof.measurement.algorithm.util.GeoMath.Coordinate;

import java.util.List;

/**
 * Building outline from OpenStreetMap.
 *
 * @param buildingTag value of the {@code building} tag, may be null
 * @param outline polygon vertices
 */
public record BuildingFootprint(String buildingTag, List<Coordinate> outline) {

    public BuildingFootprint {
        outline = outline == null ? List.of() : List.copyOf(outline);
    }
}
