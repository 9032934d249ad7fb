package com.roof.measurement.algorithm.util;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Great-circle distance, coarse region bucketing and footprint polygon area.
 */
public final class GeoMath {

    private static final double EARTH_RADIUS_MILES = 3959.0;

    /** Metres per degree of latitude in the local equirectangular projection. */
    private static final double METERS_PER_DEGREE_LAT = 110_540.0;

    /** Metres per degree of longitude at the equator; scaled by cos(latitude). */
    private static final double METERS_PER_DEGREE_LNG = 111_320.0;

    /** Region buckets are 0.1° cells. */
    private static final double REGION_CELL_DEGREES = 0.1;

    private static final double MILES_PER_DEGREE_LAT = 69.0;

    private GeoMath() {}

    /**
     * Haversine distance in miles.
     *
     * <p>Formula: d = 2R × atan2(√a, √(1−a)), a = sin²(Δφ/2) + cos φ1 × cos φ2 × sin²(Δλ/2)
     */
    public static double distanceMiles(double lat1, double lng1, double lat2, double lng2) {
        double dLat = Math.toRadians(lat2 - lat1);
        double dLng = Math.toRadians(lng2 - lng1);
        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
            + Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2))
            * Math.sin(dLng / 2) * Math.sin(dLng / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return EARTH_RADIUS_MILES * c;
    }

    /**
     * Region code for the 0.1° cell containing a point, formatted "lat,lng" with one decimal.
     */
    public static String regionCode(double lat, double lng) {
        return formatRegion(roundToCell(lat), normalizeLongitude(roundToCell(lng)));
    }

    /**
     * Region codes of every 0.1° cell that may hold points within {@code radiusMiles} of the center.
     * Cells wrap across the antimeridian.
     */
    public static List<String> coveringRegionCodes(double lat, double lng, double radiusMiles) {
        double latSpan = radiusMiles / MILES_PER_DEGREE_LAT;
        double cosLat = Math.max(Math.cos(Math.toRadians(lat)), 0.01);
        double lngSpan = radiusMiles / (MILES_PER_DEGREE_LAT * cosLat);

        int latSteps = (int) Math.ceil(latSpan / REGION_CELL_DEGREES);
        int lngSteps = (int) Math.ceil(lngSpan / REGION_CELL_DEGREES);
        double centerLat = roundToCell(lat);
        double centerLng = roundToCell(lng);

        Set<String> codes = new LinkedHashSet<>();
        for (int i = -latSteps; i <= latSteps; i++) {
            for (int j = -lngSteps; j <= lngSteps; j++) {
                codes.add(formatRegion(
                    roundToCell(centerLat + i * REGION_CELL_DEGREES),
                    normalizeLongitude(roundToCell(centerLng + j * REGION_CELL_DEGREES))));
            }
        }
        return new ArrayList<>(codes);
    }

    /**
     * Planar area of a lat/lng polygon in square metres (shoelace formula over a local
     * equirectangular projection: x = λ × 111320 × cos φ, y = φ × 110540).
     *
     * @param ring polygon vertices; closing vertex optional
     * @return absolute area, 0 for fewer than three vertices
     */
    public static double footprintAreaSqM(List<Coordinate> ring) {
        if (ring == null || ring.size() < 3) {
            return 0.0;
        }
        double sum = 0.0;
        int n = ring.size();
        for (int i = 0; i < n; i++) {
            Coordinate p1 = ring.get(i);
            Coordinate p2 = ring.get((i + 1) % n);
            double x1 = p1.lng() * METERS_PER_DEGREE_LNG * Math.cos(Math.toRadians(p1.lat()));
            double y1 = p1.lat() * METERS_PER_DEGREE_LAT;
            double x2 = p2.lng() * METERS_PER_DEGREE_LNG * Math.cos(Math.toRadians(p2.lat()));
            double y2 = p2.lat() * METERS_PER_DEGREE_LAT;
            sum += x1 * y2 - x2 * y1;
        }
        return Math.abs(sum / 2.0);
    }

    /** Arithmetic mean of the vertices. */
    public static Coordinate centroid(List<Coordinate> ring) {
        if (ring == null || ring.isEmpty()) {
            throw new IllegalArgumentException("Cannot compute centroid of an empty polygon");
        }
        double lat = 0.0;
        double lng = 0.0;
        for (Coordinate c : ring) {
            lat += c.lat();
            lng += c.lng();
        }
        return new Coordinate(lat / ring.size(), lng / ring.size());
    }

    private static double roundToCell(double value) {
        return Math.round(value / REGION_CELL_DEGREES) * REGION_CELL_DEGREES;
    }

    /** Maps a longitude into [-180, 180). */
    static double normalizeLongitude(double lng) {
        double wrapped = ((lng + 180.0) % 360.0 + 360.0) % 360.0 - 180.0;
        return roundToCell(wrapped);
    }

    private static String formatRegion(double lat, double lng) {
        return String.format(Locale.ROOT, "%.1f,%.1f", lat, lng);
    }

    /** A WGS84 point. */
    public record Coordinate(double lat, double lng) {}
}
