package com.roof.measurement;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Roof Measurement Service.
 *
 * <p>Resolves roof area and pitch from the most accurate available source (LiDAR, solar imagery,
 * building footprints, historical reports or manual tracing), cross-validates candidate
 * measurements, scores confidence and calibrates results against verified GAF reports.
 */
@SpringBootApplication
public class RoofMeasurementServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(RoofMeasurementServiceApplication.class, args);
    }
}
