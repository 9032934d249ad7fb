package com.roof.measurement.service;

import com.roof.measurement.dto.ManualMeasurementRequest;
import com.roof.measurement.dto.MeasurementReport;
import com.roof.measurement.dto.ProviderCredentials;

/**
 * Service interface for roof measurement reports.
 */
public interface RoofMeasurementService {

    /**
     * Measures a roof using the tier waterfall: the most accurate source that succeeds is used and
     * no lower-priority source is called.
     *
     * @param lat Latitude
     * @param lng Longitude
     * @param address Street address, optional
     * @param credentials Provider API keys
     * @return Report with measurement, confidence, calibration and tier transparency
     * @throws IllegalArgumentException for invalid coordinates
     */
    MeasurementReport measure(double lat, double lng, String address, ProviderCredentials credentials);

    /**
     * Queries every automated source concurrently and cross-validates the results.
     *
     * @throws com.roof.measurement.exception.ParallelMeasurementUnavailableException when the executor is saturated
     */
    MeasurementReport measureAllSources(double lat, double lng, String address, ProviderCredentials credentials);

    /**
     * Builds a report from a user-traced area.
     *
     * @throws IllegalArgumentException for a non-positive area or invalid pitch or coordinates
     */
    MeasurementReport measureManual(ManualMeasurementRequest request);
}
