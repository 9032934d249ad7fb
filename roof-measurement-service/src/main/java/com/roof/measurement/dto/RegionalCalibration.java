package com.roof.measurement.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;

import java.time.Instant;

/**
 * Calibration aggregated over one 0.1° region bucket.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@DynamoDbBean
public class RegionalCalibration {

    private String regionCode;
    private Double calibrationFactor;
    private Integer sampleCount;
    private Double averageVariancePercent;
    private Instant lastUpdated;

    @DynamoDbPartitionKey
    @DynamoDbAttribute("region_code")
    public String getRegionCode() {
        return regionCode;
    }

    @DynamoDbAttribute("calibration_factor")
    public Double getCalibrationFactor() {
        return calibrationFactor;
    }

    @DynamoDbAttribute("sample_count")
    public Integer getSampleCount() {
        return sampleCount;
    }
}
