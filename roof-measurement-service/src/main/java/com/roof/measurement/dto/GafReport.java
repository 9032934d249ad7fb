package com.roof.measurement.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbSecondaryPartitionKey;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Verified field measurement report with DynamoDB mapping annotations. These reports are the
 * ground truth behind calibration.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@DynamoDbBean
public class GafReport {

    public static final String REGION_INDEX = "RegionIndex";
    public static final String ADDRESS_INDEX = "AddressIndex";
    public static final String USER_INDEX = "UserIndex";

    private String reportId;
    private String userId;
    private String address;
    private String normalizedAddress;
    private Double latitude;
    private Double longitude;
    private String regionCode;
    private Double totalSquares;
    private Double totalAreaSqFt;
    private Double estimatedAreaSqFt;
    private String pitchInfo;
    private Double pitchDegrees;
    private Integer facetCount;
    private Double wasteFactor;
    private LocalDate reportDate;
    private Instant uploadedAt;
    private String pdfUrl;

    @DynamoDbPartitionKey
    @DynamoDbAttribute("report_id")
    public String getReportId() {
        return reportId;
    }

    @DynamoDbSecondaryPartitionKey(indexNames = USER_INDEX)
    @DynamoDbAttribute("user_id")
    public String getUserId() {
        return userId;
    }

    @DynamoDbSecondaryPartitionKey(indexNames = ADDRESS_INDEX)
    @DynamoDbAttribute("normalized_address")
    public String getNormalizedAddress() {
        return normalizedAddress;
    }

    @DynamoDbSecondaryPartitionKey(indexNames = REGION_INDEX)
    @DynamoDbAttribute("region_code")
    public String getRegionCode() {
        return regionCode;
    }

    @DynamoDbAttribute("total_area_sq_ft")
    public Double getTotalAreaSqFt() {
        return totalAreaSqFt;
    }

    @DynamoDbAttribute("estimated_area_sq_ft")
    public Double getEstimatedAreaSqFt() {
        return estimatedAreaSqFt;
    }

    /**
     * Whether this report carries the service's original estimate, i.e. can calibrate.
     */
    public boolean hasCalibrationPair() {
        return totalAreaSqFt != null && totalAreaSqFt > 0
            && estimatedAreaSqFt != null && estimatedAreaSqFt > 0;
    }
}
