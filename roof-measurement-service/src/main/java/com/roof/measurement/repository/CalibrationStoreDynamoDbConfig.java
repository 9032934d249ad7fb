package com.roof.measurement.repository;

import com.roof.measurement.dto.GafReport;
import com.roof.measurement.dto.RegionalCalibration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.DynamoDbClientBuilder;

import java.net.URI;

/**
 * DynamoDB client and table handles backing the calibration store: GAF reports and regional
 * calibration buckets.
 */
@Configuration
@Profile("!test")
public class CalibrationStoreDynamoDbConfig {

    @Value("${aws.dynamodb.endpoint:}")
    private String endpoint;

    @Value("${aws.dynamodb.region}")
    private String region;

    @Bean
    public DynamoDbClient calibrationStoreDynamoDbClient(Environment environment) {
        DynamoDbClientBuilder builder = DynamoDbClient.builder().region(Region.of(region));
        if (endpoint != null && !endpoint.isBlank()) {
            builder.endpointOverride(URI.create(endpoint));
        }
        if (environment.acceptsProfiles(Profiles.of("local"))) {
            // DynamoDB Local accepts any static credentials
            builder.credentialsProvider(StaticCredentialsProvider.create(
                AwsBasicCredentials.create("local", "local")));
        }
        return builder.build();
    }

    @Bean
    public DynamoDbEnhancedClient calibrationStoreEnhancedClient(DynamoDbClient calibrationStoreDynamoDbClient) {
        return DynamoDbEnhancedClient.builder()
                .dynamoDbClient(calibrationStoreDynamoDbClient)
                .build();
    }

    @Bean
    public DynamoDbTable<GafReport> gafReportTable(DynamoDbEnhancedClient calibrationStoreEnhancedClient,
            @Value("${aws.dynamodb.gaf-report-table}") String tableName) {
        return calibrationStoreEnhancedClient.table(tableName, TableSchema.fromBean(GafReport.class));
    }

    @Bean
    public DynamoDbTable<RegionalCalibration> regionalCalibrationTable(
            DynamoDbEnhancedClient calibrationStoreEnhancedClient,
            @Value("${aws.dynamodb.calibration-table}") String tableName) {
        return calibrationStoreEnhancedClient.table(tableName, TableSchema.fromBean(RegionalCalibration.class));
    }
}
