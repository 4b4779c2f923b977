package com.imageanalysis.shared;

import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.sqs.SqsClient;

/**
 * Factory for creating AWS clients with consistent configuration.
 */
public class AwsClientFactory {

    public static S3Client createS3Client(String region) {
        return S3Client.builder()
                .region(Region.of(region))
                .build();
    }

    public static SqsClient createSqsClient(String region) {
        return SqsClient.builder()
                .region(Region.of(region))
                .build();
    }

    public static DynamoDbClient createDynamoDbClient(String region) {
        return DynamoDbClient.builder()
                .region(Region.of(region))
                .build();
    }

    public static DynamoDbEnhancedClient createEnhancedClient(DynamoDbClient dynamoDbClient) {
        return DynamoDbEnhancedClient.builder()
                .dynamoDbClient(dynamoDbClient)
                .build();
    }
}
