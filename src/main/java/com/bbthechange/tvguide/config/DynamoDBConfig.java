package com.bbthechange.tvguide.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.DynamoDbClientBuilder;

import java.net.URI;

/**
 * Builds the shared DynamoDB client. Spring closes it on context shutdown.
 *
 * A non-blank {@code aws.dynamodb.endpoint} points the client at DynamoDB Local or
 * LocalStack; otherwise it talks to AWS with the default credential chain.
 */
@Configuration
public class DynamoDBConfig {

    private static final Logger logger = LoggerFactory.getLogger(DynamoDBConfig.class);

    @Value("${aws.region:us-east-1}")
    private String region;

    @Value("${aws.dynamodb.endpoint:}")
    private String endpoint;

    @Bean(destroyMethod = "close")
    public DynamoDbClient dynamoDbClient() {
        DynamoDbClientBuilder builder = DynamoDbClient.builder()
                .region(Region.of(region))
                .credentialsProvider(credentialsProvider());

        if (usesLocalEndpoint()) {
            logger.info("Using local DynamoDB endpoint {}", endpoint);
            builder.endpointOverride(URI.create(endpoint));
        } else {
            logger.info("Using DynamoDB in region {}", region);
        }
        return builder.build();
    }

    @Bean
    public DynamoDbEnhancedClient dynamoDbEnhancedClient(DynamoDbClient dynamoDbClient) {
        return DynamoDbEnhancedClient.builder()
                .dynamoDbClient(dynamoDbClient)
                .build();
    }

    boolean usesLocalEndpoint() {
        return endpoint != null && !endpoint.isBlank();
    }

    AwsCredentialsProvider credentialsProvider() {
        if (usesLocalEndpoint()) {
            // Local emulators accept any key pair
            return StaticCredentialsProvider.create(AwsBasicCredentials.create("local", "local"));
        }
        return DefaultCredentialsProvider.create();
    }
}
