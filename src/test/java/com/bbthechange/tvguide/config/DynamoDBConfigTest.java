package com.bbthechange.tvguide.config;

import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class DynamoDBConfigTest {

    @Test
    void dynamoDbClient_WithoutEndpoint_UsesConfiguredRegion() {
        DynamoDBConfig config = new DynamoDBConfig();
        ReflectionTestUtils.setField(config, "region", "us-west-2");
        ReflectionTestUtils.setField(config, "endpoint", "");

        try (DynamoDbClient client = config.dynamoDbClient()) {
            assertNotNull(client);
            assertEquals("us-west-2", client.serviceClientConfiguration().region().id());
        }
    }

    @Test
    void dynamoDbClient_WithLocalEndpoint_OverridesEndpoint() {
        DynamoDBConfig config = new DynamoDBConfig();
        ReflectionTestUtils.setField(config, "region", "us-east-1");
        ReflectionTestUtils.setField(config, "endpoint", "http://localhost:8000");

        try (DynamoDbClient client = config.dynamoDbClient()) {
            assertTrue(client.serviceClientConfiguration().endpointOverride().isPresent());
            assertEquals("http://localhost:8000",
                client.serviceClientConfiguration().endpointOverride().get().toString());
        }
    }

    @Test
    void credentialsProvider_LocalEndpoint_UsesStaticCredentials() {
        DynamoDBConfig config = new DynamoDBConfig();
        ReflectionTestUtils.setField(config, "endpoint", "http://localhost:4566");

        assertTrue(config.usesLocalEndpoint());
        assertInstanceOf(StaticCredentialsProvider.class, config.credentialsProvider());
    }

    @Test
    void credentialsProvider_BlankEndpoint_UsesDefaultChain() {
        DynamoDBConfig config = new DynamoDBConfig();
        ReflectionTestUtils.setField(config, "endpoint", "  ");

        assertFalse(config.usesLocalEndpoint());
        assertInstanceOf(DefaultCredentialsProvider.class, config.credentialsProvider());
    }

    @Test
    void dynamoDbEnhancedClient_WrapsLowLevelClient() {
        DynamoDBConfig config = new DynamoDBConfig();
        DynamoDbClient mockClient = mock(DynamoDbClient.class);

        DynamoDbEnhancedClient enhancedClient = config.dynamoDbEnhancedClient(mockClient);

        assertNotNull(enhancedClient);
    }
}
