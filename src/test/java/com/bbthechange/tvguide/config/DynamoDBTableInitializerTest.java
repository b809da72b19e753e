package com.bbthechange.tvguide.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.model.CreateTableEnhancedRequest;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;
import software.amazon.awssdk.services.dynamodb.waiters.DynamoDbWaiter;

import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DynamoDBTableInitializerTest {

    @Mock
    private DynamoDbEnhancedClient enhancedClient;

    @Mock
    private DynamoDbClient dynamoDbClient;

    @Mock
    private DynamoDbTable<Object> channelsTable;

    @Mock
    private DynamoDbTable<Object> favoritesTable;

    @Mock
    private DynamoDbWaiter waiter;

    private DynamoDBTableInitializer initializer;

    @BeforeEach
    void setUp() {
        initializer = new DynamoDBTableInitializer(enhancedClient, dynamoDbClient, new TvGuideProperties());
        lenient().doReturn(channelsTable).when(enhancedClient).table(eq("Channels"), any());
        lenient().doReturn(favoritesTable).when(enhancedClient).table(eq("UserFavorites"), any());
    }

    @Test
    void run_TablesExist_CreatesNothing() {
        initializer.run(null);

        verify(channelsTable).describeTable();
        verify(favoritesTable).describeTable();
        verify(channelsTable, never()).createTable(any(CreateTableEnhancedRequest.class));
        verify(favoritesTable, never()).createTable(any(CreateTableEnhancedRequest.class));
        verifyNoInteractions(dynamoDbClient);
    }

    @Test
    @SuppressWarnings("unchecked")
    void run_TableMissing_CreatesAndWaitsForIt() {
        when(channelsTable.describeTable())
            .thenThrow(ResourceNotFoundException.builder().message("Cannot do operations on a non-existent table").build());
        when(dynamoDbClient.waiter()).thenReturn(waiter);

        initializer.run(null);

        verify(channelsTable).createTable(any(CreateTableEnhancedRequest.class));
        verify(waiter).waitUntilTableExists(any(Consumer.class));
        verify(favoritesTable, never()).createTable(any(CreateTableEnhancedRequest.class));
    }

    @Test
    void run_DescribeFailsOtherwise_Propagates() {
        when(channelsTable.describeTable()).thenThrow(new IllegalStateException("boom"));

        assertThatThrownBy(() -> initializer.run(null))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("boom");
    }
}
