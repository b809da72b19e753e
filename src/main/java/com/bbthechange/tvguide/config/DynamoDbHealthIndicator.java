package com.bbthechange.tvguide.config;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableRequest;
import software.amazon.awssdk.services.dynamodb.model.TableStatus;

/**
 * Reports DOWN unless both catalog tables are reachable and ACTIVE.
 */
@Component
public class DynamoDbHealthIndicator implements HealthIndicator {

    private final DynamoDbClient dynamoDbClient;
    private final TvGuideProperties properties;

    public DynamoDbHealthIndicator(DynamoDbClient dynamoDbClient, TvGuideProperties properties) {
        this.dynamoDbClient = dynamoDbClient;
        this.properties = properties;
    }

    @Override
    public Health health() {
        String channelsTable = properties.getDynamodb().getChannelsTable();
        String favoritesTable = properties.getDynamodb().getFavoritesTable();
        try {
            TableStatus channelsStatus = describe(channelsTable);
            TableStatus favoritesStatus = describe(favoritesTable);

            Health.Builder builder = channelsStatus == TableStatus.ACTIVE && favoritesStatus == TableStatus.ACTIVE
                ? Health.up()
                : Health.down();

            return builder
                .withDetail(channelsTable, channelsStatus.toString())
                .withDetail(favoritesTable, favoritesStatus.toString())
                .build();

        } catch (Exception e) {
            return Health.down()
                .withDetail("error", "DynamoDB connection failed")
                .withDetail("message", e.getMessage())
                .build();
        }
    }

    private TableStatus describe(String tableName) {
        return dynamoDbClient.describeTable(DescribeTableRequest.builder().tableName(tableName).build())
            .table()
            .tableStatus();
    }
}
