package com.bbthechange.tvguide.config;

import com.bbthechange.tvguide.model.Channel;
import com.bbthechange.tvguide.model.UserFavorites;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.CreateTableEnhancedRequest;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.ProvisionedThroughput;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;

/**
 * Creates the channel and favorites tables on startup when they do not exist yet.
 */
@Component
@ConditionalOnProperty(name = "dynamodb.table.init.enabled", havingValue = "true", matchIfMissing = true)
public class DynamoDBTableInitializer implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(DynamoDBTableInitializer.class);

    private final DynamoDbEnhancedClient dynamoDbEnhancedClient;
    private final DynamoDbClient dynamoDbClient;
    private final TvGuideProperties properties;

    public DynamoDBTableInitializer(DynamoDbEnhancedClient dynamoDbEnhancedClient,
                                    DynamoDbClient dynamoDbClient,
                                    TvGuideProperties properties) {
        this.dynamoDbEnhancedClient = dynamoDbEnhancedClient;
        this.dynamoDbClient = dynamoDbClient;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        createTableIfNotExists(properties.getDynamodb().getChannelsTable(), Channel.class);
        createTableIfNotExists(properties.getDynamodb().getFavoritesTable(), UserFavorites.class);
    }

    <T> void createTableIfNotExists(String tableName, Class<T> entityClass) {
        DynamoDbTable<T> table = dynamoDbEnhancedClient.table(tableName, TableSchema.fromBean(entityClass));
        try {
            // describeTable throws if the table is missing
            table.describeTable();
            logger.info("Table {} already exists", tableName);
        } catch (ResourceNotFoundException e) {
            logger.info("Creating table: {}", tableName);
            table.createTable(CreateTableEnhancedRequest.builder()
                .provisionedThroughput(ProvisionedThroughput.builder()
                    .readCapacityUnits(5L)
                    .writeCapacityUnits(5L)
                    .build())
                .build());
            dynamoDbClient.waiter().waitUntilTableExists(r -> r.tableName(tableName));
            logger.info("Table {} created successfully", tableName);
        } catch (Exception e) {
            logger.error("Error creating table {}: {}", tableName, e.getMessage());
            throw e;
        }
    }
}
