package com.bbthechange.tvguide.repository.impl;

import com.bbthechange.tvguide.config.TvGuideProperties;
import com.bbthechange.tvguide.exception.RepositoryException;
import com.bbthechange.tvguide.model.CategoryCount;
import com.bbthechange.tvguide.model.Channel;
import com.bbthechange.tvguide.model.ChannelFilter;
import com.bbthechange.tvguide.repository.ChannelRepository;
import com.bbthechange.tvguide.util.QueryPerformanceTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.*;

import java.util.*;
import java.util.stream.Collectors;

/**
 * ChannelRepository backed by a DynamoDB table keyed on {@code id}.
 *
 * Listing and aggregation are paginated scans. Substring matching is done here
 * rather than in a filter expression so the semantics do not depend on DynamoDB's
 * case-sensitive {@code contains}.
 */
@Repository
public class ChannelRepositoryImpl implements ChannelRepository {

    private static final Logger logger = LoggerFactory.getLogger(ChannelRepositoryImpl.class);
    static final int BATCH_WRITE_LIMIT = 25;
    private static final Set<String> IMMUTABLE_ATTRIBUTES = Set.of("id", "createdAt");

    private final DynamoDbClient dynamoDbClient;
    private final QueryPerformanceTracker queryTracker;
    private final TableSchema<Channel> channelSchema;
    private final String tableName;

    public ChannelRepositoryImpl(DynamoDbClient dynamoDbClient,
                                 QueryPerformanceTracker queryTracker,
                                 TvGuideProperties properties) {
        this.dynamoDbClient = dynamoDbClient;
        this.queryTracker = queryTracker;
        this.channelSchema = TableSchema.fromBean(Channel.class);
        this.tableName = properties.getDynamodb().getChannelsTable();
    }

    @Override
    public List<Channel> findAll(ChannelFilter filter) {
        List<Channel> matches = new ArrayList<>();
        Map<String, AttributeValue> startKey = null;

        do {
            ScanRequest.Builder builder = ScanRequest.builder().tableName(tableName);
            if (filter.activeOnly()) {
                builder.filterExpression("#active = :active")
                    .expressionAttributeNames(Map.of("#active", "isActive"))
                    .expressionAttributeValues(Map.of(":active", AttributeValue.builder().bool(true).build()));
            }
            if (startKey != null) {
                builder.exclusiveStartKey(startKey);
            }

            ScanResponse response = scan(builder.build(), "Failed to list channels");
            for (Map<String, AttributeValue> item : response.items()) {
                Channel channel = channelSchema.mapToItem(item);
                if (filter.matches(channel)) {
                    matches.add(channel);
                    if (matches.size() >= MAX_RESULTS) {
                        logger.debug("Channel listing truncated at {} results", MAX_RESULTS);
                        return matches;
                    }
                }
            }
            startKey = nextPage(response);
        } while (startKey != null);

        return matches;
    }

    @Override
    public Optional<Channel> findById(String id) {
        return queryTracker.trackQuery("GetItem", tableName, () -> {
            try {
                GetItemResponse response = dynamoDbClient.getItem(GetItemRequest.builder()
                    .tableName(tableName)
                    .key(key(id))
                    .build());

                if (!response.hasItem() || response.item().isEmpty()) {
                    return Optional.empty();
                }
                return Optional.of(channelSchema.mapToItem(response.item()));

            } catch (SdkException e) {
                logger.error("Failed to get channel {}", id, e);
                throw new RepositoryException("Failed to retrieve channel", e);
            }
        });
    }

    @Override
    public Channel save(Channel channel) {
        return queryTracker.trackQuery("PutItem", tableName, () -> {
            try {
                dynamoDbClient.putItem(PutItemRequest.builder()
                    .tableName(tableName)
                    .item(channelSchema.itemToMap(channel, true))
                    .conditionExpression("attribute_not_exists(id)")
                    .build());

                logger.info("Saved channel {} ({})", channel.getId(), channel.getName());
                return channel;

            } catch (ConditionalCheckFailedException e) {
                throw new RepositoryException("Channel id already in use: " + channel.getId(), e);
            } catch (SdkException e) {
                logger.error("Failed to save channel {}", channel.getId(), e);
                throw new RepositoryException("Failed to save channel", e);
            }
        });
    }

    @Override
    public Optional<Channel> update(String id, Map<String, AttributeValue> fields) {
        if (fields.isEmpty()) {
            throw new IllegalArgumentException("No attributes to update");
        }
        for (String attribute : fields.keySet()) {
            if (IMMUTABLE_ATTRIBUTES.contains(attribute)) {
                throw new IllegalArgumentException("Attribute cannot be updated: " + attribute);
            }
        }

        StringBuilder updateExpression = new StringBuilder("SET ");
        Map<String, String> names = new HashMap<>();
        Map<String, AttributeValue> values = new HashMap<>();
        int index = 0;
        for (Map.Entry<String, AttributeValue> entry : fields.entrySet()) {
            if (index > 0) {
                updateExpression.append(", ");
            }
            String nameAlias = "#attr" + index;
            String valueAlias = ":val" + index;
            updateExpression.append(nameAlias).append(" = ").append(valueAlias);
            names.put(nameAlias, entry.getKey());
            values.put(valueAlias, entry.getValue());
            index++;
        }

        UpdateItemRequest request = UpdateItemRequest.builder()
            .tableName(tableName)
            .key(key(id))
            .updateExpression(updateExpression.toString())
            .conditionExpression("attribute_exists(id)")
            .expressionAttributeNames(names)
            .expressionAttributeValues(values)
            .returnValues(ReturnValue.ALL_NEW)
            .build();

        return queryTracker.trackQuery("UpdateItem", tableName, () -> {
            try {
                UpdateItemResponse response = dynamoDbClient.updateItem(request);
                logger.info("Updated channel {} attributes {}", id, fields.keySet());
                return Optional.of(channelSchema.mapToItem(response.attributes()));

            } catch (ConditionalCheckFailedException e) {
                logger.debug("Update skipped, channel {} does not exist", id);
                return Optional.empty();
            } catch (SdkException e) {
                logger.error("Failed to update channel {}", id, e);
                throw new RepositoryException("Failed to update channel", e);
            }
        });
    }

    @Override
    public boolean deleteById(String id) {
        return queryTracker.trackQuery("DeleteItem", tableName, () -> {
            try {
                dynamoDbClient.deleteItem(DeleteItemRequest.builder()
                    .tableName(tableName)
                    .key(key(id))
                    .conditionExpression("attribute_exists(id)")
                    .build());

                logger.info("Deleted channel {}", id);
                return true;

            } catch (ConditionalCheckFailedException e) {
                logger.debug("Delete skipped, channel {} does not exist", id);
                return false;
            } catch (SdkException e) {
                logger.error("Failed to delete channel {}", id, e);
                throw new RepositoryException("Failed to delete channel", e);
            }
        });
    }

    @Override
    public List<CategoryCount> countByCategory() {
        Map<String, Long> counts = new TreeMap<>();
        Map<String, AttributeValue> startKey = null;

        do {
            ScanRequest.Builder builder = ScanRequest.builder()
                .tableName(tableName)
                .projectionExpression("#category")
                .expressionAttributeNames(Map.of("#category", "category"));
            if (startKey != null) {
                builder.exclusiveStartKey(startKey);
            }

            ScanResponse response = scan(builder.build(), "Failed to aggregate categories");
            for (Map<String, AttributeValue> item : response.items()) {
                AttributeValue category = item.get("category");
                if (category == null || category.s() == null) {
                    continue;
                }
                counts.merge(category.s(), 1L, Long::sum);
            }
            startKey = nextPage(response);
        } while (startKey != null);

        return counts.entrySet().stream()
            .map(entry -> new CategoryCount(entry.getKey(), entry.getValue()))
            .collect(Collectors.toList());
    }

    @Override
    public long count() {
        long total = 0;
        Map<String, AttributeValue> startKey = null;

        do {
            ScanRequest.Builder builder = ScanRequest.builder()
                .tableName(tableName)
                .select(Select.COUNT);
            if (startKey != null) {
                builder.exclusiveStartKey(startKey);
            }

            ScanResponse response = scan(builder.build(), "Failed to count channels");
            total += response.count() != null ? response.count() : 0;
            startKey = nextPage(response);
        } while (startKey != null);

        return total;
    }

    @Override
    public int saveAll(List<Channel> channels) {
        int written = 0;
        for (int start = 0; start < channels.size(); start += BATCH_WRITE_LIMIT) {
            List<Channel> chunk = channels.subList(start, Math.min(start + BATCH_WRITE_LIMIT, channels.size()));
            List<WriteRequest> writes = chunk.stream()
                .map(channel -> WriteRequest.builder()
                    .putRequest(PutRequest.builder().item(channelSchema.itemToMap(channel, true)).build())
                    .build())
                .collect(Collectors.toList());

            BatchWriteItemResponse response = queryTracker.trackQuery("BatchWriteItem", tableName, () -> {
                try {
                    return dynamoDbClient.batchWriteItem(BatchWriteItemRequest.builder()
                        .requestItems(Map.of(tableName, writes))
                        .build());
                } catch (SdkException e) {
                    logger.error("Failed to batch write {} channels", writes.size(), e);
                    throw new RepositoryException("Failed to save channels", e);
                }
            });

            List<WriteRequest> unprocessed = response.hasUnprocessedItems()
                ? response.unprocessedItems().getOrDefault(tableName, List.of())
                : List.of();
            if (!unprocessed.isEmpty()) {
                logger.error("Batch write left {} of {} channels unprocessed", unprocessed.size(), writes.size());
                throw new RepositoryException("Failed to save channels: " + unprocessed.size() + " writes were not processed");
            }
            written += chunk.size();
        }

        logger.info("Batch saved {} channels", written);
        return written;
    }

    private ScanResponse scan(ScanRequest request, String failureMessage) {
        return queryTracker.trackQuery("Scan", tableName, () -> {
            try {
                return dynamoDbClient.scan(request);
            } catch (SdkException e) {
                logger.error("{} on table {}", failureMessage, tableName, e);
                throw new RepositoryException(failureMessage, e);
            }
        });
    }

    private static Map<String, AttributeValue> nextPage(ScanResponse response) {
        if (response.hasLastEvaluatedKey() && !response.lastEvaluatedKey().isEmpty()) {
            return response.lastEvaluatedKey();
        }
        return null;
    }

    private static Map<String, AttributeValue> key(String id) {
        return Map.of("id", AttributeValue.builder().s(id).build());
    }
}
