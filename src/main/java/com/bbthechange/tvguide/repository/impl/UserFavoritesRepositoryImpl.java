package com.bbthechange.tvguide.repository.impl;

import com.bbthechange.tvguide.config.TvGuideProperties;
import com.bbthechange.tvguide.exception.RepositoryException;
import com.bbthechange.tvguide.model.FavoriteAction;
import com.bbthechange.tvguide.model.ToggleResult;
import com.bbthechange.tvguide.model.UserFavorites;
import com.bbthechange.tvguide.repository.UserFavoritesRepository;
import com.bbthechange.tvguide.util.QueryPerformanceTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.*;

import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;

/**
 * UserFavoritesRepository backed by a DynamoDB table keyed on {@code userId}.
 *
 * Replace is a single upsert. Toggle is a read-compute-write guarded by the
 * {@code version} attribute and retried on conflict, so concurrent toggles never
 * overwrite each other.
 */
@Repository
public class UserFavoritesRepositoryImpl implements UserFavoritesRepository {

    private static final Logger logger = LoggerFactory.getLogger(UserFavoritesRepositoryImpl.class);

    private static final Map<String, String> ATTRIBUTE_NAMES = Map.of(
        "#id", "id",
        "#channelIds", "channelIds",
        "#updatedAt", "updatedAt",
        "#version", "version"
    );

    private final DynamoDbClient dynamoDbClient;
    private final QueryPerformanceTracker queryTracker;
    private final TableSchema<UserFavorites> favoritesSchema;
    private final String tableName;

    public UserFavoritesRepositoryImpl(DynamoDbClient dynamoDbClient,
                                       QueryPerformanceTracker queryTracker,
                                       TvGuideProperties properties) {
        this.dynamoDbClient = dynamoDbClient;
        this.queryTracker = queryTracker;
        this.favoritesSchema = TableSchema.fromBean(UserFavorites.class);
        this.tableName = properties.getDynamodb().getFavoritesTable();
    }

    @Override
    public Optional<UserFavorites> findByUserId(String userId) {
        return queryTracker.trackQuery("GetItem", tableName, () -> {
            try {
                GetItemResponse response = dynamoDbClient.getItem(GetItemRequest.builder()
                    .tableName(tableName)
                    .key(key(userId))
                    .consistentRead(true)
                    .build());

                if (!response.hasItem() || response.item().isEmpty()) {
                    return Optional.empty();
                }
                return Optional.of(favoritesSchema.mapToItem(response.item()));

            } catch (SdkException e) {
                logger.error("Failed to get favorites for user {}", userId, e);
                throw new RepositoryException("Failed to retrieve favorites", e);
            }
        });
    }

    @Override
    public UserFavorites getOrCreate(String userId) {
        Optional<UserFavorites> existing = findByUserId(userId);
        if (existing.isPresent()) {
            return existing.get();
        }

        UserFavorites created = UserFavorites.empty(userId);
        if (putIfAbsent(created)) {
            logger.info("Created empty favorites for user {}", userId);
            return created;
        }

        // Another caller created the record between our read and write
        return findByUserId(userId)
            .orElseThrow(() -> new RepositoryException("Favorites for user " + userId + " vanished during creation"));
    }

    @Override
    public UserFavorites replaceChannelIds(String userId, List<String> channelIds) {
        Map<String, AttributeValue> values = new HashMap<>();
        values.put(":ids", toList(channelIds));
        values.put(":now", AttributeValue.builder().s(Instant.now().toString()).build());
        values.put(":newId", AttributeValue.builder().s(UUID.randomUUID().toString()).build());
        values.put(":zero", AttributeValue.builder().n("0").build());
        values.put(":one", AttributeValue.builder().n("1").build());

        UpdateItemRequest request = UpdateItemRequest.builder()
            .tableName(tableName)
            .key(key(userId))
            .updateExpression("SET #channelIds = :ids, #updatedAt = :now, #id = if_not_exists(#id, :newId), "
                + "#version = if_not_exists(#version, :zero) + :one")
            .expressionAttributeNames(ATTRIBUTE_NAMES)
            .expressionAttributeValues(values)
            .returnValues(ReturnValue.ALL_NEW)
            .build();

        return queryTracker.trackQuery("UpdateItem", tableName, () -> {
            try {
                UpdateItemResponse response = dynamoDbClient.updateItem(request);
                logger.info("Replaced favorites for user {} with {} channels", userId, channelIds.size());
                return favoritesSchema.mapToItem(response.attributes());

            } catch (SdkException e) {
                logger.error("Failed to replace favorites for user {}", userId, e);
                throw new RepositoryException("Failed to update favorites", e);
            }
        });
    }

    @Override
    public ToggleResult toggleChannel(String userId, String channelId) {
        // A lost conditional write means another write committed, so the loop always makes progress
        for (int attempt = 1; ; attempt++) {
            UserFavorites current = getOrCreate(userId);

            List<String> channelIds = current.getChannelIds() != null
                ? new ArrayList<>(current.getChannelIds())
                : new ArrayList<>();
            boolean present = channelIds.contains(channelId);
            if (present) {
                // replace() may have stored duplicates; all of them go
                channelIds.removeIf(channelId::equals);
            } else {
                channelIds.add(channelId);
            }

            if (writeIfVersionMatches(userId, channelIds, current.getVersion())) {
                FavoriteAction action = FavoriteAction.forMembership(!present);
                logger.info("Toggled channel {} for user {}: {} (attempt {})", channelId, userId, action.getLabel(), attempt);
                return new ToggleResult(action, channelId);
            }

            logger.debug("Version conflict toggling channel {} for user {} (attempt {}), re-reading",
                channelId, userId, attempt);
        }
    }

    private boolean putIfAbsent(UserFavorites favorites) {
        return queryTracker.trackQuery("PutItem", tableName, () -> {
            try {
                dynamoDbClient.putItem(PutItemRequest.builder()
                    .tableName(tableName)
                    .item(favoritesSchema.itemToMap(favorites, true))
                    .conditionExpression("attribute_not_exists(userId)")
                    .build());
                return true;

            } catch (ConditionalCheckFailedException e) {
                return false;
            } catch (SdkException e) {
                logger.error("Failed to create favorites for user {}", favorites.getUserId(), e);
                throw new RepositoryException("Failed to create favorites", e);
            }
        });
    }

    private boolean writeIfVersionMatches(String userId, List<String> channelIds, Long expectedVersion) {
        Map<String, AttributeValue> values = new HashMap<>();
        values.put(":ids", toList(channelIds));
        values.put(":now", AttributeValue.builder().s(Instant.now().toString()).build());

        String condition;
        if (expectedVersion == null) {
            condition = "attribute_not_exists(#version)";
            values.put(":next", AttributeValue.builder().n("1").build());
        } else {
            condition = "#version = :expected";
            values.put(":expected", AttributeValue.builder().n(String.valueOf(expectedVersion)).build());
            values.put(":next", AttributeValue.builder().n(String.valueOf(expectedVersion + 1)).build());
        }

        UpdateItemRequest request = UpdateItemRequest.builder()
            .tableName(tableName)
            .key(key(userId))
            .updateExpression("SET #channelIds = :ids, #updatedAt = :now, #version = :next")
            .conditionExpression(condition)
            .expressionAttributeNames(Map.of(
                "#channelIds", "channelIds",
                "#updatedAt", "updatedAt",
                "#version", "version"))
            .expressionAttributeValues(values)
            .build();

        return queryTracker.trackQuery("UpdateItem", tableName, () -> {
            try {
                dynamoDbClient.updateItem(request);
                return true;

            } catch (ConditionalCheckFailedException e) {
                return false;
            } catch (SdkException e) {
                logger.error("Failed to write favorites for user {}", userId, e);
                throw new RepositoryException("Failed to update favorites", e);
            }
        });
    }

    private static AttributeValue toList(List<String> channelIds) {
        return AttributeValue.builder()
            .l(channelIds.stream()
                .map(id -> AttributeValue.builder().s(id).build())
                .collect(Collectors.toList()))
            .build();
    }

    private static Map<String, AttributeValue> key(String userId) {
        return Map.of("userId", AttributeValue.builder().s(userId).build());
    }
}
