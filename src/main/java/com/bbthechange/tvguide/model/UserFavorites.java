package com.bbthechange.tvguide.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * One favorites record per user, keyed by the external {@code userId}.
 *
 * {@code channelIds} are opaque strings; they are not checked against the channel catalog.
 * {@code version} is bumped on every write and guards optimistic updates.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@DynamoDbBean
public class UserFavorites {

    private String id;
    private String userId;
    private List<String> channelIds = new ArrayList<>();
    private Instant updatedAt;
    private Long version;

    public static UserFavorites empty(String userId) {
        return new UserFavorites(UUID.randomUUID().toString(), userId, new ArrayList<>(), Instant.now(), 0L);
    }

    @DynamoDbPartitionKey
    public String getUserId() {
        return userId;
    }
}
