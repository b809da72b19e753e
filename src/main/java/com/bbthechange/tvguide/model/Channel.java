package com.bbthechange.tvguide.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;

import java.time.Instant;
import java.util.UUID;

/**
 * A catalog entry describing one live stream.
 *
 * {@code id} and {@code createdAt} are assigned once by {@link #newChannel} and never change.
 * {@code active} is a soft-delete flag; removal from the catalog is a hard delete.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@DynamoDbBean
public class Channel {

    public static final String DEFAULT_CATEGORY = "General";

    private String id;
    private String name;
    private String logo;
    private String stream;
    private String category;
    private String description;
    private boolean active;
    private Instant createdAt;

    public static Channel newChannel(String name, String logo, String stream, String category, String description) {
        return new Channel(
            UUID.randomUUID().toString(),
            name,
            logo,
            stream,
            category != null ? category : DEFAULT_CATEGORY,
            description,
            true,
            Instant.now());
    }

    @DynamoDbPartitionKey
    public String getId() {
        return id;
    }

    @DynamoDbAttribute("isActive")
    public boolean isActive() {
        return active;
    }
}
