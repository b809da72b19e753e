package com.bbthechange.tvguide.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of seeding the catalog. Exactly one of the counts is set:
 * {@code channels_created} after an insert, {@code channels} when the catalog was already populated.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SeedResultDTO {

    private String message;

    @JsonProperty("channels_created")
    private Integer channelsCreated;

    @JsonProperty("channels")
    private Long existingChannels;

    public static SeedResultDTO created(int count) {
        return new SeedResultDTO("Sample data initialized successfully", count, null);
    }

    public static SeedResultDTO alreadyInitialized(long existing) {
        return new SeedResultDTO("Data already initialized", null, existing);
    }
}
