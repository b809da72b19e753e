package com.bbthechange.tvguide.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial update for a channel. Null fields are left untouched.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateChannelRequest {

    private String name;
    private String logo;
    private String stream;
    private String category;
    private String description;

    @JsonProperty("is_active")
    private Boolean isActive;
}
