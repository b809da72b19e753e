package com.bbthechange.tvguide.dto;

import com.bbthechange.tvguide.model.Channel;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChannelDTO {

    private String id;
    private String name;
    private String logo;
    private String stream;
    private String category;
    private String description;

    @JsonProperty("is_active")
    private boolean active;

    @JsonProperty("created_at")
    private Instant createdAt;

    public ChannelDTO(Channel channel) {
        this(channel.getId(), channel.getName(), channel.getLogo(), channel.getStream(),
            channel.getCategory(), channel.getDescription(), channel.isActive(), channel.getCreatedAt());
    }
}
