package com.bbthechange.tvguide.dto;

import com.bbthechange.tvguide.model.UserFavorites;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class UserFavoritesDTO {

    private String id;

    @JsonProperty("user_id")
    private String userId;

    @JsonProperty("channel_ids")
    private List<String> channelIds;

    @JsonProperty("updated_at")
    private Instant updatedAt;

    public UserFavoritesDTO(UserFavorites favorites) {
        this(favorites.getId(),
            favorites.getUserId(),
            favorites.getChannelIds() != null ? new ArrayList<>(favorites.getChannelIds()) : new ArrayList<>(),
            favorites.getUpdatedAt());
    }
}
