package com.bbthechange.tvguide.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Full replacement of a user's favorites. The list is stored exactly as given.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UpdateFavoritesRequest {

    @NotNull(message = "channel_ids is required")
    @JsonProperty("channel_ids")
    private List<String> channelIds;
}
