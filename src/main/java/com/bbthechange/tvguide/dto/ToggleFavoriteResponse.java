package com.bbthechange.tvguide.dto;

import com.bbthechange.tvguide.model.ToggleResult;
import com.fasterxml.jackson.annotation.JsonProperty;

public record ToggleFavoriteResponse(
    String message,
    @JsonProperty("channel_id") String channelId,
    String action
) {
    public static ToggleFavoriteResponse from(ToggleResult result) {
        return new ToggleFavoriteResponse(
            result.action().getMessage(),
            result.channelId(),
            result.action().getLabel());
    }
}
