package com.bbthechange.tvguide.model;

/**
 * Result of flipping one channel's membership in a user's favorites.
 */
public record ToggleResult(FavoriteAction action, String channelId) {
}
