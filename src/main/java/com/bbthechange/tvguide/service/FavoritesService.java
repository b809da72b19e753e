package com.bbthechange.tvguide.service;

import com.bbthechange.tvguide.dto.UserFavoritesDTO;
import com.bbthechange.tvguide.model.ToggleResult;

import java.util.List;

/**
 * Service interface for per-user favorite channels.
 * Channel ids are not checked against the catalog.
 */
public interface FavoritesService {

    /**
     * Get a user's favorites. A user without a record gets an empty one, which is persisted.
     */
    UserFavoritesDTO getFavorites(String userId);

    /**
     * Overwrite a user's favorites with exactly the given list.
     */
    UserFavoritesDTO replaceFavorites(String userId, List<String> channelIds);

    /**
     * Add the channel if absent, remove it if present.
     */
    ToggleResult toggleFavorite(String userId, String channelId);
}
