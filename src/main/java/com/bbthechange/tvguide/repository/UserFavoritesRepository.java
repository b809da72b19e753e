package com.bbthechange.tvguide.repository;

import com.bbthechange.tvguide.model.ToggleResult;
import com.bbthechange.tvguide.model.UserFavorites;

import java.util.List;
import java.util.Optional;

/**
 * Persistent store of per-user favorites, one record per user id.
 */
public interface UserFavoritesRepository {

    Optional<UserFavorites> findByUserId(String userId);

    /**
     * Return the user's record, first persisting an empty one if none exists.
     * Reading through this method therefore has a write side effect.
     */
    UserFavorites getOrCreate(String userId);

    /**
     * Overwrite the user's channel list as given (no de-duplication), creating the record if absent.
     */
    UserFavorites replaceChannelIds(String userId, List<String> channelIds);

    /**
     * Flip membership of one channel in the user's favorites, creating the record if absent.
     * Concurrent toggles on the same user are each applied exactly once; a caller that loses
     * a race re-reads and tries again until its own write lands.
     */
    ToggleResult toggleChannel(String userId, String channelId);
}
