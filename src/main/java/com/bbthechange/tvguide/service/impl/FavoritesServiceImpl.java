package com.bbthechange.tvguide.service.impl;

import com.bbthechange.tvguide.dto.UserFavoritesDTO;
import com.bbthechange.tvguide.exception.ValidationException;
import com.bbthechange.tvguide.model.ToggleResult;
import com.bbthechange.tvguide.repository.UserFavoritesRepository;
import com.bbthechange.tvguide.service.FavoritesService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class FavoritesServiceImpl implements FavoritesService {

    private static final Logger logger = LoggerFactory.getLogger(FavoritesServiceImpl.class);

    private final UserFavoritesRepository favoritesRepository;

    public FavoritesServiceImpl(UserFavoritesRepository favoritesRepository) {
        this.favoritesRepository = favoritesRepository;
    }

    @Override
    public UserFavoritesDTO getFavorites(String userId) {
        requireId(userId, "User ID");
        return new UserFavoritesDTO(favoritesRepository.getOrCreate(userId));
    }

    @Override
    public UserFavoritesDTO replaceFavorites(String userId, List<String> channelIds) {
        requireId(userId, "User ID");
        if (channelIds == null) {
            throw new ValidationException("channel_ids is required");
        }
        if (channelIds.stream().anyMatch(id -> id == null)) {
            throw new ValidationException("channel_ids must not contain null entries");
        }

        UserFavoritesDTO result = new UserFavoritesDTO(favoritesRepository.replaceChannelIds(userId, channelIds));
        logger.info("Replaced favorites for user {} ({} channels)", userId, channelIds.size());
        return result;
    }

    @Override
    public ToggleResult toggleFavorite(String userId, String channelId) {
        requireId(userId, "User ID");
        requireId(channelId, "Channel ID");
        return favoritesRepository.toggleChannel(userId, channelId);
    }

    private static void requireId(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(fieldName + " is required");
        }
    }
}
