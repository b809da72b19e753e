package com.bbthechange.tvguide.controller;

import com.bbthechange.tvguide.dto.ToggleFavoriteResponse;
import com.bbthechange.tvguide.dto.UpdateFavoritesRequest;
import com.bbthechange.tvguide.dto.UserFavoritesDTO;
import com.bbthechange.tvguide.service.FavoritesService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST controller for per-user favorite channels.
 */
@RestController
@RequestMapping("/favorites/{userId}")
@Tag(name = "Favorites", description = "Per-user favorite channels")
public class FavoritesController extends BaseController {

    private static final Logger logger = LoggerFactory.getLogger(FavoritesController.class);

    private final FavoritesService favoritesService;

    public FavoritesController(FavoritesService favoritesService) {
        this.favoritesService = favoritesService;
    }

    @GetMapping
    @Operation(summary = "Get a user's favorites",
               description = "Creates and stores an empty favorites record the first time a user is read.")
    public ResponseEntity<UserFavoritesDTO> getFavorites(@PathVariable String userId) {
        return ResponseEntity.ok(favoritesService.getFavorites(userId));
    }

    @PutMapping
    @Operation(summary = "Replace a user's favorites", description = "The list is stored exactly as sent.")
    public ResponseEntity<UserFavoritesDTO> replaceFavorites(
            @PathVariable String userId,
            @Valid @RequestBody UpdateFavoritesRequest request) {

        logger.info("Replacing favorites for user {}", userId);
        return ResponseEntity.ok(favoritesService.replaceFavorites(userId, request.getChannelIds()));
    }

    @PostMapping("/toggle/{channelId}")
    @Operation(summary = "Toggle a channel in a user's favorites")
    public ResponseEntity<ToggleFavoriteResponse> toggleFavorite(
            @PathVariable String userId,
            @PathVariable String channelId) {

        return ResponseEntity.ok(ToggleFavoriteResponse.from(favoritesService.toggleFavorite(userId, channelId)));
    }
}
