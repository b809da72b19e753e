package com.bbthechange.tvguide.service.impl;

import com.bbthechange.tvguide.dto.UserFavoritesDTO;
import com.bbthechange.tvguide.exception.RepositoryException;
import com.bbthechange.tvguide.exception.ValidationException;
import com.bbthechange.tvguide.model.FavoriteAction;
import com.bbthechange.tvguide.model.ToggleResult;
import com.bbthechange.tvguide.model.UserFavorites;
import com.bbthechange.tvguide.repository.UserFavoritesRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class FavoritesServiceImplTest {

    @Mock
    private UserFavoritesRepository favoritesRepository;

    @InjectMocks
    private FavoritesServiceImpl favoritesService;

    private static UserFavorites favorites(String userId, String... channelIds) {
        return new UserFavorites("fav-1", userId, new ArrayList<>(List.of(channelIds)), Instant.now(), 1L);
    }

    @Test
    void getFavorites_ReturnsRecordFromGetOrCreate() {
        when(favoritesRepository.getOrCreate("u1")).thenReturn(UserFavorites.empty("u1"));

        UserFavoritesDTO result = favoritesService.getFavorites("u1");

        assertThat(result.getUserId()).isEqualTo("u1");
        assertThat(result.getChannelIds()).isEmpty();
        assertThat(result.getId()).isNotBlank();
    }

    @Test
    void getFavorites_BlankUserId_ThrowsValidationException() {
        assertThatThrownBy(() -> favoritesService.getFavorites(" "))
            .isInstanceOf(ValidationException.class);
        verifyNoInteractions(favoritesRepository);
    }

    @Test
    void replaceFavorites_PassesListThroughVerbatim() {
        List<String> requested = List.of("c1", "c1", "c2");
        when(favoritesRepository.replaceChannelIds("u1", requested)).thenReturn(favorites("u1", "c1", "c1", "c2"));

        UserFavoritesDTO result = favoritesService.replaceFavorites("u1", requested);

        assertThat(result.getChannelIds()).containsExactly("c1", "c1", "c2");
    }

    @Test
    void replaceFavorites_NullList_ThrowsValidationException() {
        assertThatThrownBy(() -> favoritesService.replaceFavorites("u1", null))
            .isInstanceOf(ValidationException.class);
        verifyNoInteractions(favoritesRepository);
    }

    @Test
    void replaceFavorites_NullEntry_ThrowsValidationException() {
        assertThatThrownBy(() -> favoritesService.replaceFavorites("u1", Arrays.asList("c1", null)))
            .isInstanceOf(ValidationException.class);
        verifyNoInteractions(favoritesRepository);
    }

    @Test
    void toggleFavorite_DelegatesAndReturnsResult() {
        ToggleResult toggled = new ToggleResult(FavoriteAction.ADDED, "c1");
        when(favoritesRepository.toggleChannel("u1", "c1")).thenReturn(toggled);

        assertThat(favoritesService.toggleFavorite("u1", "c1")).isSameAs(toggled);
    }

    @Test
    void toggleFavorite_BlankChannelId_ThrowsValidationException() {
        assertThatThrownBy(() -> favoritesService.toggleFavorite("u1", ""))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("Channel ID");
        verifyNoInteractions(favoritesRepository);
    }

    @Test
    void toggleFavorite_StorageFailurePropagates() {
        when(favoritesRepository.toggleChannel(anyString(), anyString()))
            .thenThrow(new RepositoryException("Failed to update favorites"));

        assertThatThrownBy(() -> favoritesService.toggleFavorite("u1", "c1"))
            .isInstanceOf(RepositoryException.class);
    }
}
