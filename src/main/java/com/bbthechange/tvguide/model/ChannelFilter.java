package com.bbthechange.tvguide.model;

import java.util.Locale;

/**
 * Listing criteria for the channel catalog.
 *
 * Category and search are case-insensitive, unanchored substring matches against
 * {@code category} and {@code name}. Blank terms are treated as absent.
 */
public record ChannelFilter(String category, String search, boolean activeOnly) {

    public boolean matches(Channel channel) {
        if (activeOnly && !channel.isActive()) {
            return false;
        }
        return containsIgnoreCase(channel.getCategory(), category)
            && containsIgnoreCase(channel.getName(), search);
    }

    private static boolean containsIgnoreCase(String value, String term) {
        if (term == null || term.isBlank()) {
            return true;
        }
        if (value == null) {
            return false;
        }
        return value.toLowerCase(Locale.ROOT).contains(term.toLowerCase(Locale.ROOT));
    }
}
