package com.bbthechange.tvguide.model;

/**
 * Outcome of a favorites toggle: the membership the channel has after the call.
 */
public enum FavoriteAction {
    ADDED("added", "Channel added to favorites"),
    REMOVED("removed", "Channel removed from favorites");

    private final String label;
    private final String message;

    FavoriteAction(String label, String message) {
        this.label = label;
        this.message = message;
    }

    public String getLabel() {
        return label;
    }

    public String getMessage() {
        return message;
    }

    public static FavoriteAction forMembership(boolean present) {
        return present ? ADDED : REMOVED;
    }
}
