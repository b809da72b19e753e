package com.bbthechange.tvguide.exception;

/**
 * Exception thrown when a channel id has no record in the catalog.
 */
public class ChannelNotFoundException extends ResourceNotFoundException {

    private final String channelId;

    public ChannelNotFoundException(String channelId) {
        super("Channel not found: " + channelId);
        this.channelId = channelId;
    }

    public String getChannelId() {
        return channelId;
    }
}
