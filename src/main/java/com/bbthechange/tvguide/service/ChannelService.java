package com.bbthechange.tvguide.service;

import com.bbthechange.tvguide.dto.ChannelDTO;
import com.bbthechange.tvguide.dto.CreateChannelRequest;
import com.bbthechange.tvguide.dto.UpdateChannelRequest;
import com.bbthechange.tvguide.model.CategoryCount;
import com.bbthechange.tvguide.model.ChannelFilter;

import java.util.List;

/**
 * Service interface for channel catalog operations.
 */
public interface ChannelService {

    /**
     * List channels matching the filter, at most 1000.
     * @param filter category/search substrings and the active-only flag
     * @return matching channels, empty when nothing matches
     */
    List<ChannelDTO> getChannels(ChannelFilter filter);

    /**
     * Add a channel. The id and creation time are generated and the channel starts active.
     * @param request channel fields; category defaults to "General"
     * @return the stored channel
     */
    ChannelDTO createChannel(CreateChannelRequest request);

    /**
     * @throws com.bbthechange.tvguide.exception.ChannelNotFoundException if no channel has that id
     */
    ChannelDTO getChannel(String channelId);

    /**
     * Apply the non-null fields of the request.
     * @throws com.bbthechange.tvguide.exception.ValidationException if the request sets nothing
     * @throws com.bbthechange.tvguide.exception.ChannelNotFoundException if no channel has that id
     */
    ChannelDTO updateChannel(String channelId, UpdateChannelRequest request);

    /**
     * Permanently remove a channel.
     * @throws com.bbthechange.tvguide.exception.ChannelNotFoundException if no channel has that id
     */
    void deleteChannel(String channelId);

    /**
     * Per-category channel counts over the whole catalog, ordered by category name.
     */
    List<CategoryCount> getCategories();
}
