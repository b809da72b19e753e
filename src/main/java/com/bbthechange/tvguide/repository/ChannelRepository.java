package com.bbthechange.tvguide.repository;

import com.bbthechange.tvguide.model.CategoryCount;
import com.bbthechange.tvguide.model.Channel;
import com.bbthechange.tvguide.model.ChannelFilter;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistent store of catalog channels.
 * Every method throws {@link com.bbthechange.tvguide.exception.RepositoryException} when the store fails.
 */
public interface ChannelRepository {

    /** Upper bound on the number of channels a single listing returns. */
    int MAX_RESULTS = 1000;

    /**
     * List channels matching the filter, in store order, capped at {@link #MAX_RESULTS}.
     */
    List<Channel> findAll(ChannelFilter filter);

    Optional<Channel> findById(String id);

    /**
     * Insert a new channel. Fails if the id is already taken.
     */
    Channel save(Channel channel);

    /**
     * Atomically set the given attributes on an existing channel.
     *
     * @param id channel id
     * @param fields attribute name to new value; must not be empty and must not contain {@code id} or {@code createdAt}
     * @return the full record after the update, or empty if no channel has that id
     */
    Optional<Channel> update(String id, Map<String, AttributeValue> fields);

    /**
     * Hard-delete a channel.
     * @return false if no channel had that id
     */
    boolean deleteById(String id);

    /**
     * Channel counts grouped by category, over all channels (active or not), sorted by category name.
     */
    List<CategoryCount> countByCategory();

    long count();

    /**
     * Bulk insert. Each channel must already carry its own id and creation time.
     * @return number of channels written
     */
    int saveAll(List<Channel> channels);
}
