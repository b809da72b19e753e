package com.bbthechange.tvguide.service.impl;

import com.bbthechange.tvguide.dto.ChannelDTO;
import com.bbthechange.tvguide.dto.CreateChannelRequest;
import com.bbthechange.tvguide.dto.UpdateChannelRequest;
import com.bbthechange.tvguide.exception.ChannelNotFoundException;
import com.bbthechange.tvguide.exception.ValidationException;
import com.bbthechange.tvguide.model.CategoryCount;
import com.bbthechange.tvguide.model.Channel;
import com.bbthechange.tvguide.model.ChannelFilter;
import com.bbthechange.tvguide.repository.ChannelRepository;
import com.bbthechange.tvguide.service.ChannelService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Service
public class ChannelServiceImpl implements ChannelService {

    private static final Logger logger = LoggerFactory.getLogger(ChannelServiceImpl.class);

    private final ChannelRepository channelRepository;

    public ChannelServiceImpl(ChannelRepository channelRepository) {
        this.channelRepository = channelRepository;
    }

    @Override
    public List<ChannelDTO> getChannels(ChannelFilter filter) {
        List<ChannelDTO> channels = channelRepository.findAll(filter).stream()
            .map(ChannelDTO::new)
            .collect(Collectors.toList());
        logger.debug("Found {} channels for {}", channels.size(), filter);
        return channels;
    }

    @Override
    public ChannelDTO createChannel(CreateChannelRequest request) {
        if (request.getName() == null || request.getName().isBlank()) {
            throw new ValidationException("Channel name is required");
        }

        Channel channel = Channel.newChannel(
            request.getName(),
            request.getLogo(),
            request.getStream(),
            request.getCategory(),
            request.getDescription());

        Channel saved = channelRepository.save(channel);
        logger.info("Created channel {} '{}' in category {}", saved.getId(), saved.getName(), saved.getCategory());
        return new ChannelDTO(saved);
    }

    @Override
    public ChannelDTO getChannel(String channelId) {
        return channelRepository.findById(channelId)
            .map(ChannelDTO::new)
            .orElseThrow(() -> new ChannelNotFoundException(channelId));
    }

    @Override
    public ChannelDTO updateChannel(String channelId, UpdateChannelRequest request) {
        Map<String, AttributeValue> updates = toAttributeUpdates(request);
        if (updates.isEmpty()) {
            throw new ValidationException("No valid fields to update");
        }

        Channel updated = channelRepository.update(channelId, updates)
            .orElseThrow(() -> new ChannelNotFoundException(channelId));
        logger.info("Updated channel {} fields {}", channelId, updates.keySet());
        return new ChannelDTO(updated);
    }

    @Override
    public void deleteChannel(String channelId) {
        if (!channelRepository.deleteById(channelId)) {
            throw new ChannelNotFoundException(channelId);
        }
        logger.info("Deleted channel {}", channelId);
    }

    @Override
    public List<CategoryCount> getCategories() {
        return channelRepository.countByCategory();
    }

    private Map<String, AttributeValue> toAttributeUpdates(UpdateChannelRequest request) {
        Map<String, AttributeValue> updates = new LinkedHashMap<>();

        if (request.getName() != null) {
            if (request.getName().isBlank()) {
                throw new ValidationException("Channel name must not be blank");
            }
            updates.put("name", string(request.getName()));
        }
        if (request.getLogo() != null) updates.put("logo", string(request.getLogo()));
        if (request.getStream() != null) updates.put("stream", string(request.getStream()));
        if (request.getCategory() != null) updates.put("category", string(request.getCategory()));
        if (request.getDescription() != null) updates.put("description", string(request.getDescription()));
        if (request.getIsActive() != null) {
            updates.put("isActive", AttributeValue.builder().bool(request.getIsActive()).build());
        }

        return updates;
    }

    private static AttributeValue string(String value) {
        return AttributeValue.builder().s(value).build();
    }
}
