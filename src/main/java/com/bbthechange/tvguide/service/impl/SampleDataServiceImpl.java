package com.bbthechange.tvguide.service.impl;

import com.bbthechange.tvguide.dto.SampleChannel;
import com.bbthechange.tvguide.dto.SeedResultDTO;
import com.bbthechange.tvguide.model.Channel;
import com.bbthechange.tvguide.repository.ChannelRepository;
import com.bbthechange.tvguide.service.SampleChannelCatalog;
import com.bbthechange.tvguide.service.SampleDataService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

@Service
public class SampleDataServiceImpl implements SampleDataService {

    private static final Logger logger = LoggerFactory.getLogger(SampleDataServiceImpl.class);

    private final ChannelRepository channelRepository;
    private final SampleChannelCatalog sampleChannelCatalog;

    public SampleDataServiceImpl(ChannelRepository channelRepository, SampleChannelCatalog sampleChannelCatalog) {
        this.channelRepository = channelRepository;
        this.sampleChannelCatalog = sampleChannelCatalog;
    }

    @Override
    public SeedResultDTO initializeSampleData() {
        long existing = channelRepository.count();
        if (existing > 0) {
            logger.info("Catalog already holds {} channels, skipping seed", existing);
            return SeedResultDTO.alreadyInitialized(existing);
        }

        List<Channel> channels = sampleChannelCatalog.load().stream()
            .map(this::toChannel)
            .collect(Collectors.toList());

        int created = channelRepository.saveAll(channels);
        logger.info("Seeded catalog with {} sample channels", created);
        return SeedResultDTO.created(created);
    }

    private Channel toChannel(SampleChannel sample) {
        return Channel.newChannel(sample.name(), sample.logo(), sample.stream(), sample.category(), sample.description());
    }
}
