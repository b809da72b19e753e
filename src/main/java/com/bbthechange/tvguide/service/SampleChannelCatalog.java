package com.bbthechange.tvguide.service;

import com.bbthechange.tvguide.config.TvGuideProperties;
import com.bbthechange.tvguide.dto.SampleChannel;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Reads the sample channel dataset from the resource named by {@code tvguide.seed.resource}.
 */
@Component
public class SampleChannelCatalog {

    private static final Logger logger = LoggerFactory.getLogger(SampleChannelCatalog.class);

    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;
    private final String location;

    public SampleChannelCatalog(ResourceLoader resourceLoader, ObjectMapper objectMapper, TvGuideProperties properties) {
        this.resourceLoader = resourceLoader;
        this.objectMapper = objectMapper;
        this.location = properties.getSeed().getResource();
    }

    public List<SampleChannel> load() {
        Resource resource = resourceLoader.getResource(location);
        try (InputStream in = resource.getInputStream()) {
            List<SampleChannel> channels = objectMapper.readValue(in, new TypeReference<List<SampleChannel>>() {});
            logger.debug("Loaded {} sample channels from {}", channels.size(), location);
            return channels;
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read sample channels from " + location, e);
        }
    }
}
