package com.bbthechange.tvguide.service;

import com.bbthechange.tvguide.config.TvGuideProperties;
import com.bbthechange.tvguide.dto.SampleChannel;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.io.UncheckedIOException;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class SampleChannelCatalogTest {

    @Test
    void load_BundledDataset_HasFifteenCompleteChannels() {
        SampleChannelCatalog catalog = new SampleChannelCatalog(
            new DefaultResourceLoader(), new ObjectMapper(), new TvGuideProperties());

        List<SampleChannel> channels = catalog.load();

        assertThat(channels).hasSize(15);
        assertThat(channels).allSatisfy(channel -> {
            assertThat(channel.name()).isNotBlank();
            assertThat(channel.logo()).isNotBlank();
            assertThat(channel.stream()).isNotBlank();
            assertThat(channel.category()).isNotBlank();
        });
    }

    @Test
    void load_MissingResource_ThrowsUncheckedIOException() {
        TvGuideProperties properties = new TvGuideProperties();
        properties.getSeed().setResource("classpath:data/does-not-exist.json");
        SampleChannelCatalog catalog = new SampleChannelCatalog(new DefaultResourceLoader(), new ObjectMapper(), properties);

        assertThatThrownBy(catalog::load)
            .isInstanceOf(UncheckedIOException.class)
            .hasMessageContaining("does-not-exist.json");
    }
}
