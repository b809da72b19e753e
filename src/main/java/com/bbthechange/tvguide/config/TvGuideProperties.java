package com.bbthechange.tvguide.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Application settings bound from the {@code tvguide.*} namespace.
 */
@Data
@ConfigurationProperties(prefix = "tvguide")
public class TvGuideProperties {

    private final Dynamodb dynamodb = new Dynamodb();
    private final Cors cors = new Cors();
    private final Seed seed = new Seed();

    @Data
    public static class Dynamodb {
        private String channelsTable = "Channels";
        private String favoritesTable = "UserFavorites";
    }

    @Data
    public static class Cors {
        private List<String> allowedOrigins = new ArrayList<>(List.of("*"));
    }

    @Data
    public static class Seed {
        private String resource = "classpath:data/sample-channels.json";
    }
}
