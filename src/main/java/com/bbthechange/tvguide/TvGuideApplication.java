package com.bbthechange.tvguide;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;

@SpringBootApplication
@ConfigurationPropertiesScan
public class TvGuideApplication {

	private static final Logger logger = LoggerFactory.getLogger(TvGuideApplication.class);

	public static void main(String[] args) {
		SpringApplication.run(TvGuideApplication.class, args);
	}

	@EventListener(WebServerInitializedEvent.class)
	public void onWebServerReady(WebServerInitializedEvent event) {
		logger.info("Live TV API listening on port {}", event.getWebServer().getPort());
	}

}
