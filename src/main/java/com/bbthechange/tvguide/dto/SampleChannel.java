package com.bbthechange.tvguide.dto;

/**
 * One entry of the bundled sample catalog.
 */
public record SampleChannel(String name, String logo, String stream, String category, String description) {
}
