package com.bbthechange.tvguide.model;

/**
 * Number of catalog channels sharing one category label.
 */
public record CategoryCount(String name, long count) {
}
