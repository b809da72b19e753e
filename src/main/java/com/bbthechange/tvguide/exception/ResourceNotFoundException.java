package com.bbthechange.tvguide.exception;

/**
 * Base exception for lookups by key that found no record.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }
}
