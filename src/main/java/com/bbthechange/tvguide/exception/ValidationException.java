package com.bbthechange.tvguide.exception;

/**
 * Exception thrown when a caller-supplied payload fails a precondition.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
