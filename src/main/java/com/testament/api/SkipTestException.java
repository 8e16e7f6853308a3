package com.testament.api;

/**
 * Thrown from a test or fixture to record it as skipped.
 */
public class SkipTestException extends RuntimeException {

    public SkipTestException(String message) {
        super(message);
    }
}
