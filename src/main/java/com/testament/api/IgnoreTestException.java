package com.testament.api;

/**
 * Thrown from a test to drop it from the results entirely, e.g. when a capability check
 * decides mid-run that the test does not apply to the environment.
 */
public class IgnoreTestException extends RuntimeException {

    public IgnoreTestException(String message) {
        super(message);
    }
}
