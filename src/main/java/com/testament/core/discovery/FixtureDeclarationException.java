package com.testament.core.discovery;

/**
 * A class declares its fixtures in a way the engine cannot use, e.g. two {@code @Setup}
 * methods in one class. The message is the failed-import entry shown to the user.
 */
public class FixtureDeclarationException extends RuntimeException {

    public FixtureDeclarationException(String message) {
        super(message);
    }
}
