package com.testament.core.discovery;

/**
 * A module could not be imported. The message is the failed-import entry.
 */
public class ModuleLoadException extends RuntimeException {

    public ModuleLoadException(String message) {
        super(message);
    }

    public ModuleLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
