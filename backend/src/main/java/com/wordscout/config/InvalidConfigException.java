package com.wordscout.config;

/**
 * Raised when a component is constructed or configured with values outside its accepted bounds.
 * Always thrown eagerly, never deferred to the first call that would use the bad value.
 */
public class InvalidConfigException extends RuntimeException {
    public InvalidConfigException(String message) {
        super(message);
    }

    public InvalidConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
