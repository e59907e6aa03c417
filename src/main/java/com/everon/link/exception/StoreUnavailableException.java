package com.everon.link.exception;

/**
 * Exception thrown when the registration store cannot be read or written.
 * Callers may retry the whole request.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
