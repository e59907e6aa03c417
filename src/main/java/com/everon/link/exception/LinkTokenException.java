package com.everon.link.exception;

/**
 * Exception thrown when a link token cannot be signed or encoded.
 */
public class LinkTokenException extends RuntimeException {

    public LinkTokenException(String message) {
        super(message);
    }

    public LinkTokenException(String message, Throwable cause) {
        super(message, cause);
    }
}
