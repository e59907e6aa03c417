package com.everon.link.exception;

/**
 * Exception thrown when provisioning a code whose hash already exists.
 */
public class DuplicateRegistrationException extends RuntimeException {

    public DuplicateRegistrationException(String codeHash) {
        super("Registration already exists: " + codeHash.substring(0, Math.min(8, codeHash.length())));
    }
}
