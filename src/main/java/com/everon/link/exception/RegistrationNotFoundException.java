package com.everon.link.exception;

/**
 * Exception thrown when a registration is not found.
 */
public class RegistrationNotFoundException extends RuntimeException {

    public RegistrationNotFoundException(String codeHash) {
        super("Registration not found: " + codeHash);
    }
}
