package com.everon.link.exception;

/**
 * Exception thrown when a record was changed by another writer between read and save.
 */
public class StoreConflictException extends RuntimeException {

    public StoreConflictException(String codeHash) {
        super("Registration changed concurrently: " + abbreviate(codeHash));
    }

    public StoreConflictException(String codeHash, Throwable cause) {
        super("Registration changed concurrently: " + abbreviate(codeHash), cause);
    }

    private static String abbreviate(String codeHash) {
        return codeHash == null ? "?" : codeHash.substring(0, Math.min(8, codeHash.length()));
    }
}
