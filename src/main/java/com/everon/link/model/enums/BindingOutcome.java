package com.everon.link.model.enums;

/**
 * Result of one pass through the binding pipeline.
 */
public enum BindingOutcome {

    /** Unbound record is now bound to the requesting chat. */
    BOUND(true),

    /** Record was already bound to the requesting chat; a fresh token is issued. */
    ALREADY_BOUND_TO_CHANNEL(true),

    /** Binding removed by its holder. */
    UNBOUND(true),

    /** Fresh token issued for an existing binding. */
    TOKEN_REISSUED(true),

    /** Input does not have the shape of a registration code. No lookup was made. */
    INVALID_FORMAT(false),

    /** No registration matches the code. */
    NOT_FOUND(false),

    /** Registration status is not ACTIVE. */
    NOT_ACTIVE(false),

    /** Registration validity window has not started yet. */
    NOT_STARTED(false),

    /** Registration validity window has ended. */
    EXPIRED(false),

    /** Registration is bound to a different chat. */
    ALREADY_LINKED_ELSEWHERE(false),

    /** Unbind requested by a chat that does not hold the binding. */
    NOT_OWNER(false),

    /** Nothing is bound for this request. */
    NOT_BOUND(false),

    /** The store could not be read or written; safe to retry the whole request. */
    STORE_UNAVAILABLE(false);

    private final boolean success;

    BindingOutcome(boolean success) {
        this.success = success;
    }

    public boolean isSuccess() {
        return success;
    }

    /**
     * Only store outages are worth retrying with the same input.
     */
    public boolean isTransient() {
        return this == STORE_UNAVAILABLE;
    }
}
