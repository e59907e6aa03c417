package com.everon.link.model.enums;

/**
 * What a chat asks the binding core to do.
 */
public enum InboundEventKind {

    /**
     * Claim a registration with the code in the message text
     */
    BIND_ATTEMPT,

    /**
     * Release the chat's binding (optionally naming the code)
     */
    UNBIND,

    /**
     * Issue a fresh link token for the chat's existing binding
     */
    REISSUE_TOKEN
}
