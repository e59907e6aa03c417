package com.everon.link.model.enums;

/**
 * Lifecycle status of a registration, controlled by provisioning.
 */
public enum RegistrationStatus {

    /**
     * Registration can be claimed by a chat
     */
    ACTIVE,

    /**
     * Registration is not yet (or no longer) in service
     */
    INACTIVE,

    /**
     * Registration was suspended by an operator
     */
    SUSPENDED
}
