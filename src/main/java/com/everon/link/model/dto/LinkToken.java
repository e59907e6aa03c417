package com.everon.link.model.dto;

/**
 * An issued link token: the payload and its Base64 transit form.
 */
public record LinkToken(LinkTokenPayload payload, String encoded) {

    public String channelId() {
        return payload.channelId();
    }

    public long issuedAt() {
        return payload.issuedAt();
    }
}
