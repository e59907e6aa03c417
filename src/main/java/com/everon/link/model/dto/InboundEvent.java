package com.everon.link.model.dto;

import com.everon.link.model.enums.InboundEventKind;

/**
 * Transport-neutral view of one chat request.
 *
 * @param channelId chat identity as a string
 * @param rawText   text the user sent (may be null for REISSUE_TOKEN and UNBIND)
 * @param kind      requested operation
 */
public record InboundEvent(String channelId, String rawText, InboundEventKind kind) {

    public static InboundEvent bindAttempt(String channelId, String rawText) {
        return new InboundEvent(channelId, rawText, InboundEventKind.BIND_ATTEMPT);
    }

    public static InboundEvent unbind(String channelId, String rawText) {
        return new InboundEvent(channelId, rawText, InboundEventKind.UNBIND);
    }

    public static InboundEvent reissueToken(String channelId) {
        return new InboundEvent(channelId, null, InboundEventKind.REISSUE_TOKEN);
    }
}
