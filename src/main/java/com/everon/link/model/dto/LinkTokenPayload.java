package com.everon.link.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Signed payload carried by the device link QR.
 *
 * Serialized as {@code {"v":1,"cid":"42","ts":1700000000,"sig":"..."}}; the
 * signature is hex HMAC-SHA256 over {@code cid + "." + ts}.
 */
@JsonPropertyOrder({"v", "cid", "ts", "sig"})
public record LinkTokenPayload(
        @JsonProperty("v") int version,
        @JsonProperty("cid") String channelId,
        @JsonProperty("ts") long issuedAt,
        @JsonProperty("sig") String signature
) {
}
