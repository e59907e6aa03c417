package com.everon.link.service;

import java.io.IOException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.util.Base64;
import java.util.Locale;

import org.springframework.stereotype.Service;

import com.everon.link.config.EveronLinkProperties;
import com.everon.link.model.dto.LinkTokenPayload;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Checks link tokens the way a device does: recompute the signature and
 * reject anything outside the freshness window.
 *
 * @author EverOn Engineering
 * @since October 2026
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LinkTokenVerifier {

    private final EveronLinkProperties properties;
    private final Clock clock;
    private final ObjectMapper objectMapper;

    public record VerificationResult(boolean valid, String channelId, Long issuedAt, String errorMessage) {

        public static VerificationResult success(LinkTokenPayload payload) {
            return new VerificationResult(true, payload.channelId(), payload.issuedAt(), null);
        }

        public static VerificationResult failure(String errorMessage) {
            return new VerificationResult(false, null, null, errorMessage);
        }
    }

    /**
     * Verify an encoded token.
     *
     * @param encoded Base64 token body, optionally still URL-encoded
     */
    public VerificationResult verify(String encoded) {
        if (encoded == null || encoded.isBlank()) {
            return VerificationResult.failure("Token is required");
        }
        String secret = properties.getCanonicalSecret();
        if (secret == null) {
            return VerificationResult.failure("Verifier not configured");
        }

        LinkTokenPayload payload;
        try {
            String body = encoded.contains("%") ? URLDecoder.decode(encoded, StandardCharsets.UTF_8) : encoded;
            byte[] json = Base64.getDecoder().decode(body.trim());
            payload = objectMapper.readValue(json, LinkTokenPayload.class);
        } catch (IllegalArgumentException | IOException e) {
            log.debug("LINK_TOKEN: Undecodable token: {}", e.getMessage());
            return VerificationResult.failure("Malformed token");
        }

        if (payload.channelId() == null || payload.signature() == null) {
            return VerificationResult.failure("Malformed token");
        }
        if (payload.version() != properties.getToken().getVersion()) {
            return VerificationResult.failure("Unsupported token version");
        }

        String expected = LinkTokenIssuer.sign(payload.channelId(), payload.issuedAt(), secret);
        if (!MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.US_ASCII),
                payload.signature().toLowerCase(Locale.ROOT).getBytes(StandardCharsets.US_ASCII))) {
            log.warn("LINK_TOKEN: Signature mismatch for chat {}", payload.channelId());
            return VerificationResult.failure("Invalid signature");
        }

        long now = clock.instant().getEpochSecond();
        Duration freshness = properties.getToken().getFreshness();
        Duration skew = properties.getToken().getClockSkew();
        if (payload.issuedAt() > now + skew.getSeconds()) {
            return VerificationResult.failure("Token issued in the future");
        }
        if (now - payload.issuedAt() > freshness.getSeconds()) {
            return VerificationResult.failure("Token expired");
        }

        return VerificationResult.success(payload);
    }
}
