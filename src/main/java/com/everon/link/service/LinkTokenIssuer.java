package com.everon.link.service;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;
import java.util.HexFormat;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

import org.springframework.stereotype.Service;

import com.everon.link.config.EveronLinkProperties;
import com.everon.link.exception.LinkTokenException;
import com.everon.link.model.dto.LinkToken;
import com.everon.link.model.dto.LinkTokenPayload;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Issues signed link tokens for bound chats.
 *
 * Token body: Base64 of {@code {"v":1,"cid":"<chat>","ts":<unix seconds>,"sig":"<hex>"}}
 * where {@code sig = HMAC-SHA256(secret, cid + "." + ts)}.
 *
 * Nothing is stored. A token stays usable until the verifier's freshness
 * window closes; issuing a new one does not revoke older ones.
 *
 * @author EverOn Engineering
 * @since October 2026
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LinkTokenIssuer {

    private static final String HMAC_ALGORITHM = "HmacSHA256";

    private final EveronLinkProperties properties;
    private final Clock clock;
    private final ObjectMapper objectMapper;

    @PostConstruct
    void init() {
        if (!properties.isSecretConfigured()) {
            log.error("REG_SECRET is not set! Registration codes cannot be matched and link tokens cannot be signed.");
            return;
        }
        log.info("LINK_TOKEN: Signing v{} link tokens, verifier window {}",
                properties.getToken().getVersion(), properties.getToken().getFreshness());
    }

    /**
     * Issue a token for a chat at the current time.
     */
    public LinkToken issue(String channelId) {
        String secret = properties.getCanonicalSecret();
        if (secret == null) {
            throw new LinkTokenException("Registration secret not configured. Set REG_SECRET.");
        }
        return issue(channelId, secret, clock.instant());
    }

    /**
     * Issue a token for a chat with an explicit secret and issuance time.
     */
    public LinkToken issue(String channelId, String secret, Instant issuedAt) {
        long ts = issuedAt.getEpochSecond();
        LinkTokenPayload payload = new LinkTokenPayload(
                properties.getToken().getVersion(),
                channelId,
                ts,
                sign(channelId, ts, secret));

        LinkToken token = new LinkToken(payload, encode(payload));
        log.debug("LINK_TOKEN: Issued token for chat {} at {}", channelId, ts);
        return token;
    }

    /**
     * Hex HMAC-SHA256 over {@code channelId + "." + issuedAt}.
     */
    public static String sign(String channelId, long issuedAt, String secret) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
            byte[] hash = mac.doFinal((channelId + "." + issuedAt).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (GeneralSecurityException e) {
            throw new LinkTokenException("Failed to sign link token", e);
        }
    }

    private String encode(LinkTokenPayload payload) {
        try {
            byte[] json = objectMapper.writeValueAsBytes(payload);
            return Base64.getEncoder().encodeToString(json);
        } catch (JsonProcessingException e) {
            throw new LinkTokenException("Failed to encode link token", e);
        }
    }
}
