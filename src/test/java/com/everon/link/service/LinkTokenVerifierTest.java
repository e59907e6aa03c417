package com.everon.link.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Base64;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.everon.link.config.EveronLinkProperties;
import com.everon.link.model.dto.LinkToken;
import com.everon.link.service.LinkTokenVerifier.VerificationResult;
import com.everon.link.support.TestFixtures;
import com.fasterxml.jackson.databind.ObjectMapper;

class LinkTokenVerifierTest {

    private static final Instant ISSUED = Instant.ofEpochSecond(1_700_000_000L);

    private EveronLinkProperties properties;
    private ObjectMapper objectMapper;
    private LinkToken token;

    @BeforeEach
    void setUp() {
        properties = TestFixtures.properties();
        objectMapper = TestFixtures.objectMapper();
        token = new LinkTokenIssuer(properties, Clock.fixed(ISSUED, ZoneOffset.UTC), objectMapper).issue("42");
    }

    @Test
    void acceptsFreshToken() {
        VerificationResult result = verifierAt(ISSUED.plusSeconds(60)).verify(token.encoded());

        assertTrue(result.valid());
        assertEquals("42", result.channelId());
        assertEquals(ISSUED.getEpochSecond(), result.issuedAt());
    }

    @Test
    void acceptsUrlEncodedToken() {
        String urlEncoded = URLEncoder.encode(token.encoded(), StandardCharsets.UTF_8);

        assertTrue(verifierAt(ISSUED).verify(urlEncoded).valid());
    }

    @Test
    void rejectsTokenOutsideFreshnessWindow() {
        VerificationResult result = verifierAt(ISSUED.plusSeconds(601)).verify(token.encoded());

        assertFalse(result.valid());
        assertEquals("Token expired", result.errorMessage());
    }

    @Test
    void rejectsTokenFromTheFuture() {
        VerificationResult result = verifierAt(ISSUED.minusSeconds(120)).verify(token.encoded());

        assertEquals("Token issued in the future", result.errorMessage());
        assertTrue(verifierAt(ISSUED.minusSeconds(10)).verify(token.encoded()).valid());
    }

    @Test
    void rejectsTamperedChat() {
        String json = "{\"v\":1,\"cid\":\"99\",\"ts\":" + ISSUED.getEpochSecond()
                + ",\"sig\":\"" + token.payload().signature() + "\"}";
        String forged = Base64.getEncoder().encodeToString(json.getBytes(StandardCharsets.UTF_8));

        assertEquals("Invalid signature", verifierAt(ISSUED).verify(forged).errorMessage());
    }

    @Test
    void rejectsTokenSignedWithAnotherSecret() {
        properties.setRegistrationSecret("T");

        assertEquals("Invalid signature", verifierAt(ISSUED).verify(token.encoded()).errorMessage());
    }

    @Test
    void rejectsGarbageAndUnknownVersions() {
        assertEquals("Token is required", verifierAt(ISSUED).verify(" ").errorMessage());
        assertEquals("Malformed token", verifierAt(ISSUED).verify("not base64 !!").errorMessage());

        String v2 = Base64.getEncoder().encodeToString(
                "{\"v\":2,\"cid\":\"42\",\"ts\":1,\"sig\":\"00\"}".getBytes(StandardCharsets.UTF_8));
        assertEquals("Unsupported token version", verifierAt(ISSUED).verify(v2).errorMessage());
    }

    private LinkTokenVerifier verifierAt(Instant now) {
        return new LinkTokenVerifier(properties, Clock.fixed(now, ZoneOffset.UTC), objectMapper);
    }
}
