package com.everon.link.service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Optional;

import org.springframework.stereotype.Component;

import com.everon.link.config.EveronLinkProperties;
import com.everon.link.model.domain.RegistrationRecord;
import com.everon.link.store.RegistrationStore;

import lombok.RequiredArgsConstructor;

/**
 * Finds the registration a canonical code belongs to.
 *
 * The digest is lowercase hex SHA-256 of {@code code + secret}, the format the
 * provisioning tool writes into {@code reg_hash}.
 */
@Component
@RequiredArgsConstructor
public class RecordMatcher {

    private final RegistrationStore store;
    private final EveronLinkProperties properties;

    /**
     * Digest of a canonical code under the configured secret.
     *
     * @throws IllegalStateException if no secret is configured
     */
    public String digest(String canonicalCode) {
        String secret = properties.getCanonicalSecret();
        if (secret == null) {
            throw new IllegalStateException("Registration secret not configured. Set REG_SECRET.");
        }
        return digest(canonicalCode, secret);
    }

    /**
     * Digest of a canonical code under an explicit secret.
     */
    public static String digest(String canonicalCode, String secret) {
        try {
            MessageDigest sha256 = MessageDigest.getInstance("SHA-256");
            byte[] hash = sha256.digest((canonicalCode + secret).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Look up the record for a code hash. Read-only.
     */
    public Optional<RegistrationRecord> match(String codeHash) {
        return store.findByCodeHash(codeHash);
    }
}
