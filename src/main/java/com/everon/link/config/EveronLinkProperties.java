package com.everon.link.config;

import java.time.Duration;
import java.util.Locale;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Data;

/**
 * Configuration properties for EverOn Link.
 */
@Data
@ConfigurationProperties(prefix = "everon.link")
public class EveronLinkProperties {

    /**
     * Shared registration secret (REG_SECRET).
     * Used both to hash registration codes and to sign link tokens.
     */
    private String registrationSecret;

    /**
     * Zone used to decide the current calendar date for validity windows.
     */
    private String zoneId = "UTC";

    /**
     * Registration code input contract
     */
    private CodeConfig code = new CodeConfig();

    /**
     * Link token configuration
     */
    private TokenConfig token = new TokenConfig();

    /**
     * Telegram Bot API configuration
     */
    private TelegramConfig telegram = new TelegramConfig();

    /**
     * Registration store configuration
     */
    private StoreConfig store = new StoreConfig();

    /**
     * Binding commit configuration
     */
    private BindingConfig binding = new BindingConfig();

    /**
     * Inbound API protection
     */
    private SecurityConfig security = new SecurityConfig();

    /**
     * The secret in its canonical form: trimmed and upper-cased, the same form
     * the provisioning tool hashes codes with. Null when not configured.
     */
    public String getCanonicalSecret() {
        if (registrationSecret == null || registrationSecret.isBlank()) {
            return null;
        }
        return registrationSecret.trim().toUpperCase(Locale.ROOT);
    }

    public boolean isSecretConfigured() {
        return getCanonicalSecret() != null;
    }

    @Data
    public static class CodeConfig {
        /**
         * Minimum canonical code length (rejects trivial guesses)
         */
        private int minLength = 6;

        /**
         * Maximum canonical code length
         */
        private int maxLength = 64;

        /**
         * Separator characters allowed besides A-Z and 0-9. Kept in the canonical code.
         */
        private String allowedSeparators = "-";
    }

    @Data
    public static class TokenConfig {
        /**
         * Payload schema version written as "v"
         */
        private int version = 1;

        /**
         * How long a verifier accepts a token after issuance
         */
        private Duration freshness = Duration.ofMinutes(10);

        /**
         * Tolerated issuance time in the future (device clock drift)
         */
        private Duration clockSkew = Duration.ofSeconds(30);

        /**
         * Deep link the device app registers for
         */
        private String deepLinkBase = "everon://telegram-link";

        /**
         * QR image rendering service
         */
        private String qrServiceUrl = "https://api.qrserver.com/v1/create-qr-code/";

        /**
         * QR image edge length in pixels
         */
        private int qrSize = 360;
    }

    @Data
    public static class TelegramConfig {
        /**
         * Bot token (TELEGRAM_BOT_TOKEN). Delivery is skipped when blank.
         */
        private String botToken;

        /**
         * Bot API base URL
         */
        private String apiUrl = "https://api.telegram.org";

        /**
         * Expected X-Telegram-Bot-Api-Secret-Token header value for webhook calls
         */
        private String webhookSecret;

        /**
         * Request timeout in seconds
         */
        private int timeoutSeconds = 15;
    }

    @Data
    public static class StoreConfig {
        /**
         * "jpa" (database) or "file" (registration.json document)
         */
        private String type = "jpa";

        /**
         * Path of the registration document when type is "file"
         */
        private String filePath = "registration.json";
    }

    @Data
    public static class BindingConfig {
        /**
         * Attempts to commit a transition when a concurrent writer wins the race
         */
        private int maxAttempts = 3;
    }

    @Data
    public static class SecurityConfig {
        /**
         * X-API-Key expected on device and admin endpoints. Open when blank.
         */
        private String apiKey;
    }
}
