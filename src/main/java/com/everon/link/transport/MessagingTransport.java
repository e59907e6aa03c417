package com.everon.link.transport;

import java.util.Map;

/**
 * Outbound channel to chats.
 *
 * Delivery is best effort: failures are reported in the result, never thrown,
 * and callers do not retry them.
 */
public interface MessagingTransport {

    /**
     * Send a Markdown text message.
     *
     * @param channelId chat to deliver to
     * @param text      message text
     * @param keyboard  optional reply markup (e.g. an inline keyboard), may be null
     */
    DeliveryResult sendText(String channelId, String text, Map<String, Object> keyboard);

    /**
     * Send a photo the messaging service fetches from a URL.
     */
    DeliveryResult sendPhotoUrl(String channelId, String photoUrl, String caption);

    /**
     * Upload and send a photo.
     */
    DeliveryResult sendPhoto(String channelId, byte[] image, String filename, String caption);

    /**
     * Whether the transport has credentials to deliver anything.
     */
    boolean isConfigured();

    /**
     * Result of one delivery.
     */
    record DeliveryResult(boolean delivered, boolean skipped, String errorMessage) {

        public static DeliveryResult ok() {
            return new DeliveryResult(true, false, null);
        }

        public static DeliveryResult skipped(String reason) {
            return new DeliveryResult(false, true, reason);
        }

        public static DeliveryResult failed(String errorMessage) {
            return new DeliveryResult(false, false, errorMessage);
        }
    }
}
