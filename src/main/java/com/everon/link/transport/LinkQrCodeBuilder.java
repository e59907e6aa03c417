package com.everon.link.transport;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

import org.springframework.stereotype.Component;

import com.everon.link.config.EveronLinkProperties;
import com.everon.link.model.dto.LinkToken;

import lombok.RequiredArgsConstructor;

/**
 * Wraps a link token into the deep link the device app opens and the QR image
 * URL the chat receives.
 */
@Component
@RequiredArgsConstructor
public class LinkQrCodeBuilder {

    private final EveronLinkProperties properties;

    /**
     * {@code everon://telegram-link?payload=<url-encoded token>}
     */
    public String deepLink(LinkToken token) {
        return properties.getToken().getDeepLinkBase() + "?payload=" + urlEncode(token.encoded());
    }

    /**
     * URL of a QR image encoding the deep link.
     */
    public String qrImageUrl(LinkToken token) {
        int size = properties.getToken().getQrSize();
        return properties.getToken().getQrServiceUrl()
                + "?size=" + size + "x" + size
                + "&data=" + urlEncode(deepLink(token));
    }

    private static String urlEncode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
