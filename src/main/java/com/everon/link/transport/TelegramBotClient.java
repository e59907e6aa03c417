package com.everon.link.transport;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;

import com.everon.link.config.EveronLinkProperties;

import lombok.extern.slf4j.Slf4j;

/**
 * Telegram Bot API client.
 *
 * Bot API documentation: https://core.telegram.org/bots/api
 *
 * @author EverOn Engineering
 * @since October 2026
 */
@Component
@Slf4j
public class TelegramBotClient implements MessagingTransport {

    private static final String PARSE_MODE = "Markdown";

    private final WebClient webClient;
    private final EveronLinkProperties.TelegramConfig config;
    private final Duration timeout;

    public TelegramBotClient(WebClient.Builder webClientBuilder, EveronLinkProperties properties) {
        this.config = properties.getTelegram();
        this.timeout = Duration.ofSeconds(config.getTimeoutSeconds());
        this.webClient = webClientBuilder.baseUrl(config.getApiUrl()).build();

        if (isConfigured()) {
            log.info("TELEGRAM: Bot client initialized - API URL: {}", config.getApiUrl());
        } else {
            log.warn("TELEGRAM: TELEGRAM_BOT_TOKEN not set, outbound messages will be skipped");
        }
    }

    @Override
    public boolean isConfigured() {
        return config.getBotToken() != null && !config.getBotToken().isBlank();
    }

    @Override
    public DeliveryResult sendText(String channelId, String text, Map<String, Object> keyboard) {
        Map<String, Object> body = new HashMap<>();
        body.put("chat_id", channelId);
        body.put("text", text);
        body.put("parse_mode", PARSE_MODE);
        if (keyboard != null) {
            body.put("reply_markup", keyboard);
        }
        return postJson("sendMessage", channelId, body);
    }

    @Override
    public DeliveryResult sendPhotoUrl(String channelId, String photoUrl, String caption) {
        Map<String, Object> body = new HashMap<>();
        body.put("chat_id", channelId);
        body.put("photo", photoUrl);
        body.put("caption", caption == null ? "" : caption);
        body.put("parse_mode", PARSE_MODE);
        return postJson("sendPhoto", channelId, body);
    }

    @Override
    public DeliveryResult sendPhoto(String channelId, byte[] image, String filename, String caption) {
        if (!isConfigured()) {
            return DeliveryResult.skipped("Bot token not configured");
        }

        MultipartBodyBuilder multipart = new MultipartBodyBuilder();
        multipart.part("chat_id", channelId);
        multipart.part("photo", new ByteArrayResource(image) {
            @Override
            public String getFilename() {
                return filename;
            }
        }).contentType(MediaType.IMAGE_JPEG);
        multipart.part("caption", caption == null ? "" : caption);
        multipart.part("parse_mode", PARSE_MODE);

        try {
            webClient.post()
                    .uri("/bot{token}/sendPhoto", config.getBotToken())
                    .contentType(MediaType.MULTIPART_FORM_DATA)
                    .body(BodyInserters.fromMultipartData(multipart.build()))
                    .retrieve()
                    .bodyToMono(Map.class)
                    .block(timeout);
            log.debug("TELEGRAM: Uploaded photo to chat {} ({} bytes)", channelId, image.length);
            return DeliveryResult.ok();
        } catch (Exception e) {
            log.error("TELEGRAM: sendPhoto upload to chat {} failed: {}", channelId, e.getMessage());
            return DeliveryResult.failed(e.getMessage());
        }
    }

    private DeliveryResult postJson(String method, String channelId, Map<String, Object> body) {
        if (!isConfigured()) {
            return DeliveryResult.skipped("Bot token not configured");
        }

        try {
            webClient.post()
                    .uri("/bot{token}/{method}", config.getBotToken(), method)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(Map.class)
                    .block(timeout);
            log.debug("TELEGRAM: {} delivered to chat {}", method, channelId);
            return DeliveryResult.ok();
        } catch (Exception e) {
            log.error("TELEGRAM: {} to chat {} failed: {}", method, channelId, e.getMessage());
            return DeliveryResult.failed(e.getMessage());
        }
    }
}
