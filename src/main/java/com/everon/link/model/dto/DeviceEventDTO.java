package com.everon.link.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Event sent by the EverOn device app.
 *
 * SEND_TEST asks for a connectivity message in the chat;
 * SEND_SLIP forwards a payment-slip photo with its parsed details.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class DeviceEventDTO {

    public static final String SEND_TEST = "SEND_TEST";
    public static final String SEND_SLIP = "SEND_SLIP";

    @NotBlank
    private String type;

    @NotBlank
    @JsonProperty("chat_id")
    private String chatId;

    /**
     * JPEG bytes, Base64 (SEND_SLIP only).
     */
    @JsonProperty("image_base64")
    private String imageBase64;

    private SlipMeta meta;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SlipMeta {
        private String bank;
        private String ref;
        private String amount;
    }
}
