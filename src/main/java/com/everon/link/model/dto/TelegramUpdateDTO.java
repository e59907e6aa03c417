package com.everon.link.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The subset of a Telegram Bot API update this bot reads.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TelegramUpdateDTO {

    @JsonProperty("update_id")
    private Long updateId;

    private Message message;

    @JsonProperty("callback_query")
    private CallbackQuery callbackQuery;

    /**
     * Chat the update came from, whether a message or a button press.
     */
    public String chatId() {
        if (message != null && message.getChat() != null && message.getChat().getId() != null) {
            return String.valueOf(message.getChat().getId());
        }
        if (callbackQuery != null && callbackQuery.getMessage() != null
                && callbackQuery.getMessage().getChat() != null
                && callbackQuery.getMessage().getChat().getId() != null) {
            return String.valueOf(callbackQuery.getMessage().getChat().getId());
        }
        return null;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Message {
        @JsonProperty("message_id")
        private Long messageId;
        private Chat chat;
        private String text;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Chat {
        private Long id;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CallbackQuery {
        private String id;
        private String data;
        private Message message;
    }
}
