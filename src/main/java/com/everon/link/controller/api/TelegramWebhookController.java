package com.everon.link.controller.api;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.everon.link.model.dto.TelegramUpdateDTO;
import com.everon.link.service.BotCommandDispatcher;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Telegram webhook endpoint.
 *
 * Always answers 200: Telegram redelivers updates that fail, and every outcome
 * has already been reported to the chat.
 *
 * @author EverOn Engineering
 * @since October 2026
 */
@RestController
@RequestMapping("/api/v1/telegram")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Telegram", description = "Telegram Bot API webhook")
public class TelegramWebhookController {

    private final BotCommandDispatcher dispatcher;

    @PostMapping("/webhook")
    @Operation(summary = "Receive a Telegram update")
    public ResponseEntity<Void> receiveUpdate(@RequestBody TelegramUpdateDTO update) {
        log.debug("TELEGRAM: Update {} received", update.getUpdateId());
        dispatcher.dispatch(update);
        return ResponseEntity.ok().build();
    }
}
