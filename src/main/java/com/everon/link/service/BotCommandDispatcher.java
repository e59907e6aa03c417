package com.everon.link.service;

import java.util.Locale;

import org.springframework.stereotype.Service;

import com.everon.link.config.EveronLinkProperties;
import com.everon.link.model.dto.BindingResult;
import com.everon.link.model.dto.InboundEvent;
import com.everon.link.model.dto.TelegramUpdateDTO;
import com.everon.link.model.enums.BindingOutcome;
import com.everon.link.transport.LinkQrCodeBuilder;
import com.everon.link.transport.MessagingTransport;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns Telegram updates into binding events and replies in the chat.
 *
 * Commands: {@code /start}, {@code /help}, {@code /regenqr}, {@code /unlink [code]}.
 * Buttons: {@code REGISTER}, {@code REGEN_QR}. Any other text is treated as a
 * registration code.
 *
 * @author EverOn Engineering
 * @since October 2026
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BotCommandDispatcher {

    private final RegistrationBindingService bindingService;
    private final MessagingTransport transport;
    private final LinkQrCodeBuilder qrCodeBuilder;
    private final BotMessages messages;
    private final EveronLinkProperties properties;

    /**
     * Handle one update. Returns the binding result when the update reached the
     * binding core, otherwise null.
     */
    public BindingResult dispatch(TelegramUpdateDTO update) {
        if (!properties.isSecretConfigured()) {
            log.error("TELEGRAM: REG_SECRET not set, ignoring update {}", update.getUpdateId());
            return null;
        }

        String chatId = update.chatId();
        if (chatId == null) {
            return null;
        }

        if (update.getCallbackQuery() != null) {
            return onCallback(chatId, update.getCallbackQuery().getData());
        }

        if (update.getMessage() == null || update.getMessage().getText() == null) {
            return null;
        }
        return onText(chatId, update.getMessage().getText());
    }

    private BindingResult onCallback(String chatId, String data) {
        if (BotMessages.CALLBACK_REGISTER.equals(data)) {
            boolean registered = isRegistered(chatId);
            if (registered) {
                transport.sendText(chatId, messages.instructions(true), messages.registeredKeyboard());
            } else {
                transport.sendText(chatId, messages.askForCode(), null);
            }
            return null;
        }
        if (BotMessages.CALLBACK_REGEN_QR.equals(data)) {
            return process(InboundEvent.reissueToken(chatId));
        }
        log.debug("TELEGRAM: Ignoring unknown callback {} from chat {}", data, chatId);
        return null;
    }

    private BindingResult onText(String chatId, String text) {
        String input = text.strip();
        String upper = input.toUpperCase(Locale.ROOT);
        String command = upper.split("\\s+", 2)[0];

        switch (command) {
            case "/START", "/HELP" -> {
                sendInstructions(chatId);
                return null;
            }
            case "/REGENQR" -> {
                return process(InboundEvent.reissueToken(chatId));
            }
            case "/UNLINK" -> {
                String argument = input.length() > command.length() ? input.substring(command.length()).strip() : null;
                return process(InboundEvent.unbind(chatId, argument));
            }
            default -> {
                if (input.startsWith("/")) {
                    sendInstructions(chatId);
                    return null;
                }
                return process(InboundEvent.bindAttempt(chatId, input));
            }
        }
    }

    /**
     * Run an event through the binding core and tell the chat how it went.
     */
    public BindingResult process(InboundEvent event) {
        BindingResult result = bindingService.handle(event);
        reply(result);
        return result;
    }

    private void reply(BindingResult result) {
        String chatId = result.channelId();
        BindingOutcome outcome = result.outcome();

        if (outcome == BindingOutcome.INVALID_FORMAT) {
            sendInstructions(chatId);
            return;
        }

        String text = messages.outcomeText(outcome);
        if (text != null) {
            boolean registered = outcome == BindingOutcome.BOUND || outcome == BindingOutcome.ALREADY_BOUND_TO_CHANNEL;
            var keyboard = outcome == BindingOutcome.UNBOUND ? messages.registerKeyboard()
                    : registered ? messages.registeredKeyboard() : null;
            transport.sendText(chatId, text, keyboard);
        }

        if (result.hasToken()) {
            String qrUrl = qrCodeBuilder.qrImageUrl(result.token());
            var delivery = transport.sendPhotoUrl(chatId, qrUrl, messages.qrCaption(outcome == BindingOutcome.BOUND));
            if (!delivery.delivered() && !delivery.skipped()) {
                log.warn("TELEGRAM: Link QR for chat {} not delivered: {}", chatId, delivery.errorMessage());
            }
        }
    }

    private void sendInstructions(String chatId) {
        boolean registered = isRegistered(chatId);
        transport.sendText(chatId, messages.instructions(registered), messages.keyboardFor(registered));
    }

    private boolean isRegistered(String chatId) {
        return !bindingService.findBindings(chatId).isEmpty();
    }
}
