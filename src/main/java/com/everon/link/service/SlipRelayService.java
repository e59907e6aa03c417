package com.everon.link.service;

import java.util.Base64;

import org.springframework.stereotype.Service;

import com.everon.link.model.dto.DeviceEventDTO;
import com.everon.link.transport.MessagingTransport;
import com.everon.link.transport.MessagingTransport.DeliveryResult;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Relays device events (connection test, payment slips) to the chat the
 * device is linked to. Only chats holding a registration receive anything.
 *
 * @author EverOn Engineering
 * @since October 2026
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SlipRelayService {

    private static final String SLIP_FILENAME = "slip.jpg";

    private final RegistrationBindingService bindingService;
    private final MessagingTransport transport;
    private final BotMessages messages;

    public enum RelayOutcome {
        DELIVERED,
        SKIPPED,
        CHAT_NOT_BOUND,
        INVALID_REQUEST,
        DELIVERY_FAILED
    }

    public record RelayResult(RelayOutcome outcome, String message) {

        static RelayResult of(RelayOutcome outcome, String message) {
            return new RelayResult(outcome, message);
        }

        static RelayResult from(DeliveryResult delivery) {
            if (delivery.delivered()) {
                return new RelayResult(RelayOutcome.DELIVERED, null);
            }
            return new RelayResult(delivery.skipped() ? RelayOutcome.SKIPPED : RelayOutcome.DELIVERY_FAILED,
                    delivery.errorMessage());
        }
    }

    public RelayResult relay(DeviceEventDTO event) {
        String chatId = event.getChatId();
        if (chatId == null || chatId.isBlank()) {
            return RelayResult.of(RelayOutcome.INVALID_REQUEST, "chat_id is required");
        }

        if (!DeviceEventDTO.SEND_TEST.equals(event.getType()) && !DeviceEventDTO.SEND_SLIP.equals(event.getType())) {
            return RelayResult.of(RelayOutcome.INVALID_REQUEST, "Unknown event type: " + event.getType());
        }

        if (bindingService.findBindings(chatId).isEmpty()) {
            log.warn("RELAY: Chat {} is not linked to any registration, dropping {}", chatId, event.getType());
            return RelayResult.of(RelayOutcome.CHAT_NOT_BOUND, "Chat is not linked");
        }

        if (DeviceEventDTO.SEND_TEST.equals(event.getType())) {
            return RelayResult.from(transport.sendText(chatId, messages.testMessage(), null));
        }
        return relaySlip(chatId, event);
    }

    private RelayResult relaySlip(String chatId, DeviceEventDTO event) {
        if (event.getImageBase64() == null || event.getImageBase64().isBlank()) {
            return RelayResult.of(RelayOutcome.INVALID_REQUEST, "image_base64 is required");
        }

        byte[] image;
        try {
            image = Base64.getMimeDecoder().decode(event.getImageBase64());
        } catch (IllegalArgumentException e) {
            return RelayResult.of(RelayOutcome.INVALID_REQUEST, "image_base64 is not valid Base64");
        }
        if (image.length == 0) {
            return RelayResult.of(RelayOutcome.INVALID_REQUEST, "image_base64 is empty");
        }

        DeviceEventDTO.SlipMeta meta = event.getMeta() != null ? event.getMeta() : new DeviceEventDTO.SlipMeta();
        String caption = messages.slipCaption(meta.getBank(), meta.getRef(), meta.getAmount());

        log.info("RELAY: Forwarding payment slip ({} bytes) to chat {}", image.length, chatId);
        return RelayResult.from(transport.sendPhoto(chatId, image, SLIP_FILENAME, caption));
    }
}
