package com.everon.link.service;

import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.everon.link.config.EveronLinkProperties;
import com.everon.link.model.enums.BindingOutcome;

import lombok.RequiredArgsConstructor;

/**
 * Texts and inline keyboards shown in the chat.
 */
@Component
@RequiredArgsConstructor
public class BotMessages {

    public static final String CALLBACK_REGISTER = "REGISTER";
    public static final String CALLBACK_REGEN_QR = "REGEN_QR";

    private final EveronLinkProperties properties;

    public Map<String, Object> registerKeyboard() {
        return inlineKeyboard("🔐 Register", CALLBACK_REGISTER);
    }

    public Map<String, Object> registeredKeyboard() {
        return inlineKeyboard("🔄 Re-generate Device QR", CALLBACK_REGEN_QR);
    }

    public Map<String, Object> keyboardFor(boolean registered) {
        return registered ? registeredKeyboard() : registerKeyboard();
    }

    public String instructions(boolean registered) {
        if (registered) {
            return "🤖 *EverOn Bot*\n\n"
                    + "You are already registered.\n\n"
                    + "Available commands:\n"
                    + "• `/start` – Show status\n"
                    + "• `/regenqr` – Re-generate device QR\n"
                    + "• `/unlink` – Unlink this chat\n"
                    + "• `/help` – Show instructions\n\n"
                    + "Or use the button below 👇";
        }
        return "🤖 *EverOn Bot*\n\n"
                + "This bot is used to link your EverOn device.\n\n"
                + "Available commands:\n"
                + "• `/start` – Start registration\n"
                + "• `/help` – Show instructions\n\n"
                + "Please register before using the device.";
    }

    public String askForCode() {
        return "🧾 Please send your *Registration Code*.";
    }

    public String qrCaption(boolean fresh) {
        long minutes = properties.getToken().getFreshness().toMinutes();
        String title = fresh ? "🔐 *Secure EverOn Link QR*" : "🔐 *New EverOn Link QR*";
        return title + "\n\n• Valid for " + minutes + " minutes";
    }

    public String testMessage() {
        return "🧪 *EverOn Test Payment Slip*\n\n"
                + "✅ Telegram connection is working correctly.";
    }

    public String slipCaption(String bank, String ref, String amount) {
        return "🧾 *Payment Slip Received*\n\n"
                + "🏦 Bank: " + orDash(bank) + "\n"
                + "🔢 Ref: " + orDash(ref) + "\n"
                + "💰 Amount: " + orDash(amount);
    }

    /**
     * Reply text for a binding outcome. INVALID_FORMAT has none: the chat gets
     * the instructions instead.
     */
    public String outcomeText(BindingOutcome outcome) {
        return switch (outcome) {
            case BOUND -> "✅ *Registration successful*";
            case ALREADY_BOUND_TO_CHANNEL -> "✅ *Already registered*\n\nThis chat is already linked to this registration.";
            case UNBOUND -> "🔓 *Registration unlinked*\n\nThe device can no longer send to this chat.";
            case TOKEN_REISSUED, INVALID_FORMAT -> null;
            case NOT_FOUND -> "❌ Invalid registration code.";
            case NOT_ACTIVE -> "⛔ This registration is not active. Please contact support.";
            case NOT_STARTED -> "⏳ This registration is not valid yet.";
            case EXPIRED -> "⌛ This registration has expired.";
            case ALREADY_LINKED_ELSEWHERE -> "🔒 This registration is already linked to another chat.";
            case NOT_OWNER -> "❌ This registration is linked to another chat.";
            case NOT_BOUND -> "❌ Please register first using /start";
            case STORE_UNAVAILABLE -> "⚠️ Registration is temporarily unavailable. Please try again shortly.";
        };
    }

    private static Map<String, Object> inlineKeyboard(String text, String callbackData) {
        return Map.of("inline_keyboard",
                List.of(List.of(Map.of("text", text, "callback_data", callbackData))));
    }

    private static String orDash(String value) {
        return value == null || value.isBlank() ? "-" : value;
    }
}
