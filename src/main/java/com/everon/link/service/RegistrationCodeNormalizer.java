package com.everon.link.service;

import java.util.Optional;

import org.springframework.stereotype.Component;

import com.everon.link.config.EveronLinkProperties;

import lombok.RequiredArgsConstructor;

/**
 * Turns user input into the canonical registration code form.
 *
 * Canonical form: upper case, no whitespace anywhere, only A-Z, 0-9 and the
 * configured separators, starting and ending with a letter or digit. Separators
 * stay in the code; the same form is hashed at provisioning time.
 *
 * Only ASCII a-z is case-folded. Any other character outside the alphabet is
 * rejected before folding, so {@code ß} or {@code ﬁ} never turn into ASCII.
 */
@Component
@RequiredArgsConstructor
public class RegistrationCodeNormalizer {

    private final EveronLinkProperties properties;

    /**
     * Normalize raw input.
     *
     * @param raw text as typed by the user
     * @return the canonical code, or empty if the input is not shaped like a code
     */
    public Optional<String> normalize(String raw) {
        if (raw == null) {
            return Optional.empty();
        }

        EveronLinkProperties.CodeConfig config = properties.getCode();
        String separators = config.getAllowedSeparators() == null ? "" : config.getAllowedSeparators();

        StringBuilder code = new StringBuilder(raw.length());
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (Character.isWhitespace(c) || Character.isSpaceChar(c)) {
                continue;
            }
            if (c >= 'a' && c <= 'z') {
                code.append((char) (c - 'a' + 'A'));
            } else if ((c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || separators.indexOf(c) >= 0) {
                code.append(c);
            } else {
                return Optional.empty();
            }
        }

        if (code.length() == 0 || code.length() < config.getMinLength() || code.length() > config.getMaxLength()) {
            return Optional.empty();
        }
        if (separators.indexOf(code.charAt(0)) >= 0 || separators.indexOf(code.charAt(code.length() - 1)) >= 0) {
            return Optional.empty();
        }

        return Optional.of(code.toString());
    }
}
