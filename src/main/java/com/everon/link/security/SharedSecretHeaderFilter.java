package com.everon.link.security;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import com.everon.link.config.EveronLinkProperties;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Checks shared-secret headers on inbound API calls.
 *
 * <ul>
 *   <li>{@code /api/v1/telegram/**}: {@code X-Telegram-Bot-Api-Secret-Token} must equal the webhook secret</li>
 *   <li>{@code /api/v1/device/**}, {@code /api/v1/registrations/**}: {@code X-API-Key} must equal the API key</li>
 * </ul>
 * A check is skipped while its secret is not configured. Link verification is open.
 *
 * @author EverOn Engineering
 * @since October 2026
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SharedSecretHeaderFilter extends OncePerRequestFilter {

    static final String TELEGRAM_SECRET_HEADER = "X-Telegram-Bot-Api-Secret-Token";
    static final String API_KEY_HEADER = "X-API-Key";

    private static final String TELEGRAM_PATH = "/api/v1/telegram/";
    private static final String DEVICE_PATH = "/api/v1/device/";
    private static final String REGISTRATIONS_PATH = "/api/v1/registrations";

    private final EveronLinkProperties properties;

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI();
        return !path.startsWith(TELEGRAM_PATH)
                && !path.startsWith(DEVICE_PATH)
                && !path.startsWith(REGISTRATIONS_PATH);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {

        String path = request.getRequestURI();
        boolean telegram = path.startsWith(TELEGRAM_PATH);
        String expected = telegram ? properties.getTelegram().getWebhookSecret() : properties.getSecurity().getApiKey();
        String header = telegram ? TELEGRAM_SECRET_HEADER : API_KEY_HEADER;

        if (expected == null || expected.isBlank()) {
            filterChain.doFilter(request, response);
            return;
        }

        String provided = request.getHeader(header);
        if (provided == null || !constantTimeEquals(expected, provided)) {
            log.warn("AUTH: Rejected {} without valid {} header", path, header);
            response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
            response.setContentType("application/json");
            response.getWriter().write("{\"error\":\"Missing or invalid " + header + "\",\"code\":\"UNAUTHORIZED\"}");
            return;
        }

        filterChain.doFilter(request, response);
    }

    private static boolean constantTimeEquals(String expected, String provided) {
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                provided.getBytes(StandardCharsets.UTF_8));
    }
}
