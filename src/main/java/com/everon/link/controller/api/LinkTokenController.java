package com.everon.link.controller.api;

import java.util.HashMap;
import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.everon.link.model.dto.LinkVerificationDTO;
import com.everon.link.service.LinkTokenVerifier;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

/**
 * Link token verification for devices that do not hold the shared secret.
 */
@RestController
@RequestMapping("/api/v1/link")
@RequiredArgsConstructor
@Tag(name = "Link Tokens", description = "Verify scanned link QR payloads")
public class LinkTokenController {

    private final LinkTokenVerifier verifier;

    @PostMapping("/verify")
    @Operation(summary = "Verify a link token", description = "Checks signature and freshness of a scanned payload")
    public ResponseEntity<Map<String, Object>> verify(@Valid @RequestBody LinkVerificationDTO request) {
        var result = verifier.verify(request.getPayload());

        Map<String, Object> response = new HashMap<>();
        response.put("valid", result.valid());
        if (result.valid()) {
            response.put("chatId", result.channelId());
            response.put("issuedAt", result.issuedAt());
        } else {
            response.put("error", result.errorMessage());
        }

        return ResponseEntity.ok(response);
    }
}
