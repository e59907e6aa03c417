package com.everon.link.controller.api;

import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.everon.link.model.dto.DeviceEventDTO;
import com.everon.link.service.SlipRelayService;
import com.everon.link.service.SlipRelayService.RelayResult;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

/**
 * Events sent by linked EverOn devices.
 *
 * @author EverOn Engineering
 * @since October 2026
 */
@RestController
@RequestMapping("/api/v1/device")
@RequiredArgsConstructor
@Tag(name = "Device Events", description = "Connection tests and payment slips from devices")
public class DeviceEventController {

    private final SlipRelayService relayService;

    @PostMapping("/events")
    @Operation(summary = "Relay a device event", description = "SEND_TEST or SEND_SLIP to the linked chat")
    @ApiResponses({
        @ApiResponse(responseCode = "202", description = "Delivered to the chat"),
        @ApiResponse(responseCode = "400", description = "Invalid event"),
        @ApiResponse(responseCode = "404", description = "Chat is not linked"),
        @ApiResponse(responseCode = "502", description = "Messaging service rejected the delivery")
    })
    public ResponseEntity<Map<String, Object>> relay(@Valid @RequestBody DeviceEventDTO event) {
        RelayResult result = relayService.relay(event);

        HttpStatus status = switch (result.outcome()) {
            case DELIVERED, SKIPPED -> HttpStatus.ACCEPTED;
            case CHAT_NOT_BOUND -> HttpStatus.NOT_FOUND;
            case INVALID_REQUEST -> HttpStatus.BAD_REQUEST;
            case DELIVERY_FAILED -> HttpStatus.BAD_GATEWAY;
        };

        return ResponseEntity.status(status).body(Map.of(
                "outcome", result.outcome().name(),
                "message", result.message() == null ? "" : result.message()));
    }
}
