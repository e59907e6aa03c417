package com.everon.link.controller.api;

import java.util.List;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.everon.link.model.dto.BindingResult;
import com.everon.link.model.dto.RegistrationRequestDTO;
import com.everon.link.model.dto.RegistrationResponseDTO;
import com.everon.link.service.RegistrationBindingService;
import com.everon.link.service.RegistrationProvisioningService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * REST API for registration provisioning.
 *
 * @author EverOn Engineering
 * @since October 2026
 */
@RestController
@RequestMapping("/api/v1/registrations")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Registrations", description = "Provision and inspect device registrations")
public class RegistrationAdminController {

    private final RegistrationProvisioningService provisioningService;
    private final RegistrationBindingService bindingService;

    @PostMapping
    @Operation(summary = "Provision a registration", description = "Stores the hash of a new registration code")
    @ApiResponses({
        @ApiResponse(responseCode = "201", description = "Registration created"),
        @ApiResponse(responseCode = "400", description = "Invalid code or validity window"),
        @ApiResponse(responseCode = "409", description = "Code already provisioned")
    })
    public ResponseEntity<RegistrationResponseDTO> provision(@Valid @RequestBody RegistrationRequestDTO request) {
        var record = provisioningService.provision(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(RegistrationResponseDTO.fromEntity(record));
    }

    @GetMapping
    @Operation(summary = "List registrations")
    public ResponseEntity<List<RegistrationResponseDTO>> list() {
        return ResponseEntity.ok(provisioningService.list().stream()
                .map(RegistrationResponseDTO::fromEntity)
                .toList());
    }

    @GetMapping("/{codeHash}")
    @Operation(summary = "Get a registration")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Registration found"),
        @ApiResponse(responseCode = "404", description = "Registration not found")
    })
    public ResponseEntity<RegistrationResponseDTO> get(
            @Parameter(description = "Hex SHA-256 code hash")
            @PathVariable String codeHash) {
        return ResponseEntity.ok(RegistrationResponseDTO.fromEntity(provisioningService.get(codeHash)));
    }

    @DeleteMapping("/{codeHash}/binding")
    @Operation(summary = "Release a binding", description = "Unbinds the registration from whichever chat holds it")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Binding released"),
        @ApiResponse(responseCode = "404", description = "Registration not found"),
        @ApiResponse(responseCode = "409", description = "Registration is not bound"),
        @ApiResponse(responseCode = "503", description = "Store unavailable")
    })
    public ResponseEntity<RegistrationResponseDTO> releaseBinding(@PathVariable String codeHash) {
        BindingResult result = bindingService.releaseByOperator(codeHash);
        log.info("Operator release of {}: {}", codeHash, result.outcome());

        return switch (result.outcome()) {
            case UNBOUND -> ResponseEntity.ok(RegistrationResponseDTO.fromEntity(result.record()));
            case NOT_FOUND -> ResponseEntity.notFound().build();
            case NOT_BOUND -> ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(RegistrationResponseDTO.fromEntity(result.record()));
            default -> ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
        };
    }
}
