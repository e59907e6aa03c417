package com.everon.link.model.dto;

import java.time.LocalDate;

import com.everon.link.model.enums.RegistrationStatus;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for provisioning a registration.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RegistrationRequestDTO {

    /**
     * Plain registration code handed to the customer. Only its hash is stored.
     */
    @NotBlank
    private String code;

    /**
     * Initial status (default ACTIVE).
     */
    private RegistrationStatus status;

    private LocalDate validFrom;

    private LocalDate validUntil;

    @Size(max = 120)
    private String label;
}
