package com.everon.link.model.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for link token verification by a device.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LinkVerificationDTO {

    /**
     * Base64 payload taken from the scanned deep link.
     */
    @NotBlank
    private String payload;
}
