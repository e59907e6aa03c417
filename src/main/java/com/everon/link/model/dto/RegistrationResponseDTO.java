package com.everon.link.model.dto;

import java.time.Instant;
import java.time.LocalDate;

import com.everon.link.model.domain.RegistrationRecord;
import com.everon.link.model.enums.RegistrationStatus;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response DTO for registration records.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RegistrationResponseDTO {

    private String codeHash;

    private RegistrationStatus status;

    private LocalDate validFrom;

    private LocalDate validUntil;

    /**
     * Chat holding the registration (null if unbound).
     */
    private String boundChannelId;

    private Instant boundAt;

    private String label;

    private Instant createdAt;

    public static RegistrationResponseDTO fromEntity(RegistrationRecord record) {
        return RegistrationResponseDTO.builder()
                .codeHash(record.getCodeHash())
                .status(record.getStatus())
                .validFrom(record.getValidFrom())
                .validUntil(record.getValidUntil())
                .boundChannelId(record.getBoundChannelId())
                .boundAt(record.getBoundAt())
                .label(record.getLabel())
                .createdAt(record.getCreatedAt())
                .build();
    }
}
