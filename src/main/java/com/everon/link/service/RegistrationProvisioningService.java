package com.everon.link.service;

import java.util.List;

import org.springframework.stereotype.Service;

import com.everon.link.exception.RegistrationNotFoundException;
import com.everon.link.model.domain.RegistrationRecord;
import com.everon.link.model.dto.RegistrationRequestDTO;
import com.everon.link.model.enums.RegistrationStatus;
import com.everon.link.store.RegistrationStore;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Creates and lists registrations for operators.
 *
 * Codes go through the same normalization and digest as bind attempts, so a
 * provisioned code matches whatever way the user later types it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RegistrationProvisioningService {

    private final RegistrationCodeNormalizer normalizer;
    private final RecordMatcher matcher;
    private final RegistrationStore store;

    /**
     * Provision a registration from a plain code.
     *
     * @throws IllegalArgumentException if the code is not in the accepted shape
     *                                  or the window is inverted
     */
    public RegistrationRecord provision(RegistrationRequestDTO request) {
        String code = normalizer.normalize(request.getCode())
                .orElseThrow(() -> new IllegalArgumentException("Registration code has an invalid format"));

        if (request.getValidFrom() != null && request.getValidUntil() != null
                && request.getValidUntil().isBefore(request.getValidFrom())) {
            throw new IllegalArgumentException("validUntil is before validFrom");
        }

        RegistrationRecord record = RegistrationRecord.builder()
                .codeHash(matcher.digest(code))
                .status(request.getStatus() != null ? request.getStatus() : RegistrationStatus.ACTIVE)
                .validFrom(request.getValidFrom())
                .validUntil(request.getValidUntil())
                .label(request.getLabel())
                .build();

        RegistrationRecord created = store.create(record);
        log.info("PROVISION: Created registration {} ({})",
                created.getCodeHash().substring(0, 8), created.getStatus());
        return created;
    }

    public List<RegistrationRecord> list() {
        return store.findAll();
    }

    public RegistrationRecord get(String codeHash) {
        return store.findByCodeHash(codeHash)
                .orElseThrow(() -> new RegistrationNotFoundException(codeHash));
    }
}
