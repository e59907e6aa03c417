package com.everon.link.service;

import java.time.Clock;
import java.time.LocalDate;

import org.springframework.stereotype.Component;

import com.everon.link.model.domain.RegistrationRecord;
import com.everon.link.model.enums.BindingOutcome;
import com.everon.link.model.enums.RegistrationStatus;

import lombok.RequiredArgsConstructor;

/**
 * Decides whether a matched registration may be claimed today.
 *
 * Status is checked first, then the start of the validity window, then its end.
 * Both window bounds are inclusive.
 */
@Component
@RequiredArgsConstructor
public class EligibilityChecker {

    private final Clock clock;

    public record Eligibility(boolean eligible, BindingOutcome reason) {

        public static final Eligibility ELIGIBLE = new Eligibility(true, null);

        public static Eligibility ineligible(BindingOutcome reason) {
            return new Eligibility(false, reason);
        }
    }

    public Eligibility check(RegistrationRecord record) {
        return check(record, LocalDate.now(clock));
    }

    public Eligibility check(RegistrationRecord record, LocalDate today) {
        if (record.getStatus() != RegistrationStatus.ACTIVE) {
            return Eligibility.ineligible(BindingOutcome.NOT_ACTIVE);
        }
        if (record.getValidFrom() != null && today.isBefore(record.getValidFrom())) {
            return Eligibility.ineligible(BindingOutcome.NOT_STARTED);
        }
        if (record.getValidUntil() != null && today.isAfter(record.getValidUntil())) {
            return Eligibility.ineligible(BindingOutcome.EXPIRED);
        }
        return Eligibility.ELIGIBLE;
    }
}
