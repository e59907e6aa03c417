package com.everon.link.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.LocalDate;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.everon.link.model.domain.RegistrationRecord;
import com.everon.link.model.enums.BindingOutcome;
import com.everon.link.model.enums.RegistrationStatus;
import com.everon.link.support.TestFixtures;

class EligibilityCheckerTest {

    private static final LocalDate END = LocalDate.of(2024, 1, 1);

    private EligibilityChecker checker;
    private RegistrationRecord record;

    @BeforeEach
    void setUp() {
        checker = new EligibilityChecker(TestFixtures.clockAt("2023-12-31"));
        record = TestFixtures.recordValidUntil("ABC123", END);
    }

    @Test
    void eligibleBeforeAndOnLastDay() {
        assertTrue(checker.check(record, LocalDate.of(2023, 12, 31)).eligible());
        assertTrue(checker.check(record, END).eligible());
        assertTrue(checker.check(record).eligible());
    }

    @Test
    void expiredAfterLastDay() {
        var result = checker.check(record, LocalDate.of(2024, 1, 2));

        assertFalse(result.eligible());
        assertEquals(BindingOutcome.EXPIRED, result.reason());
    }

    @Test
    void notStartedBeforeFirstDay() {
        record.setValidFrom(LocalDate.of(2024, 1, 1));
        record.setValidUntil(null);

        assertEquals(BindingOutcome.NOT_STARTED, checker.check(record).reason());
        assertTrue(checker.check(record, LocalDate.of(2024, 1, 1)).eligible());
    }

    @Test
    void inactiveStatusWinsOverDates() {
        record.setStatus(RegistrationStatus.SUSPENDED);

        assertEquals(BindingOutcome.NOT_ACTIVE, checker.check(record, LocalDate.of(2024, 6, 1)).reason());
    }

    @Test
    void inactiveRecordIsNotActive() {
        record.setStatus(RegistrationStatus.INACTIVE);

        var result = checker.check(record);

        assertFalse(result.eligible());
        assertEquals(BindingOutcome.NOT_ACTIVE, result.reason());
    }

    @Test
    void openEndedWindowIsAlwaysEligible() {
        RegistrationRecord open = TestFixtures.activeRecord("ABC123");

        assertTrue(checker.check(open, LocalDate.of(2099, 1, 1)).eligible());
    }
}
