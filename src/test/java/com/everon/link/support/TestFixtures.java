package com.everon.link.support;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

import com.everon.link.config.EveronLinkProperties;
import com.everon.link.model.domain.RegistrationRecord;
import com.everon.link.model.enums.RegistrationStatus;
import com.everon.link.service.EligibilityChecker;
import com.everon.link.service.LinkTokenIssuer;
import com.everon.link.service.RecordLockRegistry;
import com.everon.link.service.RecordMatcher;
import com.everon.link.service.RegistrationBindingService;
import com.everon.link.service.RegistrationCodeNormalizer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

public final class TestFixtures {

    public static final String SECRET = "S";

    private TestFixtures() {
    }

    public static EveronLinkProperties properties() {
        EveronLinkProperties properties = new EveronLinkProperties();
        properties.setRegistrationSecret(SECRET);
        return properties;
    }

    public static Clock clockAt(String date) {
        return Clock.fixed(Instant.parse(date + "T12:00:00Z"), ZoneOffset.UTC);
    }

    public static ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public static RegistrationRecord activeRecord(String code) {
        return RegistrationRecord.builder()
                .codeHash(RecordMatcher.digest(code, SECRET))
                .status(RegistrationStatus.ACTIVE)
                .build();
    }

    public static RegistrationRecord recordValidUntil(String code, LocalDate validUntil) {
        RegistrationRecord record = activeRecord(code);
        record.setValidUntil(validUntil);
        return record;
    }

    /**
     * Binding service wired against the given store, clock and properties.
     */
    public static RegistrationBindingService bindingService(InMemoryRegistrationStore store, Clock clock,
                                                            EveronLinkProperties properties) {
        RecordMatcher matcher = new RecordMatcher(store, properties);
        return new RegistrationBindingService(
                new RegistrationCodeNormalizer(properties),
                matcher,
                new EligibilityChecker(clock),
                new LinkTokenIssuer(properties, clock, objectMapper()),
                new RecordLockRegistry(),
                store,
                properties,
                clock);
    }
}
