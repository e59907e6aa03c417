package com.everon.link.config;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import com.everon.link.store.RegistrationStore;
import com.everon.link.transport.MessagingTransport;

import lombok.RequiredArgsConstructor;

/**
 * Spring Boot Actuator health indicator for the binding pipeline.
 *
 * Reports DOWN when the registration store is unreachable or no registration
 * secret is configured; a missing bot token only shows up as a detail.
 */
@Component
@RequiredArgsConstructor
public class RegistrationStoreHealthIndicator implements HealthIndicator {

    private final RegistrationStore store;
    private final MessagingTransport transport;
    private final EveronLinkProperties properties;

    @Override
    public Health health() {
        boolean storeUp = store.isAvailable();
        boolean secretSet = properties.isSecretConfigured();

        Health.Builder builder = storeUp && secretSet ? Health.up() : Health.down();
        return builder
                .withDetail("store", store.getType())
                .withDetail("store-reachable", storeUp)
                .withDetail("registration-secret", secretSet ? "configured" : "missing")
                .withDetail("telegram", transport.isConfigured() ? "configured" : "disabled")
                .build();
    }
}
