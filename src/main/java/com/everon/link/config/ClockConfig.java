package com.everon.link.config;

import java.time.Clock;
import java.time.ZoneId;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the clock used for validity windows and token timestamps.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock(EveronLinkProperties properties) {
        return Clock.system(ZoneId.of(properties.getZoneId()));
    }
}
