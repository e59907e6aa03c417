package com.everon.link.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.access.intercept.AuthorizationFilter;

import com.everon.link.security.SharedSecretHeaderFilter;

import lombok.RequiredArgsConstructor;

/**
 * Security configuration for EverOn Link.
 *
 * There are no user accounts: callers prove themselves with shared-secret
 * headers checked by {@link SharedSecretHeaderFilter}.
 */
@Configuration
@EnableWebSecurity
@RequiredArgsConstructor
public class LinkSecurityConfig {

    private final SharedSecretHeaderFilter sharedSecretHeaderFilter;

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        http
            .csrf(csrf -> csrf.disable())
            .sessionManagement(session ->
                session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .authorizeHttpRequests(auth -> auth
                .requestMatchers("/actuator/health", "/actuator/info").permitAll()
                .requestMatchers("/swagger-ui/**", "/api-docs/**", "/swagger-ui.html").permitAll()
                .requestMatchers("/api/**").permitAll()
                .anyRequest().denyAll()
            )
            .addFilterBefore(sharedSecretHeaderFilter, AuthorizationFilter.class)
            .headers(headers -> headers
                .frameOptions(frame -> frame.deny())
            );

        return http.build();
    }
}
