package com.everon.link;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

import com.everon.link.config.EveronLinkProperties;

/**
 * EverOn Link - Telegram chat to device registration binding.
 *
 * A user proves ownership of a pre-provisioned EverOn registration by sending
 * its one-time code to the bot. The chat is then bound to the registration and
 * receives a signed link QR that the device scans to address the chat.
 */
@SpringBootApplication
@EnableConfigurationProperties(EveronLinkProperties.class)
public class EveronLinkApplication {

    public static void main(String[] args) {
        SpringApplication.run(EveronLinkApplication.class, args);
    }
}
