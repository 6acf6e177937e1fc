package com.acks;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main entry point for the ACKS campaign server.
 *
 * Features:
 * - Dungeon maps as room graphs with embedded fights
 * - Server-authoritative combat resolution with DM overrides
 * - Party XP pool and allocation
 * - Role-filtered real-time updates over STOMP
 */
@SpringBootApplication
@EnableScheduling
public class AcksCampaignApplication {

    public static void main(String[] args) {
        SpringApplication.run(AcksCampaignApplication.class, args);
    }
}
