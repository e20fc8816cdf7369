package com.bmsedge.emergency.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;

/**
 * Configuration for the emergency engine timers
 */
@Configuration
@EnableScheduling  // Correlation, power, wellbeing and collaborator polls
public class EmergencyConfig {

    /**
     * Clock shared by every component so tests can drive time explicitly
     */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
