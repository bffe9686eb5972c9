package com.parichay.api.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Turns on the periodic expiry sweeps. Disabled with {@code parichay.sweep.enabled=false}.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(name = "parichay.sweep.enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConfig {
}
