package com.kickoff.tipping.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Resolves the competition's local zone once at startup. If the zone id cannot be loaded the
 * configured fixed offset (default +10:00) is used instead of failing the context.
 */
@Configuration
public class TimeZoneConfig {
    private static final Logger log = LoggerFactory.getLogger(TimeZoneConfig.class);

    @Bean
    public ZoneId tippingZone(@Value("${tipping.timezone:Australia/Sydney}") String zone,
                              @Value("${tipping.timezone.fallback-offset:+10:00}") String fallbackOffset) {
        return resolveZone(zone, fallbackOffset);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    static ZoneId resolveZone(String zone, String fallbackOffset) {
        try {
            return ZoneId.of(zone);
        } catch (DateTimeException | NullPointerException ex) {
            log.warn("[TIME] zone '{}' unavailable ({}), falling back to fixed offset {}", zone, ex.getMessage(), fallbackOffset);
            return ZoneOffset.of(fallbackOffset);
        }
    }
}
