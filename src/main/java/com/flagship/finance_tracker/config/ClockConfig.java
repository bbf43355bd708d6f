package com.flagship.finance_tracker.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Source of "today" for due-date, overdue and default paid-date rules.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock(@Value("${finance.time-zone:UTC}") String timeZone) {
        return Clock.system(ZoneId.of(timeZone));
    }
}
