package com.leadflow.backend.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Engine clock. Inactivity cutoffs, due dates, run locks and token lifetimes are all
 * measured against it, always in UTC; schedule matching converts to the scheduler zone.
 */
@Configuration
public class TimeConfig {

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock engagementClock() {
        return Clock.systemUTC();
    }
}
