package com.planttracker.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * UTC clock behind job start and end times, progress retention and the "today" that
 * relative fertilizer dates are parsed against. Tests pass a fixed one.
 */
@Configuration
public class TimeConfig {

    @Bean
    public Clock importClock() {
        return Clock.systemUTC();
    }
}
