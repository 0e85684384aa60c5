package com.company.slaregistry.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfiguration {

    /**
     * Source of every createdAt / lastReportAt timestamp in the ledger
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
