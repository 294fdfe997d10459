package com.flagship.credit_ledger.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;

/**
 * Core wiring for the ledger: typed settings, the clock every timestamp comes from,
 * and scheduling for the sweep, reminder and outbox jobs.
 */
@Configuration
@EnableScheduling
@EnableConfigurationProperties(CreditLedgerProperties.class)
public class LedgerConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
