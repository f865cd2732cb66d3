package com.petwash.ledger.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class LedgerConfig {

    /** Source of signed timestamps. */
    @Bean
    public Clock ledgerClock() {
        return Clock.systemUTC();
    }
}
