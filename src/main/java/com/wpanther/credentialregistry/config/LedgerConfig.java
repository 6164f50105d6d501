package com.wpanther.credentialregistry.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class LedgerConfig {

    /**
     * Wall clock the ledger height is derived from
     */
    @Bean
    public Clock ledgerWallClock() {
        return Clock.systemUTC();
    }
}
