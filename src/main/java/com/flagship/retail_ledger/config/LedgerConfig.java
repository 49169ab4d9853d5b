package com.flagship.retail_ledger.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(LedgerProperties.class)
public class LedgerConfig {

    /**
     * Clock used for date-derived state: overdue debts and adjustment date ranges.
     */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
