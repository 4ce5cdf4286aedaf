package com.flagship.lending_ledger.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
public class ClockConfig {

    /**
     * Clock in the accrual zone, so "today" for interest matches the cron's calendar day.
     */
    @Bean
    public Clock clock(LendingProperties properties) {
        return Clock.system(ZoneId.of(properties.getInterestAccrual().getZone()));
    }
}
