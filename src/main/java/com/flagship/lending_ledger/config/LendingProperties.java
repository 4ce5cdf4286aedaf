package com.flagship.lending_ledger.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Lending configuration bound from the "lending" prefix.
 *
 * The defaults block seeds the settings store; values in the lending_settings table win.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "lending")
public class LendingProperties {

    private Defaults defaults = new Defaults();

    private Rates rates = new Rates();

    private RiskMonitor riskMonitor = new RiskMonitor();

    private InterestAccrual interestAccrual = new InterestAccrual();

    /** Attempts for an operation that lost a lock or deadlock race */
    private int retryMaxAttempts = 3;

    @Data
    public static class Defaults {
        /** LTV ratio a new loan gets when the request names none (percent) */
        private BigDecimal ltvRatio = new BigDecimal("60");
        /** Annual interest rate captured on new loans (percent) */
        private BigDecimal interestRate = new BigDecimal("15");
        private BigDecimal liquidationThreshold = new BigDecimal("90");
        private BigDecimal warningThreshold = new BigDecimal("85");
        /** LTV a partial liquidation brings the loan back to (percent) */
        private BigDecimal liquidationTarget = new BigDecimal("60");
        private int minimumInterestDays = 30;
    }

    @Data
    public static class Rates {
        private String redisKey = "market:rates:btc";
        /** Rates older than this are rejected */
        private Duration maxAge = Duration.ofMinutes(5);
        /** Read Redis before the market_rates table */
        private boolean redisEnabled = true;
    }

    @Data
    public static class RiskMonitor {
        private boolean enabled = true;
        private long intervalMs = 30_000L;
    }

    @Data
    public static class InterestAccrual {
        private boolean enabled = true;
        private String cron = "0 1 0 * * *";
        private String zone = "Asia/Kolkata";
    }
}
