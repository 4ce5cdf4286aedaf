package com.flagship.lending_ledger.settings;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Lending parameters in effect for one operation. Percentages are plain numbers (60 means 60%).
 */
@Value
@Builder(toBuilder = true)
public class LendingSettings {
    BigDecimal defaultLtvRatio;
    BigDecimal interestRate;
    BigDecimal liquidationThreshold;
    BigDecimal warningThreshold;
    BigDecimal liquidationTarget;
    int minimumInterestDays;

    public BigDecimal get(SettingKey key) {
        return switch (key) {
            case DEFAULT_LTV_RATIO -> defaultLtvRatio;
            case INTEREST_RATE -> interestRate;
            case LIQUIDATION_THRESHOLD -> liquidationThreshold;
            case WARNING_THRESHOLD -> warningThreshold;
            case LIQUIDATION_TARGET -> liquidationTarget;
            case MINIMUM_INTEREST_DAYS -> BigDecimal.valueOf(minimumInterestDays);
        };
    }

    public LendingSettings with(SettingKey key, BigDecimal value) {
        return switch (key) {
            case DEFAULT_LTV_RATIO -> toBuilder().defaultLtvRatio(value).build();
            case INTEREST_RATE -> toBuilder().interestRate(value).build();
            case LIQUIDATION_THRESHOLD -> toBuilder().liquidationThreshold(value).build();
            case WARNING_THRESHOLD -> toBuilder().warningThreshold(value).build();
            case LIQUIDATION_TARGET -> toBuilder().liquidationTarget(value).build();
            case MINIMUM_INTEREST_DAYS -> toBuilder().minimumInterestDays(value.intValueExact()).build();
        };
    }
}
