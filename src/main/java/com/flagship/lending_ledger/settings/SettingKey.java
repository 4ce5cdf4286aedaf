package com.flagship.lending_ledger.settings;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Optional;

/**
 * Keys of the lending_settings table.
 */
@Getter
@RequiredArgsConstructor
public enum SettingKey {
    DEFAULT_LTV_RATIO("default_ltv_ratio"),
    INTEREST_RATE("interest_rate"),
    LIQUIDATION_THRESHOLD("liquidation_threshold"),
    WARNING_THRESHOLD("warning_threshold"),
    LIQUIDATION_TARGET("liquidation_target"),
    MINIMUM_INTEREST_DAYS("minimum_interest_days");

    private final String key;

    public static Optional<SettingKey> fromKey(String key) {
        return Arrays.stream(values())
            .filter(k -> k.key.equalsIgnoreCase(key))
            .findFirst();
    }
}
