package com.flagship.lending_ledger.settings;

import com.flagship.lending_ledger.config.LendingProperties;
import com.flagship.lending_ledger.loan.exception.LendingErrorCode;
import com.flagship.lending_ledger.loan.exception.LendingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Settings store for lending parameters.
 *
 * Rows in lending_settings override the lending.defaults.* properties key by key, so a
 * missing row never leaves a parameter undefined. Reads are not cached: an admin change
 * applies to the next operation.
 */
@Service
@Slf4j
public class LendingSettingsService {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final JdbcTemplate jdbcTemplate;
    private final LendingProperties properties;

    public LendingSettingsService(JdbcTemplate jdbcTemplate, LendingProperties properties) {
        this.jdbcTemplate = jdbcTemplate;
        this.properties = properties;
    }

    @Transactional(readOnly = true)
    public LendingSettings current() {
        LendingSettings settings = defaults();
        List<Map<String, Object>> rows = jdbcTemplate.queryForList(
            "SELECT setting_key, setting_value FROM lending_settings");
        for (Map<String, Object> row : rows) {
            String key = (String) row.get("setting_key");
            BigDecimal value = (BigDecimal) row.get("setting_value");
            var settingKey = SettingKey.fromKey(key);
            if (settingKey.isEmpty()) {
                log.debug("Ignoring unknown lending setting: {}", key);
                continue;
            }
            settings = settings.with(settingKey.get(), value);
        }
        return settings;
    }

    /**
     * Changes one setting after checking the thresholds stay ordered:
     * target and default LTV below warning, warning below liquidation, liquidation at most 100.
     */
    @Transactional
    public LendingSettings update(SettingKey key, BigDecimal value) {
        if (value == null || value.signum() <= 0) {
            throw new LendingException(LendingErrorCode.INVALID_SETTING,
                key.getKey() + " must be positive");
        }
        if (key == SettingKey.MINIMUM_INTEREST_DAYS && value.stripTrailingZeros().scale() > 0) {
            throw new LendingException(LendingErrorCode.INVALID_SETTING,
                key.getKey() + " must be a whole number of days");
        }

        LendingSettings updated = current().with(key, value);
        validate(updated);

        jdbcTemplate.update(
            "INSERT INTO lending_settings (setting_key, setting_value, updated_at) VALUES (?, ?, CURRENT_TIMESTAMP) " +
            "ON CONFLICT (setting_key) DO UPDATE SET setting_value = EXCLUDED.setting_value, updated_at = CURRENT_TIMESTAMP",
            key.getKey(), value);

        log.info("Lending setting updated: key={}, value={}", key.getKey(), value);
        return updated;
    }

    private LendingSettings defaults() {
        LendingProperties.Defaults defaults = properties.getDefaults();
        return LendingSettings.builder()
            .defaultLtvRatio(defaults.getLtvRatio())
            .interestRate(defaults.getInterestRate())
            .liquidationThreshold(defaults.getLiquidationThreshold())
            .warningThreshold(defaults.getWarningThreshold())
            .liquidationTarget(defaults.getLiquidationTarget())
            .minimumInterestDays(defaults.getMinimumInterestDays())
            .build();
    }

    private static void validate(LendingSettings settings) {
        if (settings.getLiquidationThreshold().compareTo(HUNDRED) > 0) {
            throw new LendingException(LendingErrorCode.INVALID_SETTING,
                "liquidation_threshold cannot exceed 100");
        }
        if (settings.getWarningThreshold().compareTo(settings.getLiquidationThreshold()) >= 0) {
            throw new LendingException(LendingErrorCode.INVALID_SETTING,
                "warning_threshold must be below liquidation_threshold");
        }
        if (settings.getLiquidationTarget().compareTo(settings.getWarningThreshold()) >= 0) {
            throw new LendingException(LendingErrorCode.INVALID_SETTING,
                "liquidation_target must be below warning_threshold");
        }
        if (settings.getDefaultLtvRatio().compareTo(settings.getLiquidationThreshold()) >= 0) {
            throw new LendingException(LendingErrorCode.INVALID_SETTING,
                "default_ltv_ratio must be below liquidation_threshold");
        }
    }
}
