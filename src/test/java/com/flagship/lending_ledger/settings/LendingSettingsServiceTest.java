package com.flagship.lending_ledger.settings;

import com.flagship.lending_ledger.config.LendingProperties;
import com.flagship.lending_ledger.loan.exception.LendingErrorCode;
import com.flagship.lending_ledger.loan.exception.LendingException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.JdbcTemplate;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Settings resolution (table over property defaults) and threshold ordering on update.
 */
@ExtendWith(MockitoExtension.class)
class LendingSettingsServiceTest {

    @Mock
    private JdbcTemplate jdbcTemplate;

    private LendingSettingsService settingsService;

    @BeforeEach
    void setUp() {
        settingsService = new LendingSettingsService(jdbcTemplate, new LendingProperties());
    }

    private void givenRows(List<Map<String, Object>> rows) {
        when(jdbcTemplate.queryForList(anyString())).thenReturn(rows);
    }

    private static Map<String, Object> row(String key, String value) {
        return Map.of("setting_key", key, "setting_value", new BigDecimal(value));
    }

    @Test
    @DisplayName("Property defaults apply when the table is empty")
    void defaultsWithoutRows() {
        givenRows(List.of());

        LendingSettings settings = settingsService.current();

        assertEquals(0, new BigDecimal("60").compareTo(settings.getDefaultLtvRatio()));
        assertEquals(0, new BigDecimal("15").compareTo(settings.getInterestRate()));
        assertEquals(0, new BigDecimal("90").compareTo(settings.getLiquidationThreshold()));
        assertEquals(0, new BigDecimal("85").compareTo(settings.getWarningThreshold()));
        assertEquals(0, new BigDecimal("60").compareTo(settings.getLiquidationTarget()));
        assertEquals(30, settings.getMinimumInterestDays());
    }

    @Test
    @DisplayName("Table rows override defaults and unknown keys are ignored")
    void rowsOverrideDefaults() {
        givenRows(List.of(
            row("interest_rate", "12.5"),
            row("minimum_interest_days", "14"),
            row("legacy_fee", "3")));

        LendingSettings settings = settingsService.current();

        assertEquals(0, new BigDecimal("12.5").compareTo(settings.getInterestRate()));
        assertEquals(14, settings.getMinimumInterestDays());
        assertEquals(0, new BigDecimal("90").compareTo(settings.getLiquidationThreshold()));
    }

    @Test
    @DisplayName("Valid update is upserted")
    void validUpdate() {
        givenRows(List.of());

        LendingSettings updated = settingsService.update(SettingKey.LIQUIDATION_TARGET, new BigDecimal("55"));

        assertEquals(0, new BigDecimal("55").compareTo(updated.getLiquidationTarget()));
        verify(jdbcTemplate).update(anyString(), eq("liquidation_target"), eq(new BigDecimal("55")));
    }

    @Test
    @DisplayName("Warning threshold must stay below the liquidation threshold")
    void warningAboveLiquidation() {
        givenRows(List.of());

        LendingException ex = assertThrows(LendingException.class,
            () -> settingsService.update(SettingKey.WARNING_THRESHOLD, new BigDecimal("90")));

        assertEquals(LendingErrorCode.INVALID_SETTING, ex.getErrorCode());
        verify(jdbcTemplate).queryForList(anyString());
        verifyNoMoreInteractions(jdbcTemplate);
    }

    @Test
    @DisplayName("Liquidation threshold cannot exceed 100")
    void thresholdAboveHundred() {
        givenRows(List.of());

        LendingException ex = assertThrows(LendingException.class,
            () -> settingsService.update(SettingKey.LIQUIDATION_THRESHOLD, new BigDecimal("101")));

        assertEquals(LendingErrorCode.INVALID_SETTING, ex.getErrorCode());
    }

    @Test
    @DisplayName("Non-positive values and fractional day counts are rejected before reading the table")
    void malformedValues() {
        assertEquals(LendingErrorCode.INVALID_SETTING, assertThrows(LendingException.class,
            () -> settingsService.update(SettingKey.INTEREST_RATE, BigDecimal.ZERO)).getErrorCode());
        assertEquals(LendingErrorCode.INVALID_SETTING, assertThrows(LendingException.class,
            () -> settingsService.update(SettingKey.MINIMUM_INTEREST_DAYS, new BigDecimal("1.5"))).getErrorCode());

        verifyNoInteractions(jdbcTemplate);
    }
}
