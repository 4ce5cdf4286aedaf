package com.flagship.lending_ledger.admin;

import com.flagship.lending_ledger.admin.dto.RecordRatesRequest;
import com.flagship.lending_ledger.admin.dto.UpdateSettingRequest;
import com.flagship.lending_ledger.interest.AccrualRunResult;
import com.flagship.lending_ledger.interest.InterestAccrualJob;
import com.flagship.lending_ledger.liquidation.AtRiskLoan;
import com.flagship.lending_ledger.liquidation.LiquidationResult;
import com.flagship.lending_ledger.liquidation.LiquidationService;
import com.flagship.lending_ledger.liquidation.RiskMonitor;
import com.flagship.lending_ledger.liquidation.RiskTickResult;
import com.flagship.lending_ledger.loan.exception.LendingErrorCode;
import com.flagship.lending_ledger.loan.exception.LendingException;
import com.flagship.lending_ledger.rate.MarketRates;
import com.flagship.lending_ledger.rate.MarketRateRecorder;
import com.flagship.lending_ledger.settings.LendingSettings;
import com.flagship.lending_ledger.settings.LendingSettingsService;
import com.flagship.lending_ledger.settings.SettingKey;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Operator endpoints: forced liquidation, the at-risk view, on-demand job runs,
 * lending settings and rate observations.
 */
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
@Slf4j
public class AdminController {

    private final LiquidationService liquidationService;
    private final RiskMonitor riskMonitor;
    private final InterestAccrualJob interestAccrualJob;
    private final LendingSettingsService settingsService;
    private final MarketRateRecorder rateRecorder;

    @PostMapping("/loans/{loanId}/liquidate")
    public ResponseEntity<LiquidationResult> forceLiquidate(@PathVariable("loanId") UUID loanId) {
        log.warn("Operator liquidation requested: loanId={}", loanId);
        return ResponseEntity.ok(liquidationService.forceLiquidate(loanId));
    }

    @GetMapping("/loans/at-risk")
    public ResponseEntity<List<AtRiskLoan>> listAtRiskLoans(
            @RequestParam(name = "include_safe", defaultValue = "false") boolean includeSafe) {
        return ResponseEntity.ok(liquidationService.listAtRiskLoans(includeSafe));
    }

    @PostMapping("/jobs/interest-accrual")
    public ResponseEntity<AccrualRunResult> runInterestAccrual() {
        log.info("Interest accrual triggered manually");
        return ResponseEntity.ok(interestAccrualJob.runAccrual());
    }

    @PostMapping("/jobs/risk-check")
    public ResponseEntity<RiskTickResult> runRiskCheck() {
        return ResponseEntity.ok(riskMonitor.triggerNow());
    }

    @GetMapping("/settings")
    public ResponseEntity<Map<String, BigDecimal>> getSettings() {
        return ResponseEntity.ok(toMap(settingsService.current()));
    }

    @PutMapping("/settings/{key}")
    public ResponseEntity<Map<String, BigDecimal>> updateSetting(@PathVariable("key") String key,
                                                                 @Valid @RequestBody UpdateSettingRequest request) {
        SettingKey settingKey = SettingKey.fromKey(key)
            .orElseThrow(() -> new LendingException(LendingErrorCode.INVALID_SETTING, "Unknown setting: " + key));
        return ResponseEntity.ok(toMap(settingsService.update(settingKey, request.getValue())));
    }

    @PostMapping("/rates")
    public ResponseEntity<MarketRates> recordRates(@Valid @RequestBody RecordRatesRequest request) {
        MarketRates rates = rateRecorder.recordRates(request.getBuyRate(), request.getSellRate());
        return ResponseEntity.status(HttpStatus.CREATED).body(rates);
    }

    private static Map<String, BigDecimal> toMap(LendingSettings settings) {
        Map<String, BigDecimal> values = new LinkedHashMap<>();
        for (SettingKey key : SettingKey.values()) {
            values.put(key.getKey(), settings.get(key));
        }
        return values;
    }
}
