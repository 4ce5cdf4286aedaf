package com.flagship.lending_ledger.liquidation;

import com.flagship.lending_ledger.config.LendingProperties;
import com.flagship.lending_ledger.loan.LoanPersistenceService;
import com.flagship.lending_ledger.loan.exception.LendingException;
import com.flagship.lending_ledger.observability.CorrelationContext;
import com.flagship.lending_ledger.observability.LendingMetrics;
import com.flagship.lending_ledger.rate.MarketRates;
import com.flagship.lending_ledger.rate.RateOracle;
import com.flagship.lending_ledger.settings.LendingSettings;
import com.flagship.lending_ledger.settings.LendingSettingsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodic loan-to-value check over every active loan with debt and collateral.
 *
 * Each tick reads one rate and evaluates each loan in its own transaction, so a loan that
 * fails is logged and retried next tick without holding up the rest. Ticks never overlap:
 * a tick that finds the previous one still running is skipped. Without a fresh rate the
 * whole tick is skipped. The rate is re-read whenever it expires during a tick; loans that
 * cannot get a fresh rate are left for the next tick.
 *
 * Warning events are raised once per entry into the warning band. The set of warned loans
 * lives in memory and is lost on restart, which at worst repeats a warning.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RiskMonitor {

    private final LiquidationService liquidationService;
    private final LoanPersistenceService loanPersistenceService;
    private final LendingSettingsService settingsService;
    private final RateOracle rateOracle;
    private final LendingMetrics lendingMetrics;
    private final LendingProperties properties;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Set<UUID> warnedLoans = ConcurrentHashMap.newKeySet();

    @Scheduled(fixedDelayString = "${lending.risk-monitor.interval-ms:30000}",
        initialDelayString = "${lending.risk-monitor.interval-ms:30000}")
    public void scheduledTick() {
        if (!properties.getRiskMonitor().isEnabled()) {
            return;
        }
        runTick();
    }

    /**
     * Runs one tick now, on the calling thread, whether or not the schedule is enabled.
     */
    public RiskTickResult triggerNow() {
        log.info("Risk check triggered manually");
        return runTick();
    }

    RiskTickResult runTick() {
        Instant startedAt = clock.instant();
        if (!running.compareAndSet(false, true)) {
            log.info("Risk monitor tick skipped: previous tick still running");
            return RiskTickResult.skipped(RiskTickResult.Outcome.SKIPPED_ALREADY_RUNNING, startedAt);
        }

        long startTime = System.currentTimeMillis();
        CorrelationContext.startJob("risk-monitor");
        try {
            MarketRates rates;
            try {
                rates = rateOracle.currentRates();
            } catch (LendingException e) {
                lendingMetrics.recordRateUnavailable("risk_monitor");
                lendingMetrics.recordRiskMonitorTick("rate_unavailable", System.currentTimeMillis() - startTime);
                log.warn("Risk monitor tick skipped: {}", e.getMessage());
                return RiskTickResult.skipped(RiskTickResult.Outcome.SKIPPED_RATE_UNAVAILABLE, startedAt);
            }

            LendingSettings settings = settingsService.current();
            List<UUID> loanIds = loanPersistenceService.findMonitoredLoanIds();
            warnedLoans.retainAll(new HashSet<>(loanIds));

            RiskTickResult.RiskTickResultBuilder result = RiskTickResult.builder()
                .outcome(RiskTickResult.Outcome.COMPLETED)
                .startedAt(startedAt)
                .sellRate(rates.getSellRate())
                .loansChecked(loanIds.size());
            int warnings = 0;

            for (int i = 0; i < loanIds.size(); i++) {
                UUID loanId = loanIds.get(i);
                if (!rates.isFresh(clock.instant(), properties.getRates().getMaxAge())) {
                    try {
                        rates = rateOracle.currentRates();
                    } catch (LendingException e) {
                        lendingMetrics.recordRateUnavailable("risk_monitor");
                        log.warn("Rate expired mid-tick, {} loans left for next tick: {}",
                            loanIds.size() - i, e.getMessage());
                        for (UUID remaining : loanIds.subList(i, loanIds.size())) {
                            result.failure(remaining, "rate expired before evaluation");
                        }
                        break;
                    }
                }
                MDC.put(CorrelationContext.LOAN_ID_MDC_KEY, loanId.toString());
                try {
                    RiskEvaluation evaluation = liquidationService.evaluateLoan(
                        loanId, rates, settings, warnedLoans.contains(loanId));
                    switch (evaluation.getOutcome()) {
                        case WARNING -> {
                            warnedLoans.add(loanId);
                            if (evaluation.isWarningEmitted()) {
                                warnings++;
                            }
                        }
                        case LIQUIDATED -> {
                            warnedLoans.remove(loanId);
                            result.liquidation(evaluation.getLiquidation());
                        }
                        default -> warnedLoans.remove(loanId);
                    }
                } catch (Exception e) {
                    log.error("Risk check failed for loan, will retry next tick: error={}", e.getMessage(), e);
                    result.failure(loanId, String.valueOf(e.getMessage()));
                } finally {
                    MDC.remove(CorrelationContext.LOAN_ID_MDC_KEY);
                }
            }

            long duration = System.currentTimeMillis() - startTime;
            RiskTickResult tick = result.warningsRaised(warnings).durationMs(duration).build();
            lendingMetrics.recordRiskMonitorTick("completed", duration);

            log.info("Risk monitor tick completed: loans={}, warnings={}, liquidations={}, failures={}, " +
                    "sellRate={}, duration={}ms",
                tick.getLoansChecked(), tick.getWarningsRaised(), tick.getLiquidations().size(),
                tick.getFailures().size(), rates.getSellRate(), duration);
            return tick;

        } finally {
            running.set(false);
            CorrelationContext.clear();
        }
    }
}
