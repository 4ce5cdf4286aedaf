package com.flagship.lending_ledger.observability;

import com.flagship.lending_ledger.loan.LoanRepository;
import com.flagship.lending_ledger.loan.LoanStatus;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Centralized metrics for lending operations.
 *
 * Metrics exposed:
 * - lending.operations: operations by name and outcome
 * - lending.operation.latency: timer per operation
 * - lending.liquidations: liquidations by type and trigger
 * - lending.interest.accrued: base units of interest charged
 * - lending.risk.warnings: loans entering the warning band
 * - lending.rates.unavailable: computations refused for lack of a fresh rate
 * - lending.loans.active: gauge of ACTIVE loans
 */
@Component
@Slf4j
public class LendingMetrics {

    private final MeterRegistry registry;
    private final LoanRepository loanRepository;

    private final AtomicLong activeLoans = new AtomicLong(0);

    public LendingMetrics(MeterRegistry registry, LoanRepository loanRepository) {
        this.registry = registry;
        this.loanRepository = loanRepository;

        Gauge.builder("lending.loans.active", activeLoans, AtomicLong::get)
            .description("Number of ACTIVE loans")
            .register(registry);
    }

    public void recordOperation(String operation, String outcome) {
        registry.counter("lending.operations",
            "operation", sanitizeTag(operation),
            "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordOperationLatency(String operation, long durationMs) {
        registry.timer("lending.operation.latency",
            "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    public void recordLiquidation(String type, String trigger, long collateralSold) {
        registry.counter("lending.liquidations",
            "type", sanitizeTag(type),
            "trigger", sanitizeTag(trigger)
        ).increment();
        registry.summary("lending.liquidation.collateral_sold",
            "trigger", sanitizeTag(trigger)
        ).record(collateralSold);
    }

    public void recordInterestAccrued(long amount) {
        registry.counter("lending.interest.accrued").increment(amount);
    }

    public void recordAccrualRun(int accrued, int skipped, int failed) {
        registry.counter("lending.interest.runs.loans", "result", "accrued").increment(accrued);
        registry.counter("lending.interest.runs.loans", "result", "skipped").increment(skipped);
        registry.counter("lending.interest.runs.loans", "result", "failed").increment(failed);
    }

    public void recordRiskWarning() {
        registry.counter("lending.risk.warnings").increment();
    }

    public void recordRiskMonitorTick(String outcome, long durationMs) {
        registry.timer("lending.risk.monitor.tick",
            "outcome", sanitizeTag(outcome)
        ).record(Duration.ofMillis(durationMs));
    }

    public void recordRateUnavailable(String context) {
        registry.counter("lending.rates.unavailable",
            "context", sanitizeTag(context)
        ).increment();
    }

    /**
     * Refreshes the portfolio gauges. Called periodically by the scheduler.
     */
    public void refreshPortfolioMetrics() {
        try {
            activeLoans.set(loanRepository.countByStatus(LoanStatus.ACTIVE));
        } catch (Exception e) {
            log.warn("Failed to refresh lending metrics: {}", e.getMessage());
        }
    }

    /**
     * Keeps tag values short and free of special characters.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
