package com.flagship.lending_ledger.interest;

import com.flagship.lending_ledger.config.LendingProperties;
import com.flagship.lending_ledger.loan.LoanPersistenceService;
import com.flagship.lending_ledger.observability.CorrelationContext;
import com.flagship.lending_ledger.observability.LendingMetrics;
import com.flagship.lending_ledger.settings.LendingSettings;
import com.flagship.lending_ledger.settings.LendingSettingsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Daily interest accrual over every active loan with debt.
 *
 * Runs shortly after midnight in the accrual zone. Loans are processed one transaction
 * each; a failure is logged and counted and the run moves on to the next loan.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class InterestAccrualJob {

    private final InterestAccrualService accrualService;
    private final LoanPersistenceService loanPersistenceService;
    private final LendingSettingsService settingsService;
    private final LendingMetrics lendingMetrics;
    private final LendingProperties properties;
    private final Clock clock;

    @Scheduled(cron = "${lending.interest-accrual.cron:0 1 0 * * *}",
        zone = "${lending.interest-accrual.zone:Asia/Kolkata}")
    public void scheduledRun() {
        if (!properties.getInterestAccrual().isEnabled()) {
            log.debug("Interest accrual disabled, skipping scheduled run");
            return;
        }
        runAccrual();
    }

    /**
     * Accrues today's interest on every eligible loan, on the calling thread.
     */
    public AccrualRunResult runAccrual() {
        long startTime = System.currentTimeMillis();
        CorrelationContext.startJob("interest-accrual");
        try {
            LocalDate accrualDate = LocalDate.now(clock);
            LendingSettings settings = settingsService.current();
            List<UUID> loanIds = loanPersistenceService.findAccruingLoanIds();
            log.info("Interest accrual started: date={}, loans={}", accrualDate, loanIds.size());

            AccrualRunResult.AccrualRunResultBuilder result = AccrualRunResult.builder()
                .accrualDate(accrualDate)
                .loansConsidered(loanIds.size());
            int accrued = 0;
            int skipped = 0;
            int failed = 0;
            long totalInterest = 0L;

            for (UUID loanId : loanIds) {
                MDC.put(CorrelationContext.LOAN_ID_MDC_KEY, loanId.toString());
                try {
                    LoanAccrual accrual = accrualService.accrue(loanId, accrualDate, settings);
                    if (accrual.isAccrued()) {
                        accrued++;
                        totalInterest += accrual.getInterest();
                    } else {
                        skipped++;
                    }
                } catch (Exception e) {
                    failed++;
                    result.failure(loanId, String.valueOf(e.getMessage()));
                    log.error("Interest accrual failed for loan: error={}", e.getMessage(), e);
                } finally {
                    MDC.remove(CorrelationContext.LOAN_ID_MDC_KEY);
                }
            }

            long duration = System.currentTimeMillis() - startTime;
            lendingMetrics.recordAccrualRun(accrued, skipped, failed);

            log.info("Interest accrual completed: date={}, accrued={}, skipped={}, failed={}, totalInterest={}, duration={}ms",
                accrualDate, accrued, skipped, failed, totalInterest, duration);

            return result
                .loansAccrued(accrued)
                .loansSkipped(skipped)
                .loansFailed(failed)
                .totalInterest(totalInterest)
                .durationMs(duration)
                .build();
        } finally {
            CorrelationContext.clear();
        }
    }
}
