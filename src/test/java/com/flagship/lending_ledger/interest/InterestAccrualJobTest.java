package com.flagship.lending_ledger.interest;

import com.flagship.lending_ledger.config.LendingProperties;
import com.flagship.lending_ledger.loan.LoanPersistenceService;
import com.flagship.lending_ledger.observability.LendingMetrics;
import com.flagship.lending_ledger.settings.LendingSettings;
import com.flagship.lending_ledger.settings.LendingSettingsService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.CannotAcquireLockException;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Accrual run bookkeeping: per-loan failure isolation, the accrual date in the
 * configured zone, and the disabled switch.
 */
@ExtendWith(MockitoExtension.class)
class InterestAccrualJobTest {

    // 20:00 UTC is already the next day in Asia/Kolkata
    private static final Instant NOW = Instant.parse("2024-03-10T20:00:00Z");
    private static final LocalDate KOLKATA_DATE = LocalDate.of(2024, 3, 11);

    @Mock
    private InterestAccrualService accrualService;

    @Mock
    private LoanPersistenceService loanPersistenceService;

    @Mock
    private LendingSettingsService settingsService;

    @Mock
    private LendingMetrics lendingMetrics;

    private LendingProperties properties;
    private InterestAccrualJob job;

    @BeforeEach
    void setUp() {
        properties = new LendingProperties();
        job = new InterestAccrualJob(accrualService, loanPersistenceService, settingsService, lendingMetrics,
            properties, Clock.fixed(NOW, ZoneId.of("Asia/Kolkata")));
    }

    @Test
    @DisplayName("A failing loan is counted and the run continues with the rest")
    void failureIsolation() {
        UUID failing = UUID.randomUUID();
        UUID healthy = UUID.randomUUID();
        UUID alreadyAccrued = UUID.randomUUID();
        LendingSettings settings = LendingSettings.builder().build();
        when(settingsService.current()).thenReturn(settings);
        when(loanPersistenceService.findAccruingLoanIds()).thenReturn(List.of(failing, healthy, alreadyAccrued));
        when(accrualService.accrue(failing, KOLKATA_DATE, settings))
            .thenThrow(new CannotAcquireLockException("lock timeout"));
        when(accrualService.accrue(healthy, KOLKATA_DATE, settings))
            .thenReturn(new LoanAccrual(healthy, true, 4L));
        when(accrualService.accrue(alreadyAccrued, KOLKATA_DATE, settings))
            .thenReturn(new LoanAccrual(alreadyAccrued, false, 0L));

        AccrualRunResult result = job.runAccrual();

        assertEquals(KOLKATA_DATE, result.getAccrualDate());
        assertEquals(3, result.getLoansConsidered());
        assertEquals(1, result.getLoansAccrued());
        assertEquals(1, result.getLoansSkipped());
        assertEquals(1, result.getLoansFailed());
        assertEquals(4L, result.getTotalInterest());
        assertTrue(result.getFailures().containsKey(failing));
        verify(lendingMetrics).recordAccrualRun(1, 1, 1);
    }

    @Test
    @DisplayName("Scheduled run does nothing when accrual is disabled")
    void disabledScheduledRun() {
        properties.getInterestAccrual().setEnabled(false);

        job.scheduledRun();

        verifyNoInteractions(accrualService, loanPersistenceService, settingsService);
    }

    @Test
    @DisplayName("Scheduled run accrues when enabled")
    void enabledScheduledRun() {
        when(settingsService.current()).thenReturn(LendingSettings.builder().build());
        when(loanPersistenceService.findAccruingLoanIds()).thenReturn(List.of());

        job.scheduledRun();

        verify(loanPersistenceService).findAccruingLoanIds();
        verify(accrualService, never()).accrue(any(), eq(KOLKATA_DATE), any());
    }
}
