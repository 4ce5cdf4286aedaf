package com.flagship.lending_ledger.loan;

import lombok.Value;

/**
 * Amount needed to close a loan, with the minimum-interest floor applied.
 *
 * totalAmountDue = outstanding balance + interestShortfall, where the shortfall is what the
 * floor still requires on top of the interest already charged.
 */
@Value
public class RepaymentQuote {
    long principal;
    long interestAccrued;
    long daysElapsed;
    long daysCharged;
    long minimumInterestDue;
    long interestShortfall;
    long totalAmountDue;

    public boolean requiresTopUp() {
        return interestShortfall > 0;
    }
}
