package com.flagship.lending_ledger.rate;

/**
 * Source of current market rates for collateral valuation.
 */
public interface RateOracle {

    /**
     * Returns rates no older than the configured freshness window.
     *
     * @throws com.flagship.lending_ledger.loan.exception.LendingException with
     *         RATE_UNAVAILABLE when no fresh rate exists
     */
    MarketRates currentRates();
}
