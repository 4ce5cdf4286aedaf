package com.flagship.lending_ledger.account;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Snapshot of an account's balance buckets.
 *
 * Crypto buckets are in 1/100,000,000 of a whole unit; base buckets in the base currency's minor unit.
 * borrowedBase and interestAccruedBase mirror the open loan's outstanding balance and charged interest.
 */
@Value
public class AccountBalances {
    UUID accountId;
    long availableCrypto;
    long collateralCrypto;
    long availableBase;
    long borrowedBase;
    long interestAccruedBase;
    Instant updatedAt;
}
