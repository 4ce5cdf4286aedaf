package com.flagship.lending_ledger.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.lending_ledger.account.AccountBalances;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class AccountBalancesResponse {

    @JsonProperty("account_id")
    UUID accountId;

    @JsonProperty("available_crypto")
    long availableCrypto;

    @JsonProperty("collateral_crypto")
    long collateralCrypto;

    @JsonProperty("available_base")
    long availableBase;

    @JsonProperty("borrowed_base")
    long borrowedBase;

    @JsonProperty("interest_accrued_base")
    long interestAccruedBase;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static AccountBalancesResponse from(AccountBalances balances) {
        return AccountBalancesResponse.builder()
            .accountId(balances.getAccountId())
            .availableCrypto(balances.getAvailableCrypto())
            .collateralCrypto(balances.getCollateralCrypto())
            .availableBase(balances.getAvailableBase())
            .borrowedBase(balances.getBorrowedBase())
            .interestAccruedBase(balances.getInterestAccruedBase())
            .updatedAt(balances.getUpdatedAt())
            .build();
    }
}
