package com.flagship.lending_ledger.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.lending_ledger.account.AssetType;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Value;

@Value
public class FundAccountRequest {

    @NotNull(message = "Asset is required")
    @JsonProperty("asset")
    AssetType asset;

    @NotNull(message = "Amount is required")
    @Positive(message = "Amount must be greater than 0")
    @JsonProperty("amount")
    Long amount;
}
