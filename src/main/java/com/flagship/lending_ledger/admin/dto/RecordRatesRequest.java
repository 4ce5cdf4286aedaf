package com.flagship.lending_ledger.admin.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Value;

/**
 * A market rate observation in base units per whole crypto unit.
 */
@Value
public class RecordRatesRequest {

    @NotNull(message = "Buy rate is required")
    @Positive(message = "Buy rate must be greater than 0")
    @JsonProperty("buy_rate")
    Long buyRate;

    @NotNull(message = "Sell rate is required")
    @Positive(message = "Sell rate must be greater than 0")
    @JsonProperty("sell_rate")
    Long sellRate;
}
