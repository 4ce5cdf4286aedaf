package com.flagship.lending_ledger.admin.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

@Value
@Builder
@Jacksonized
public class UpdateSettingRequest {

    @NotNull(message = "Value is required")
    @JsonProperty("value")
    BigDecimal value;
}
