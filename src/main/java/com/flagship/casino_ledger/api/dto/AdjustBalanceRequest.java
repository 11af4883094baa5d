package com.flagship.casino_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Manual correction by a guild administrator. The amount may be negative.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AdjustBalanceRequest {

    @JsonProperty("amount")
    private long amount;

    @NotBlank(message = "Reason is required")
    @JsonProperty("reason")
    private String reason;
}
