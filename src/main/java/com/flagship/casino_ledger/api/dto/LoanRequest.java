package com.flagship.casino_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LoanRequest {

    @NotBlank(message = "Receiver is required")
    @JsonProperty("receiver_id")
    private String receiverId;

    @Min(value = 1, message = "Amount must be a positive number of coins")
    @JsonProperty("amount")
    private long amount;
}
