package com.flagship.casino_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.casino_ledger.game.roulette.RouletteBetType;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RouletteBetRequest {

    @NotNull(message = "Bet type is required")
    @JsonProperty("type")
    private RouletteBetType type;

    /** Pocket for a straight bet: "0" to "36" or "00". */
    @JsonProperty("selection")
    private String selection;

    @Min(value = 1, message = "Amount must be a positive number of coins")
    @JsonProperty("amount")
    private long amount;
}
