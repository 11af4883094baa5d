package com.flagship.casino_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.casino_ledger.game.ridethebus.Guess;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class GuessRequest {

    @NotNull(message = "Guess is required")
    @JsonProperty("guess")
    private Guess guess;
}
