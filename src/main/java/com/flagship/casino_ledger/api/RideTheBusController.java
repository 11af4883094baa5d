package com.flagship.casino_ledger.api;

import com.flagship.casino_ledger.api.dto.GuessRequest;
import com.flagship.casino_ledger.api.dto.WagerRequest;
import com.flagship.casino_ledger.game.ridethebus.RideTheBusService;
import com.flagship.casino_ledger.game.ridethebus.RideTheBusView;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/guilds/{guildId}/players/{userId}/ride-the-bus")
@RequiredArgsConstructor
public class RideTheBusController {

    private final RideTheBusService rideTheBusService;

    @PostMapping
    public ResponseEntity<RideTheBusView> start(@PathVariable String guildId, @PathVariable String userId,
                                                @Valid @RequestBody WagerRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(rideTheBusService.start(userId, guildId, request.getBet()));
    }

    @GetMapping
    public ResponseEntity<RideTheBusView> getGame(@PathVariable String guildId, @PathVariable String userId) {
        return rideTheBusService.getGame(userId, guildId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/guess")
    public RideTheBusView guess(@PathVariable String guildId, @PathVariable String userId,
                                @Valid @RequestBody GuessRequest request) {
        return rideTheBusService.guess(userId, guildId, request.getGuess());
    }

    @PostMapping("/cash-out")
    public RideTheBusView cashOut(@PathVariable String guildId, @PathVariable String userId) {
        return rideTheBusService.cashOut(userId, guildId);
    }
}
