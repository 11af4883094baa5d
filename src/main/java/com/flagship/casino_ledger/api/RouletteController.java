package com.flagship.casino_ledger.api;

import com.flagship.casino_ledger.api.dto.RouletteBetRequest;
import com.flagship.casino_ledger.game.roulette.RouletteService;
import com.flagship.casino_ledger.game.roulette.RouletteSpinResult;
import com.flagship.casino_ledger.game.roulette.RouletteView;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/guilds/{guildId}/players/{userId}/roulette")
@RequiredArgsConstructor
public class RouletteController {

    private final RouletteService rouletteService;

    @PostMapping
    public ResponseEntity<RouletteView> open(@PathVariable String guildId, @PathVariable String userId) {
        return ResponseEntity.status(HttpStatus.CREATED).body(rouletteService.openTable(userId, guildId));
    }

    @GetMapping
    public ResponseEntity<RouletteView> getTable(@PathVariable String guildId, @PathVariable String userId) {
        return rouletteService.getTable(userId, guildId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/bets")
    public RouletteView placeBet(@PathVariable String guildId, @PathVariable String userId,
                                 @Valid @RequestBody RouletteBetRequest request) {
        return rouletteService.placeBet(userId, guildId, request.getType(), request.getSelection(),
                request.getAmount());
    }

    @DeleteMapping("/bets")
    public RouletteView clearBets(@PathVariable String guildId, @PathVariable String userId) {
        return rouletteService.clearBets(userId, guildId);
    }

    @PostMapping("/spin")
    public RouletteSpinResult spin(@PathVariable String guildId, @PathVariable String userId) {
        return rouletteService.spin(userId, guildId);
    }

    @DeleteMapping
    public Map<String, Long> cancel(@PathVariable String guildId, @PathVariable String userId) {
        return Map.of("balance", rouletteService.cancel(userId, guildId));
    }
}
