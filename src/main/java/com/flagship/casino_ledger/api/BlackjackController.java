package com.flagship.casino_ledger.api;

import com.flagship.casino_ledger.api.dto.WagerRequest;
import com.flagship.casino_ledger.game.blackjack.BlackjackRound;
import com.flagship.casino_ledger.game.blackjack.BlackjackService;
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
@RequestMapping("/api/guilds/{guildId}/players/{userId}/blackjack")
@RequiredArgsConstructor
public class BlackjackController {

    private final BlackjackService blackjackService;

    @PostMapping
    public ResponseEntity<BlackjackRound> deal(@PathVariable String guildId, @PathVariable String userId,
                                               @Valid @RequestBody WagerRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(blackjackService.start(userId, guildId, request.getBet()));
    }

    @GetMapping
    public ResponseEntity<BlackjackRound> getTable(@PathVariable String guildId, @PathVariable String userId) {
        return blackjackService.getTable(userId, guildId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/hit")
    public BlackjackRound hit(@PathVariable String guildId, @PathVariable String userId) {
        return blackjackService.hit(userId, guildId);
    }

    @PostMapping("/stand")
    public BlackjackRound stand(@PathVariable String guildId, @PathVariable String userId) {
        return blackjackService.stand(userId, guildId);
    }

    @PostMapping("/double")
    public BlackjackRound doubleDown(@PathVariable String guildId, @PathVariable String userId) {
        return blackjackService.doubleDown(userId, guildId);
    }

    @PostMapping("/split")
    public BlackjackRound split(@PathVariable String guildId, @PathVariable String userId) {
        return blackjackService.split(userId, guildId);
    }
}
