package com.flagship.casino_ledger.api;

import com.flagship.casino_ledger.ledger.GameSource;
import com.flagship.casino_ledger.stats.GameStats;
import com.flagship.casino_ledger.stats.StatsService;
import com.flagship.casino_ledger.stats.WrappedStats;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/guilds/{guildId}/players/{userId}/stats")
@RequiredArgsConstructor
public class StatsController {

    private final StatsService statsService;

    @GetMapping
    public List<GameStats> getAllStats(@PathVariable String guildId, @PathVariable String userId) {
        return statsService.getAllStats(userId, guildId);
    }

    @GetMapping("/wrapped")
    public WrappedStats getWrapped(@PathVariable String guildId, @PathVariable String userId) {
        return statsService.getWrappedStats(userId, guildId);
    }

    /**
     * @param game persisted game name, e.g. {@code ride_the_bus}
     */
    @GetMapping("/{game}")
    public ResponseEntity<GameStats> getStats(@PathVariable String guildId, @PathVariable String userId,
                                              @PathVariable String game) {
        return statsService.getStats(userId, guildId, GameSource.fromDbValue(game))
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }
}
