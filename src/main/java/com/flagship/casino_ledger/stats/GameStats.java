package com.flagship.casino_ledger.stats;

import com.flagship.casino_ledger.ledger.GameSource;
import lombok.Value;

/**
 * Running totals of one player in one game.
 */
@Value
public class GameStats {
    String userId;
    String guildId;
    GameSource source;
    int gamesPlayed;
    int gamesWon;
    int gamesLost;
    int currentWinStreak;
    int currentLosingStreak;
    int bestWinStreak;
    int worstLosingStreak;
    long highestBet;
    long highestPayout;
    long highestLoss;
    ExtraCounters extraStats;
}
