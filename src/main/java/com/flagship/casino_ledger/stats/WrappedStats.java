package com.flagship.casino_ledger.stats;

import com.flagship.casino_ledger.ledger.GameSource;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Cross-game rollup of a player's year in the casino.
 * Loans, begging and staff adjustments never count as winnings.
 */
@Value
@Builder
public class WrappedStats {
    int totalGamesPlayed;
    int totalGamesWon;
    int totalGamesLost;
    int bestWinStreak;
    int worstLosingStreak;
    long totalWagered;
    long totalWinnings;
    long netProfit;
    BigDecimal winRatePercent;
    GameSource favoriteGame;
    long biggestWin;
    long biggestLoss;
}
