package com.flagship.casino_ledger.game;

import com.flagship.casino_ledger.ledger.GameSource;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Set;

/**
 * What a game engine hands back once a wager is decided. Every engine produces
 * this same shape and {@link OutcomeSettler} consumes it the same way.
 *
 * {@code multiplier} is the total-return multiple of the wager (2 for an even
 * money win, 2.5 for a natural), and {@code payout} is the number of coins
 * returned to the player, stake included.
 */
@Value
@Builder(toBuilder = true)
public class GameOutcome {
    GameSource source;
    OutcomeKind kind;
    long wager;
    BigDecimal multiplier;
    long payout;
    @Singular
    Set<BonusFlag> bonusFlags;

    public static GameOutcome win(GameSource source, long wager, BigDecimal multiplier) {
        long payout = BigDecimal.valueOf(wager).multiply(multiplier).setScale(0, RoundingMode.FLOOR).longValueExact();
        return win(source, wager, multiplier, payout);
    }

    public static GameOutcome win(GameSource source, long wager, BigDecimal multiplier, long payout) {
        if (payout <= 0) {
            throw new IllegalArgumentException("A win must return coins, got payout " + payout);
        }
        return GameOutcome.builder()
                .source(source)
                .kind(OutcomeKind.WIN)
                .wager(wager)
                .multiplier(multiplier)
                .payout(payout)
                .build();
    }

    public static GameOutcome loss(GameSource source, long wager) {
        return GameOutcome.builder()
                .source(source)
                .kind(OutcomeKind.LOSS)
                .wager(wager)
                .multiplier(BigDecimal.ZERO)
                .payout(0)
                .build();
    }

    /** Stake returned untouched. */
    public static GameOutcome push(GameSource source, long wager) {
        return GameOutcome.builder()
                .source(source)
                .kind(OutcomeKind.PUSH)
                .wager(wager)
                .multiplier(BigDecimal.ONE)
                .payout(wager)
                .build();
    }

    public GameOutcome withFlag(BonusFlag flag) {
        return toBuilder().bonusFlag(flag).build();
    }

    public boolean has(BonusFlag flag) {
        return bonusFlags.contains(flag);
    }

    public boolean isWin() {
        return kind == OutcomeKind.WIN;
    }

    public long net() {
        return payout - wager;
    }
}
