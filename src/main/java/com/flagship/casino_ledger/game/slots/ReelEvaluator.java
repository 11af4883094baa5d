package com.flagship.casino_ledger.game.slots;

import com.flagship.casino_ledger.game.deck.WeightedTable;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.random.RandomGenerator;

/**
 * Three-reel evaluation.
 *
 * Paylines are checked in a fixed priority: a hog triple is the jackpot, tree
 * and snowflake triples grant a bonus spin, any other triple pays flat, two
 * hogs pay more than any other pair.
 */
public final class ReelEvaluator {

    public static final int REELS = 3;

    static final BigDecimal JACKPOT_MULTIPLIER = BigDecimal.valueOf(20);
    static final BigDecimal TREE_MULTIPLIER = BigDecimal.valueOf(8);
    static final BigDecimal SNOWFLAKE_MULTIPLIER = BigDecimal.valueOf(6);
    static final BigDecimal TRIPLE_MULTIPLIER = BigDecimal.TEN;
    static final BigDecimal HOG_PAIR_MULTIPLIER = BigDecimal.valueOf(5);
    static final BigDecimal PAIR_MULTIPLIER = BigDecimal.valueOf(2);

    private static final WeightedTable<SlotSymbol> REEL = buildReel();

    private ReelEvaluator() {
    }

    public static List<SlotSymbol> spin(RandomGenerator random) {
        return List.of(REEL.draw(random), REEL.draw(random), REEL.draw(random));
    }

    /**
     * Scores a line of symbols.
     *
     * @param pool the jackpot pool the player would collect on a hog triple;
     *             pass zero where the pool cannot be won
     */
    public static ReelResult evaluate(List<SlotSymbol> symbols, long bet, long pool) {
        if (symbols.size() != REELS) {
            throw new IllegalArgumentException("Expected " + REELS + " symbols, got " + symbols.size());
        }

        Map<SlotSymbol, Integer> counts = new EnumMap<>(SlotSymbol.class);
        for (SlotSymbol symbol : symbols) {
            counts.merge(symbol, 1, Integer::sum);
        }

        SlotSymbol triple = null;
        boolean pair = false;
        for (Map.Entry<SlotSymbol, Integer> entry : counts.entrySet()) {
            if (entry.getValue() == 3) {
                triple = entry.getKey();
            } else if (entry.getValue() == 2) {
                pair = true;
            }
        }

        if (triple == SlotSymbol.HOG) {
            return result(symbols, bet, JACKPOT_MULTIPLIER, true, false, pool);
        }
        if (triple == SlotSymbol.TREE) {
            return result(symbols, bet, TREE_MULTIPLIER, false, true, 0);
        }
        if (triple == SlotSymbol.SNOWFLAKE) {
            return result(symbols, bet, SNOWFLAKE_MULTIPLIER, false, true, 0);
        }
        if (triple != null) {
            return result(symbols, bet, TRIPLE_MULTIPLIER, false, false, 0);
        }
        if (counts.getOrDefault(SlotSymbol.HOG, 0) == 2) {
            return result(symbols, bet, HOG_PAIR_MULTIPLIER, false, false, 0);
        }
        if (pair) {
            return result(symbols, bet, PAIR_MULTIPLIER, false, false, 0);
        }
        return new ReelResult(List.copyOf(symbols), BigDecimal.ZERO, false, false, 0);
    }

    private static ReelResult result(List<SlotSymbol> symbols, long bet, BigDecimal multiplier,
                                     boolean jackpot, boolean bonus, long pool) {
        long payout = BigDecimal.valueOf(bet).multiply(multiplier).longValueExact() + pool;
        return new ReelResult(List.copyOf(symbols), multiplier, jackpot, bonus, payout);
    }

    private static WeightedTable<SlotSymbol> buildReel() {
        WeightedTable.Builder<SlotSymbol> builder = WeightedTable.builder();
        for (SlotSymbol symbol : SlotSymbol.values()) {
            builder.add(symbol, symbol.weight());
        }
        return builder.build();
    }
}
