package com.flagship.casino_ledger.game.roulette;

import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Bets the table accepts. The ratio is paid on top of the returned stake.
 * Green pockets lose every outside bet.
 */
public enum RouletteBetType {
    STRAIGHT(35, pocket -> false),
    RED(1, pocket -> pocket.color() == PocketColor.RED),
    BLACK(1, pocket -> pocket.color() == PocketColor.BLACK),
    ODD(1, pocket -> !pocket.isGreen() && pocket.number() % 2 == 1),
    EVEN(1, pocket -> !pocket.isGreen() && pocket.number() % 2 == 0),
    LOW(1, pocket -> !pocket.isGreen() && pocket.number() <= 18),
    HIGH(1, pocket -> !pocket.isGreen() && pocket.number() >= 19);

    private final int payoutRatio;
    private final Predicate<Pocket> outsideCovers;

    RouletteBetType(int payoutRatio, Predicate<Pocket> outsideCovers) {
        this.payoutRatio = payoutRatio;
        this.outsideCovers = outsideCovers;
    }

    public int payoutRatio() {
        return payoutRatio;
    }

    public boolean isOutside() {
        return this != STRAIGHT;
    }

    /**
     * Labels of every pocket the bet wins on, in wheel index order.
     *
     * @param selection the chosen pocket for a straight bet, ignored otherwise
     */
    public List<String> coveredPockets(Pocket selection) {
        if (this == STRAIGHT) {
            if (selection == null) {
                throw new IllegalArgumentException("A straight bet needs a pocket");
            }
            return List.of(selection.label());
        }
        return IntStream.range(0, Pocket.POCKETS)
                .mapToObj(Pocket::of)
                .filter(outsideCovers)
                .map(Pocket::label)
                .collect(Collectors.toUnmodifiableList());
    }

    public String statKey() {
        return "bet_" + name().toLowerCase();
    }
}
