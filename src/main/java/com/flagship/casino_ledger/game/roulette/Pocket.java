package com.flagship.casino_ledger.game.roulette;

import lombok.Value;

import java.util.Set;

/**
 * One of the 38 pockets of an American wheel. Index 0 is "0", index 37 is
 * "00", every other index is its own number.
 */
@Value
public class Pocket {
    public static final int POCKETS = 38;
    public static final int DOUBLE_ZERO_INDEX = 37;
    public static final String DOUBLE_ZERO = "00";

    private static final Set<Integer> RED_NUMBERS = Set.of(
            1, 3, 5, 7, 9, 12, 14, 16, 18, 19, 21, 23, 25, 27, 30, 32, 34, 36);

    int index;

    public static Pocket of(int index) {
        if (index < 0 || index >= POCKETS) {
            throw new IllegalArgumentException("No pocket " + index + " on an American wheel");
        }
        return new Pocket(index);
    }

    /**
     * Parses a pocket label ("0".."36" or "00").
     */
    public static Pocket parse(String label) {
        if (label == null) {
            throw new IllegalArgumentException("A pocket label is required");
        }
        String trimmed = label.trim();
        if (DOUBLE_ZERO.equals(trimmed)) {
            return of(DOUBLE_ZERO_INDEX);
        }
        int number;
        try {
            number = Integer.parseInt(trimmed);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a roulette number: " + label, e);
        }
        if (number < 0 || number > 36) {
            throw new IllegalArgumentException("Roulette numbers run from 0 to 36 plus 00, got " + label);
        }
        return of(number);
    }

    public boolean isGreen() {
        return index == 0 || index == DOUBLE_ZERO_INDEX;
    }

    /** The number 1..36, or 0 for either green pocket. */
    public int number() {
        return isGreen() ? 0 : index;
    }

    public PocketColor color() {
        if (isGreen()) {
            return PocketColor.GREEN;
        }
        return RED_NUMBERS.contains(index) ? PocketColor.RED : PocketColor.BLACK;
    }

    public String label() {
        return index == DOUBLE_ZERO_INDEX ? DOUBLE_ZERO : Integer.toString(index);
    }

    @Override
    public String toString() {
        return label() + " " + color().name().toLowerCase();
    }
}
