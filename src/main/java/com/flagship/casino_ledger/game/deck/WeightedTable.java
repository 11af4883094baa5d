package com.flagship.casino_ledger.game.deck;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.random.RandomGenerator;

/**
 * Draws items with probability proportional to their integer weight.
 */
public final class WeightedTable<T> {

    private final List<T> items;
    private final List<Integer> weights;
    private final int totalWeight;

    private WeightedTable(List<T> items, List<Integer> weights) {
        this.items = Collections.unmodifiableList(items);
        this.weights = Collections.unmodifiableList(weights);
        this.totalWeight = weights.stream().mapToInt(Integer::intValue).sum();
    }

    public static <T> Builder<T> builder() {
        return new Builder<>();
    }

    public T draw(RandomGenerator random) {
        int roll = random.nextInt(totalWeight);
        for (int i = 0; i < items.size(); i++) {
            roll -= weights.get(i);
            if (roll < 0) {
                return items.get(i);
            }
        }
        // unreachable while totalWeight is the sum of weights
        return items.get(items.size() - 1);
    }

    public int totalWeight() {
        return totalWeight;
    }

    public int weightOf(T item) {
        int index = items.indexOf(item);
        return index < 0 ? 0 : weights.get(index);
    }

    public static final class Builder<T> {
        private final List<T> items = new ArrayList<>();
        private final List<Integer> weights = new ArrayList<>();

        public Builder<T> add(T item, int weight) {
            if (weight <= 0) {
                throw new IllegalArgumentException("Weight must be positive for " + item);
            }
            items.add(item);
            weights.add(weight);
            return this;
        }

        public WeightedTable<T> build() {
            if (items.isEmpty()) {
                throw new IllegalStateException("A weighted table needs at least one item");
            }
            return new WeightedTable<>(new ArrayList<>(items), new ArrayList<>(weights));
        }
    }
}
