package com.flagship.casino_ledger.stats;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Named integer counters a game keeps next to its standard stats
 * (for example {@code double_down_wins} or {@code wheel_red}).
 *
 * Counters only ever add up: merging two sets sums the values key by key,
 * which is also how the database merges them on conflict.
 */
public final class ExtraCounters {

    private static final ExtraCounters EMPTY = new ExtraCounters(Map.of());

    private final Map<String, Integer> counts;

    private ExtraCounters(Map<String, Integer> counts) {
        this.counts = Collections.unmodifiableMap(new TreeMap<>(counts));
    }

    public static ExtraCounters empty() {
        return EMPTY;
    }

    public static ExtraCounters of(String key) {
        return EMPTY.plus(key, 1);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static ExtraCounters fromMap(Map<String, Integer> counts) {
        if (counts == null || counts.isEmpty()) {
            return EMPTY;
        }
        counts.forEach((key, value) -> requireKey(key));
        return new ExtraCounters(counts);
    }

    public ExtraCounters plus(String key) {
        return plus(key, 1);
    }

    public ExtraCounters plus(String key, int amount) {
        requireKey(key);
        Map<String, Integer> next = new TreeMap<>(counts);
        next.merge(key, amount, Integer::sum);
        return new ExtraCounters(next);
    }

    public ExtraCounters merge(ExtraCounters other) {
        if (other == null || other.isEmpty()) {
            return this;
        }
        Map<String, Integer> next = new TreeMap<>(counts);
        other.counts.forEach((key, value) -> next.merge(key, value, Integer::sum));
        return new ExtraCounters(next);
    }

    public int get(String key) {
        return counts.getOrDefault(key, 0);
    }

    public boolean isEmpty() {
        return counts.isEmpty();
    }

    @JsonValue
    public Map<String, Integer> asMap() {
        return counts;
    }

    private static void requireKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Counter name must not be blank");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ExtraCounters)) {
            return false;
        }
        return counts.equals(((ExtraCounters) o).counts);
    }

    @Override
    public int hashCode() {
        return Objects.hash(counts);
    }

    @Override
    public String toString() {
        return counts.toString();
    }
}
