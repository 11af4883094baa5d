package com.flagship.casino_ledger.game.deck;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.random.RandomGenerator;

/**
 * A single 52-card deck. Cards are drawn from the end of the list; an empty
 * deck is replaced by a freshly shuffled one.
 *
 * The remaining cards can be exported and restored, which is how a card game
 * keeps its deck in the session snapshot between rounds.
 */
public final class Deck {

    private final List<Card> cards;
    private final RandomGenerator random;

    private Deck(List<Card> cards, RandomGenerator random) {
        this.cards = cards;
        this.random = random;
    }

    public static Deck shuffled(RandomGenerator random) {
        List<Card> cards = standardCards();
        shuffle(cards, random);
        return new Deck(cards, random);
    }

    /**
     * Rebuilds a deck from its remaining cards; the last card is drawn first.
     */
    public static Deck restore(List<Card> remaining, RandomGenerator random) {
        return new Deck(new ArrayList<>(remaining), random);
    }

    public static List<Card> standardCards() {
        List<Card> cards = new ArrayList<>(52);
        for (Suit suit : Suit.values()) {
            for (int rank = 2; rank <= Card.ACE; rank++) {
                cards.add(Card.of(rank, suit));
            }
        }
        return cards;
    }

    /**
     * In-place Fisher-Yates shuffle.
     */
    public static <T> void shuffle(List<T> items, RandomGenerator random) {
        for (int i = items.size() - 1; i > 0; i--) {
            int j = random.nextInt(i + 1);
            Collections.swap(items, i, j);
        }
    }

    public Card draw() {
        if (cards.isEmpty()) {
            List<Card> fresh = standardCards();
            shuffle(fresh, random);
            cards.addAll(fresh);
        }
        return cards.remove(cards.size() - 1);
    }

    public int remaining() {
        return cards.size();
    }

    public List<Card> remainingCards() {
        return List.copyOf(cards);
    }
}
