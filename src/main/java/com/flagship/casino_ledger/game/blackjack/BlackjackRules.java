package com.flagship.casino_ledger.game.blackjack;

import com.flagship.casino_ledger.game.deck.Card;

import java.util.List;

/**
 * Hand arithmetic shared by the player and the dealer.
 */
public final class BlackjackRules {

    public static final int BLACKJACK = 21;
    public static final int DEALER_STANDS_AT = 17;

    private BlackjackRules() {
    }

    /**
     * Best total not over 21 where possible: aces count 11 and are demoted to 1
     * one at a time while the hand is over 21.
     */
    public static int handValue(List<Card> cards) {
        return evaluate(cards)[0];
    }

    /** True when an ace is still counted as 11. */
    public static boolean isSoft(List<Card> cards) {
        int[] evaluated = evaluate(cards);
        return evaluated[1] > 0 && evaluated[0] <= BLACKJACK;
    }

    public static boolean isBust(List<Card> cards) {
        return handValue(cards) > BLACKJACK;
    }

    public static boolean isTwoCardTwentyOne(List<Card> cards) {
        return cards.size() == 2 && handValue(cards) == BLACKJACK;
    }

    /** The dealer only checks the hole card when the up-card could complete a natural. */
    public static boolean dealerPeeks(Card upCard) {
        return upCard.isAce() || upCard.isTenValue();
    }

    private static int[] evaluate(List<Card> cards) {
        int total = 0;
        int highAces = 0;
        for (Card card : cards) {
            total += card.blackjackValue();
            if (card.isAce()) {
                highAces++;
            }
        }
        while (total > BLACKJACK && highAces > 0) {
            total -= 10;
            highAces--;
        }
        return new int[] {total, highAces};
    }
}
