package com.flagship.casino_ledger.game.blackjack;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.flagship.casino_ledger.game.deck.Card;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One player hand inside a table snapshot.
 */
@Data
@NoArgsConstructor
public class BlackjackHand {
    private List<Card> cards = new ArrayList<>();
    private long bet;
    private boolean doubled;
    private boolean finished;
    private boolean fromSplit;

    public BlackjackHand(long bet, boolean fromSplit, Card... cards) {
        this.bet = bet;
        this.fromSplit = fromSplit;
        this.cards.addAll(List.of(cards));
    }

    @JsonIgnore
    public int getValue() {
        return BlackjackRules.handValue(cards);
    }

    @JsonIgnore
    public boolean isBust() {
        return BlackjackRules.isBust(cards);
    }

    @JsonIgnore
    public boolean isSoft() {
        return BlackjackRules.isSoft(cards);
    }

    /** A split hand that reaches 21 with two cards is an ordinary 21. */
    @JsonIgnore
    public boolean isNatural() {
        return !fromSplit && BlackjackRules.isTwoCardTwentyOne(cards);
    }

    @JsonIgnore
    public boolean canDouble() {
        return !finished && !doubled && cards.size() == 2;
    }

    void add(Card card) {
        cards.add(card);
    }
}
