package com.flagship.casino_ledger.game.blackjack;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.flagship.casino_ledger.game.deck.Card;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything needed to continue a blackjack round, stored as the session
 * snapshot between player actions. The undealt deck is part of it, so a
 * round resumes with exactly the cards it was dealt from.
 */
@Data
@NoArgsConstructor
public class BlackjackTable {
    private long baseBet;
    private List<BlackjackHand> hands = new ArrayList<>();
    private List<Card> dealerCards = new ArrayList<>();
    private List<Card> deck = new ArrayList<>();
    private int activeHand;
    private TablePhase phase = TablePhase.PLAYER_TURN;

    @JsonIgnore
    public BlackjackHand currentHand() {
        if (phase != TablePhase.PLAYER_TURN || activeHand >= hands.size()) {
            throw new IllegalStateException("No hand is waiting for a decision");
        }
        return hands.get(activeHand);
    }

    @JsonIgnore
    public Card dealerUpCard() {
        return dealerCards.get(0);
    }

    @JsonIgnore
    public boolean isSplit() {
        return hands.size() > 1;
    }

    /** Coins currently on the table across all hands. */
    @JsonIgnore
    public long totalWagered() {
        return hands.stream().mapToLong(BlackjackHand::getBet).sum();
    }
}
