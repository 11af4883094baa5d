package com.flagship.casino_ledger.game.blackjack;

import com.flagship.casino_ledger.game.GameOutcome;
import com.flagship.casino_ledger.game.deck.Card;
import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * What the player gets to see after an action. The dealer's hole card stays
 * hidden until the round is resolved, and the deck is never exposed.
 */
@Value
public class BlackjackRound {
    static final String HIDDEN_CARD = "??";

    List<HandView> hands;
    int activeHand;
    List<String> dealerCards;
    Integer dealerValue;
    TablePhase phase;
    boolean canDouble;
    boolean canSplit;
    List<GameOutcome> outcomes;
    long balance;

    public static BlackjackRound of(BlackjackTable table, List<GameOutcome> outcomes, long balance) {
        boolean resolved = table.getPhase() == TablePhase.RESOLVED;
        List<String> dealer = resolved
                ? labels(table.getDealerCards())
                : List.of(table.dealerUpCard().label(), HIDDEN_CARD);

        boolean playing = !resolved && table.getActiveHand() < table.getHands().size();
        return new BlackjackRound(
                table.getHands().stream().map(HandView::of).collect(Collectors.toList()),
                table.getActiveHand(),
                dealer,
                resolved ? BlackjackRules.handValue(table.getDealerCards()) : null,
                table.getPhase(),
                playing && table.currentHand().canDouble(),
                playing && BlackjackEngine.canSplit(table),
                List.copyOf(outcomes),
                balance
        );
    }

    private static List<String> labels(List<Card> cards) {
        return cards.stream().map(Card::label).collect(Collectors.toList());
    }

    @Value
    public static class HandView {
        List<String> cards;
        int value;
        boolean soft;
        long bet;
        boolean doubled;
        boolean finished;

        static HandView of(BlackjackHand hand) {
            return new HandView(labels(hand.getCards()), hand.getValue(), hand.isSoft(),
                    hand.getBet(), hand.isDoubled(), hand.isFinished());
        }
    }
}
