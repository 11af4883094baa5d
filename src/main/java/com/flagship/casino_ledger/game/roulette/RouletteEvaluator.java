package com.flagship.casino_ledger.game.roulette;

import com.flagship.casino_ledger.common.InvalidWagerException;

import java.util.List;
import java.util.random.RandomGenerator;
import java.util.stream.Collectors;

public final class RouletteEvaluator {

    private RouletteEvaluator() {
    }

    public static Pocket spin(RandomGenerator random) {
        return Pocket.of(random.nextInt(Pocket.POCKETS));
    }

    /**
     * Settles every bet on its own against the winning pocket.
     */
    public static List<BetResult> evaluate(List<RouletteBet> bets, Pocket result) {
        return bets.stream()
                .map(bet -> evaluate(bet, result))
                .collect(Collectors.toList());
    }

    public static BetResult evaluate(RouletteBet bet, Pocket result) {
        boolean won = bet.covers(result);
        long payout = won ? bet.getAmount() + bet.getAmount() * bet.getPayoutRatio() : 0;
        return new BetResult(bet, won, payout);
    }

    /**
     * Checks a new bet against the chips already on the table.
     *
     * @return the bet with its selection normalised
     * @throws InvalidWagerException if the bet cannot be added
     */
    public static RouletteBet admit(RouletteTable table, RouletteBetType type, String selection,
                                    long amount, int maxBets) {
        if (type == null) {
            throw new InvalidWagerException("A bet type is required");
        }
        if (table.getBets().size() >= maxBets) {
            throw new InvalidWagerException("A spin takes at most " + maxBets + " bets");
        }

        if (type.isOutside()) {
            boolean duplicate = table.getBets().stream().anyMatch(bet -> bet.getType() == type);
            if (duplicate) {
                throw new InvalidWagerException("There is already a " + type.name().toLowerCase() + " bet on the table");
            }
            return RouletteBet.place(type, null, amount);
        }

        Pocket pocket;
        try {
            pocket = Pocket.parse(selection);
        } catch (IllegalArgumentException e) {
            throw new InvalidWagerException(e.getMessage());
        }
        String label = pocket.label();
        boolean duplicate = table.getBets().stream()
                .anyMatch(bet -> bet.getType() == RouletteBetType.STRAIGHT && label.equals(bet.getSelection()));
        if (duplicate) {
            throw new InvalidWagerException("Number " + label + " already has a bet on it");
        }
        return RouletteBet.place(type, label, amount);
    }
}
