package org.shygy.blackjack.model.rules;

import org.shygy.blackjack.model.Hand;
import org.shygy.blackjack.model.Outcome;
import org.shygy.blackjack.model.PlayerHand;

import java.util.Optional;

public final class PayoutRules {
    private PayoutRules(){}

    /**
     * Variation nette du solde pour une mise réglée.
     * Le blackjack paie 3:2 tronqué : {@code bet * 3 / 2} (mise 11 → 16).
     */
    public static long settle(Outcome outcome, long bet) {
        if (bet <= 0) return 0;
        return switch (outcome) {
            case BLACKJACK -> (bet * 3) / 2;
            case WIN, INSURANCE_WON -> bet;
            case PUSH -> 0;
            case LOSE, BUST, INSURANCE_LOST -> -bet;
        };
    }

    /** Montant rendu au solde, la mise ayant déjà été débitée. */
    public static long credit(Outcome outcome, long bet) {
        if (bet <= 0) return 0;
        return bet + settle(outcome, bet);
    }

    /** Contrôle des blackjacks naturels juste après la distribution. */
    public static Optional<Outcome> natural(Hand player, Hand dealer) {
        boolean pBJ = player.isBlackjack(), dBJ = dealer.isBlackjack();
        if (pBJ && dBJ) return Optional.of(Outcome.PUSH);
        if (pBJ) return Optional.of(Outcome.BLACKJACK);
        if (dBJ) return Optional.of(Outcome.LOSE);
        return Optional.empty();
    }

    /** Règlement d'une main face au total final du croupier. */
    public static Outcome compare(PlayerHand player, Hand dealer) {
        if (player.isBust()) return Outcome.BUST;
        int pt = player.value(), dt = dealer.value();
        if (dealer.isBust() || pt > dt) return Outcome.WIN;
        if (pt == dt) return Outcome.PUSH;
        return Outcome.LOSE;
    }
}
