package org.shygy.blackjack.dto;

import org.shygy.blackjack.model.RoundState;

import java.util.Set;

/**
 * Demande adressée à l'{@code InputProvider}. Valeurs copiées au moment de la demande :
 * l'état de la manche n'est jamais exposé.
 *
 * @param actions       actions proposées au point {@link DecisionPoint#ACTION}, vide sinon
 * @param bet           mise principale de la manche, 0 entre deux manches
 * @param insuranceCost coût de l'assurance proposée, 0 hors {@link DecisionPoint#INSURANCE}
 */
public record Prompt(DecisionPoint point, Set<PlayerAction> actions, long balance, long bet, long insuranceCost) {

    public Prompt {
        actions = Set.copyOf(actions);
    }

    public static Prompt of(DecisionPoint point, RoundState round) {
        long cost = point == DecisionPoint.INSURANCE ? round.getBet() / 2 : 0;
        return new Prompt(point, Set.of(), round.getBalance(), round.getBet(), cost);
    }

    public static Prompt action(RoundState round, Set<PlayerAction> actions) {
        return new Prompt(DecisionPoint.ACTION, actions, round.getBalance(), round.getBet(), 0);
    }

    public static Prompt between(DecisionPoint point, long balance) {
        return new Prompt(point, Set.of(), balance, 0, 0);
    }
}
