package org.shygy.blackjack.model.rules;

import org.shygy.blackjack.model.Card;
import org.shygy.blackjack.model.PlayerHand;
import org.shygy.blackjack.model.RoundState;

public final class DealingRules {
    private DealingRules(){}

    /** Joueur, croupier, joueur, croupier. */
    public static void dealInitial(RoundState r) {
        PlayerHand player = r.getHands().get(0);
        player.getCards().clear();
        r.getDealer().getCards().clear();
        for (int i = 0; i < 2; i++) {
            player.add(r.getShoe().draw());
            r.getDealer().add(r.getShoe().draw());
        }
    }

    /** Sépare la paire en deux mains d'une carte chacune, puis complète la première puis la seconde. */
    public static void split(RoundState r) {
        PlayerHand original = r.getHands().get(0);
        Card second = original.getCards().remove(1);

        PlayerHand other = new PlayerHand(original.getBet());
        other.add(second);
        original.setSplit(true);
        other.setSplit(true);
        r.addSplitHand(other);

        original.add(r.getShoe().draw());
        other.add(r.getShoe().draw());
    }
}
