package org.shygy.blackjack.model;

import lombok.Getter;
import org.shygy.blackjack.model.rules.HandRules;

import java.util.ArrayList;
import java.util.List;

/** Main d'une partie (joueur, main issue d'un split, ou croupier). Les totaux sont toujours recalculés. */
@Getter
public class Hand {
    private final List<Card> cards = new ArrayList<>();

    public void add(Card c) {
        cards.add(c);
    }

    public int value() {
        return HandRules.value(cards);
    }

    public boolean isBust() {
        return HandRules.isBust(cards);
    }

    public boolean isBlackjack() {
        return HandRules.isBlackjack(cards);
    }

    public int size() {
        return cards.size();
    }

    @Override
    public String toString() {
        return cards + " (" + value() + ")";
    }
}
