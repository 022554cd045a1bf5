package org.shygy.blackjack.model;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;

@Getter
@EqualsAndHashCode
@AllArgsConstructor
public class Card {
    private final Rank rank;
    private final Suit suit;

    @Override
    public String toString() {
        return rank.getLabel() + "-" + suit.getLabel();
    }

    @Getter
    @AllArgsConstructor
    public enum Suit {
        HEARTS("Hearts"), DIAMONDS("Diamonds"), CLUBS("Clubs"), SPADES("Spades");

        private final String label;
    }

    @Getter
    @AllArgsConstructor
    public enum Rank {
        TWO("2"), THREE("3"), FOUR("4"), FIVE("5"), SIX("6"), SEVEN("7"), EIGHT("8"),
        NINE("9"), TEN("10"), JACK("J"), QUEEN("Q"), KING("K"), ACE("A");

        private final String label;
    }
}
