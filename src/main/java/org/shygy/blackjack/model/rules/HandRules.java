package org.shygy.blackjack.model.rules;

import org.shygy.blackjack.model.Card;

import java.util.List;

public final class HandRules {
    public static final int BLACKJACK = 21;

    private HandRules(){}

    public static int points(Card c) {
        return switch (c.getRank()) {
            case TWO -> 2; case THREE -> 3; case FOUR -> 4; case FIVE -> 5; case SIX -> 6;
            case SEVEN -> 7; case EIGHT -> 8; case NINE -> 9; case TEN, JACK, QUEEN, KING -> 10;
            case ACE -> 11;
        };
    }

    /** Meilleur total ≤ 21 si possible, sinon le plus petit total (tous les As à 1). */
    public static int value(Iterable<Card> cards) {
        int sum = 0, aces = 0;
        for (Card c : cards) {
            sum += points(c);
            if (c.getRank() == Card.Rank.ACE) aces++;
        }
        while (sum > BLACKJACK && aces-- > 0) sum -= 10;
        return sum;
    }

    /** Au moins un As compte encore 11. */
    public static boolean isSoft(Iterable<Card> cards) {
        int hard = 0;
        boolean ace = false;
        for (Card c : cards) {
            if (c.getRank() == Card.Rank.ACE) { hard += 1; ace = true; }
            else hard += points(c);
        }
        return ace && hard + 10 <= BLACKJACK;
    }

    public static boolean isBlackjack(List<Card> cards) {
        return cards.size() == 2 && value(cards) == BLACKJACK;
    }

    public static boolean isBust(Iterable<Card> cards) {
        return value(cards) > BLACKJACK;
    }

    /** Deux cartes de même rang (un roi et une dame ne forment pas une paire). */
    public static boolean isPair(List<Card> cards) {
        return cards.size() == 2 && cards.get(0).getRank() == cards.get(1).getRank();
    }
}
