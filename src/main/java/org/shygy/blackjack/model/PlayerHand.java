package org.shygy.blackjack.model;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class PlayerHand extends Hand {
    private long bet;
    private boolean doubled = false;
    private boolean standing = false;
    /** Main née d'un split : un 21 à deux cartes n'y est pas un blackjack naturel. */
    private boolean split = false;
    private HandResult result;

    public PlayerHand(long bet) {
        this.bet = bet;
    }

    /** Plus aucune décision possible sur cette main. */
    public boolean isDone() {
        return standing || isBust();
    }

    @Override
    public boolean isBlackjack() {
        return !split && super.isBlackjack();
    }

    public boolean isSettled() {
        return result != null;
    }
}
