package org.shygy.blackjack.model;

public enum Outcome {
    BLACKJACK, WIN, PUSH, LOSE, BUST, INSURANCE_WON, INSURANCE_LOST
}
