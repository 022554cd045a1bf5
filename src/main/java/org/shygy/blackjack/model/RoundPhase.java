package org.shygy.blackjack.model;

public enum RoundPhase {
    BETTING,
    INITIAL_DEAL,
    INSURANCE_OFFER,
    IMMEDIATE_SETTLEMENT,
    SPLIT_OFFER,
    PLAYER_TURN,
    DEALER_TURN,
    SETTLEMENT,
    COMPLETE
}
