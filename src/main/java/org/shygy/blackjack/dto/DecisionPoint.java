package org.shygy.blackjack.dto;

public enum DecisionPoint { BET, INSURANCE, SPLIT, ACTION, PLAY_AGAIN, CONFIRM_CANCEL }
