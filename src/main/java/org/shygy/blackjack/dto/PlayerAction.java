package org.shygy.blackjack.dto;

public enum PlayerAction { HIT, STAND, DOUBLE }
