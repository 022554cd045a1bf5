package org.shygy.blackjack.dto;

import org.shygy.blackjack.model.SessionStats;

public record SessionResult(long balance, SessionStats stats) {}
