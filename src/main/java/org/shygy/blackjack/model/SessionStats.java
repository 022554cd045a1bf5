package org.shygy.blackjack.model;

import lombok.Data;

@Data
public class SessionStats {
    private int roundsPlayed;
    private int roundsWon;
    private int roundsLost;
    private int roundsPushed;
    private long biggestWin;
    private long net;
    private int refills;

    public void record(RoundState round) {
        if (round.isCancelled() || round.getHands().isEmpty()) return; // abandon : rien n'a été joué
        long delta = round.netDelta();
        roundsPlayed++;
        net += delta;
        if (delta > 0) {
            roundsWon++;
            biggestWin = Math.max(biggestWin, delta);
        } else if (delta < 0) {
            roundsLost++;
        } else {
            roundsPushed++;
        }
    }
}
