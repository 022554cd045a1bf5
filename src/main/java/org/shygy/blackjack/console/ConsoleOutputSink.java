package org.shygy.blackjack.console;

import org.shygy.blackjack.dto.RoundEvent;
import org.shygy.blackjack.service.io.OutputSink;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.List;
import java.util.Map;

/** Une ligne (ou un petit bloc) par événement de manche. */
@Component
public class ConsoleOutputSink implements OutputSink {
    private final PrintStream out;

    public ConsoleOutputSink() {
        this(System.out);
    }

    public ConsoleOutputSink(PrintStream out) {
        this.out = out;
    }

    @Override
    public void emit(RoundEvent event) {
        Map<String, Object> p = event.getPayload();
        switch (event.getType()) {
            case "BET_PLACED" -> out.println("Bet placed: " + p.get("bet") + " Rocks.");
            case "BET_REJECTED" -> out.println("Bet refused: " + p.get("amount") + " Rocks (you have " + p.get("balance") + ").");
            case "HAND_START" -> {
                out.println();
                out.println("--- New Round ---");
                out.println("Your initial hand: " + hand(p.get("player")));
                out.println("Dealer showing: [" + ((Map<?, ?>) p.get("dealer")).get("upCard") + ", ?]");
            }
            case "INSURANCE_RESULT" -> {
                if (Boolean.TRUE.equals(p.get("taken")))
                    out.println("Insurance " + ("INSURANCE_WON".equals(p.get("outcome"))
                            ? "pays " + p.get("credit") + " Rocks! Dealer has Blackjack."
                            : "lost (" + p.get("stake") + " Rocks). Dealer doesn't have Blackjack."));
                else out.println("No insurance taken.");
            }
            case "SPLIT" -> {
                out.println("Split your hand.");
                for (Object h : (List<?>) p.get("hands")) out.println("  " + hand(h));
            }
            case "PLAYER_TURN" -> out.println("\nHand " + ((Integer) p.get("hand") + 1) + ": " + hand(p.get("state")));
            case "ACTION_RESULT" -> out.println(p.get("action") + " -> " + hand(p.get("state")));
            case "HAND_RESULT" -> out.println(label((Integer) p.get("hand")) + ": " + p.get("outcome") + " (" + signed(p.get("net")) + ")");
            case "DEALER_TURN_START" -> out.println("\nDealer's turn. Dealer's hand: " + hand(p.get("dealer")));
            case "DEALER_TURN_UPDATE" -> out.println("Dealer hits. " + hand(p.get("dealer")));
            case "DEALER_TURN_END" -> out.println("Dealer stands on " + ((Map<?, ?>) p.get("dealer")).get("total") + ".");
            case "PAYOUTS" -> {
                out.println("\n--- Final Hands ---");
                out.println("Dealer's hand: " + hand(p.get("dealer")));
                out.println("Round result: " + signed(p.get("net")) + " Rocks. Balance: " + p.get("balance") + " Rocks.");
            }
            case "ROUND_CANCELLED" -> out.println("Round abandoned. You still have " + p.get("balance") + " Rocks.");
            case "RESHUFFLE" -> out.println("\nDeck is getting low. Reshuffling...");
            case "REFILL" -> out.println("You're out of Rocks! Here's " + p.get("balance") + " more to keep playing.");
            case "SESSION_END" -> out.println("\nThanks for playing! You ended with " + p.get("balance") + " Rocks.");
            default -> { }
        }
    }

    private static String label(int index) {
        return index < 0 ? "Insurance" : "Hand " + (index + 1);
    }

    private static String hand(Object o) {
        Map<?, ?> h = (Map<?, ?>) o;
        return h.get("cards") + ", value: " + h.get("total");
    }

    private static String signed(Object n) {
        long v = ((Number) n).longValue();
        return v > 0 ? "+" + v : String.valueOf(v);
    }
}
