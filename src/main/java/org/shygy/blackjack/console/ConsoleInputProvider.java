package org.shygy.blackjack.console;

import org.shygy.blackjack.dto.Decision;
import org.shygy.blackjack.dto.PlayerAction;
import org.shygy.blackjack.dto.Prompt;
import org.shygy.blackjack.service.io.InputProvider;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.util.Set;
import java.util.function.Function;

/**
 * Lit les décisions au clavier. Toute saisie invalide est redemandée ici et n'atteint
 * jamais le moteur. Fin de flux = abandon confirmé.
 */
public class ConsoleInputProvider implements InputProvider {
    private static final Set<String> QUIT = Set.of("q", "quit", "exit");

    private final BufferedReader in;
    private final PrintStream out;

    public ConsoleInputProvider(BufferedReader in, PrintStream out) {
        this.in = in;
        this.out = out;
    }

    @Override
    public Decision request(Prompt prompt) {
        return switch (prompt.point()) {
            case BET -> bet(prompt.balance());
            case INSURANCE -> yesNo("Insurance costs " + prompt.insuranceCost() + " Rocks. Take insurance? (y/n): ",
                    Decision.InsuranceChoice::new);
            case SPLIT -> yesNo("You have a pair. Split your hand? (y/n): ", Decision.SplitChoice::new);
            case ACTION -> action(prompt.actions());
            case PLAY_AGAIN -> yesNo("Play again? (y/n): ", Decision.PlayAgain::new);
            case CONFIRM_CANCEL -> confirm();
        };
    }

    private Decision bet(long balance) {
        while (true) {
            out.println("You have " + balance + " Rocks.");
            String line = read("How much would you like to bet? ");
            if (line == null || QUIT.contains(line)) return new Decision.Cancel();
            try {
                long bet = Long.parseLong(line);
                if (bet <= 0) out.println("Please enter a positive bet amount.");
                else if (bet > balance) out.println("You don't have enough Rocks. You have " + balance + " Rocks.");
                else return new Decision.BetAmount(bet);
            } catch (NumberFormatException e) {
                out.println("Please enter a valid number.");
            }
        }
    }

    private Decision action(Set<PlayerAction> actions) {
        boolean canDouble = actions.contains(PlayerAction.DOUBLE);
        String question = canDouble ? "Hit, Stand, or Double Down? (h/s/d): " : "Hit or Stand? (h/s): ";
        while (true) {
            String line = read(question);
            if (line == null || QUIT.contains(line)) return new Decision.Cancel();
            switch (line) {
                case "h" -> { return new Decision.Action(PlayerAction.HIT); }
                case "s" -> { return new Decision.Action(PlayerAction.STAND); }
                case "d" -> {
                    if (canDouble) return new Decision.Action(PlayerAction.DOUBLE);
                }
                default -> { }
            }
            out.println(canDouble ? "Invalid choice. Please enter 'h', 's' or 'd'." : "Invalid choice. Please enter 'h' or 's'.");
        }
    }

    private Decision yesNo(String question, Function<Boolean, Decision> answer) {
        while (true) {
            String line = read(question);
            if (line == null || QUIT.contains(line)) return new Decision.Cancel();
            if (line.equals("y")) return answer.apply(true);
            if (line.equals("n")) return answer.apply(false);
            out.println("Invalid choice. Please enter 'y' or 'n'.");
        }
    }

    private Decision confirm() {
        while (true) {
            String line = read("Confirm quit? (y/n): ");
            if (line == null || line.equals("y") || line.equals("yes")) return new Decision.ConfirmCancel(true);
            if (line.equals("n") || line.equals("no")) return new Decision.ConfirmCancel(false);
            out.println("Please enter 'y' or 'n'.");
        }
    }

    private String read(String question) {
        out.print(question);
        out.flush();
        try {
            String line = in.readLine();
            return line == null ? null : line.trim().toLowerCase();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
