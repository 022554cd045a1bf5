package org.shygy.blackjack.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.shygy.blackjack.config.BlackjackProperties;
import org.shygy.blackjack.dto.Decision;
import org.shygy.blackjack.dto.DecisionPoint;
import org.shygy.blackjack.dto.Prompt;
import org.shygy.blackjack.dto.RoundEvent;
import org.shygy.blackjack.dto.SessionResult;
import org.shygy.blackjack.model.RoundState;
import org.shygy.blackjack.model.SessionStats;
import org.shygy.blackjack.model.Shoe;
import org.shygy.blackjack.model.Wallet;
import org.shygy.blackjack.service.engine.RoundService;
import org.shygy.blackjack.service.io.InputProvider;
import org.shygy.blackjack.service.io.OutputSink;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Random;

/**
 * Enchaîne les manches d'une session : mélange entre deux manches, recharge du solde
 * épuisé, rejouer / quitter.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GameSessionService {
    private final RoundService rounds;
    private final WalletService wallets;
    private final BlackjackProperties props;
    private final Random shuffleRandom;
    private final OutputSink sink;

    public Shoe newShoe() {
        return new Shoe(props.getDecks(), props.getReshuffleThreshold(), shuffleRandom);
    }

    public SessionResult run(InputProvider input) {
        return run(newShoe(), input);
    }

    public SessionResult run(Shoe shoe, InputProvider input) {
        Wallet wallet = wallets.ouvrir(props.getStartingBalance());
        SessionStats stats = new SessionStats();

        boolean again = true;
        while (again) {
            prepareRound(shoe, wallet, stats);
            RoundState r = rounds.play(shoe, wallet.getSolde(), input);
            wallets.appliquerManche(wallet, r);
            stats.record(r);
            if (r.isCancelled()) break;
            again = askPlayAgain(input, wallet.getSolde());
        }

        log.info("Fin de session: solde {} Rocks, {} manches, net {}",
                wallet.getSolde(), stats.getRoundsPlayed(), stats.getNet());
        emit("SESSION_END", Map.of(
                "balance", wallet.getSolde(),
                "roundsPlayed", stats.getRoundsPlayed(),
                "roundsWon", stats.getRoundsWon(),
                "roundsLost", stats.getRoundsLost(),
                "roundsPushed", stats.getRoundsPushed(),
                "biggestWin", stats.getBiggestWin(),
                "net", stats.getNet(),
                "refills", stats.getRefills()
        ));
        return new SessionResult(wallet.getSolde(), stats);
    }

    /** Jamais en cours de manche : le sabot n'est remélangé qu'ici. */
    void prepareRound(Shoe shoe, Wallet wallet, SessionStats stats) {
        if (shoe.needsReshuffle()) {
            log.info("Sabot bas ({} / {}), remélange", shoe.size(), shoe.getCapacity());
            shoe.reshuffle();
            emit("RESHUFFLE", Map.of("cards", shoe.size()));
        }
        if (wallets.recharger(wallet, props.getRefillAmount())) {
            stats.setRefills(stats.getRefills() + 1);
            emit("REFILL", Map.of("balance", wallet.getSolde()));
        }
    }

    private boolean askPlayAgain(InputProvider input, long balance) {
        while (true) {
            Decision d = input.request(Prompt.between(DecisionPoint.PLAY_AGAIN, balance));
            if (d instanceof Decision.Cancel) {
                if (rounds.confirmCancel(input, Prompt.between(DecisionPoint.CONFIRM_CANCEL, balance))) return false;
                continue;
            }
            if (d instanceof Decision.PlayAgain p) return p.again();
            throw new IllegalArgumentException("Décision inattendue: " + d + " (attendu PlayAgain)");
        }
    }

    private void emit(String type, Map<String, Object> payload) {
        sink.emit(RoundEvent.builder().type(type).payload(payload).build());
    }
}
