package org.shygy.blackjack.service.engine;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.shygy.blackjack.dto.Decision;
import org.shygy.blackjack.dto.DecisionPoint;
import org.shygy.blackjack.dto.Prompt;
import org.shygy.blackjack.model.RoundState;
import org.shygy.blackjack.model.Shoe;
import org.shygy.blackjack.service.io.InputProvider;
import org.springframework.stereotype.Service;

/** Joue une manche en interrogeant l'InputProvider à chaque point de décision. */
@Slf4j
@Service
@RequiredArgsConstructor
public class RoundService {
    private final RoundEngine engine;

    public RoundState play(Shoe shoe, long balance, InputProvider input) {
        RoundState r = engine.open(shoe, balance);
        while (!r.isComplete()) {
            switch (r.getPhase()) {
                case BETTING -> {
                    Decision d = ask(input, Prompt.of(DecisionPoint.BET, r), r);
                    if (d != null) engine.placeBet(r, expect(d, Decision.BetAmount.class).amount());
                }
                case INSURANCE_OFFER -> {
                    Decision d = ask(input, Prompt.of(DecisionPoint.INSURANCE, r), r);
                    if (d != null) engine.resolveInsurance(r, expect(d, Decision.InsuranceChoice.class).take());
                }
                case SPLIT_OFFER -> {
                    Decision d = ask(input, Prompt.of(DecisionPoint.SPLIT, r), r);
                    if (d != null) engine.resolveSplit(r, expect(d, Decision.SplitChoice.class).split());
                }
                case PLAYER_TURN -> {
                    Decision d = ask(input, Prompt.action(r, engine.availableActions(r)), r);
                    if (d != null) engine.applyAction(r, expect(d, Decision.Action.class).action());
                }
                default -> engine.advance(r);
            }
        }
        return r;
    }

    /**
     * Demande de confirmation après un {@link Decision.Cancel}.
     *
     * @return true si le joueur confirme l'abandon
     */
    public boolean confirmCancel(InputProvider input, Prompt prompt) {
        Decision d = input.request(prompt);
        return expect(d, Decision.ConfirmCancel.class).confirmed();
    }

    /** @return la décision, ou null si la manche vient d'être annulée */
    private Decision ask(InputProvider input, Prompt prompt, RoundState r) {
        while (true) {
            Decision d = input.request(prompt);
            if (!(d instanceof Decision.Cancel)) return d;
            if (confirmCancel(input, Prompt.of(DecisionPoint.CONFIRM_CANCEL, r))) {
                engine.cancel(r);
                return null;
            }
            log.debug("Abandon non confirmé, retour à {}", prompt.point());
        }
    }

    static <T extends Decision> T expect(Decision d, Class<T> type) {
        if (!type.isInstance(d))
            throw new IllegalArgumentException("Décision inattendue: " + d + " (attendu " + type.getSimpleName() + ")");
        return type.cast(d);
    }
}
