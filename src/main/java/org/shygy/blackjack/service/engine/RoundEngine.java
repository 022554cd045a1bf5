package org.shygy.blackjack.service.engine;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.shygy.blackjack.config.BlackjackProperties;
import org.shygy.blackjack.dto.PlayerAction;
import org.shygy.blackjack.dto.RoundEvent;
import org.shygy.blackjack.model.*;
import org.shygy.blackjack.model.rules.DealingRules;
import org.shygy.blackjack.model.rules.HandRules;
import org.shygy.blackjack.model.rules.PayoutRules;
import org.shygy.blackjack.service.io.OutputSink;
import org.shygy.blackjack.service.util.Payloads;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Machine à états d'une manche.
 * <p>
 * Chaque phase de {@link RoundPhase} a sa fonction de transition. Les phases sans décision
 * du joueur (distribution, contrôle des naturels, tour du croupier, règlement) s'enchaînent
 * via {@link #advance(RoundState)}. Une transition appelée hors de sa phase lève
 * {@link IllegalStateException}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RoundEngine {
    private final OutputSink sink;
    private final Payloads payloads;
    private final BlackjackProperties props;

    public RoundState open(Shoe shoe, long balance) {
        return new RoundState(shoe, balance);
    }

    // ---------------------------------------------------------------- BETTING

    /** @return false (sans changement d'état) si la mise est nulle, négative ou dépasse le solde */
    public boolean placeBet(RoundState r, long amount) {
        requirePhase(r, RoundPhase.BETTING);
        if (amount <= 0 || amount > r.getBalance()) {
            log.debug("Mise refusée: {} (solde {})", amount, r.getBalance());
            emit("BET_REJECTED", Map.of("amount", amount, "balance", r.getBalance()));
            return false;
        }
        r.debit(amount);
        r.openHand(amount);
        r.moveTo(RoundPhase.INITIAL_DEAL);
        emit("BET_PLACED", Map.of("bet", amount, "balance", r.getBalance()));
        return true;
    }

    // ---------------------------------------------------------------- INITIAL_DEAL

    public void dealInitial(RoundState r) {
        requirePhase(r, RoundPhase.INITIAL_DEAL);
        DealingRules.dealInitial(r);
        emit("HAND_START", Map.of(
                "player", payloads.hand(r.getHands().get(0)),
                "dealer", payloads.dealerUp(r)
        ));
        r.moveTo(insuranceAvailable(r) ? RoundPhase.INSURANCE_OFFER : RoundPhase.IMMEDIATE_SETTLEMENT);
    }

    // ---------------------------------------------------------------- INSURANCE_OFFER

    /** As visible chez le croupier, et de quoi payer la moitié de la mise. */
    public boolean insuranceAvailable(RoundState r) {
        Card up = r.dealerUpCard();
        long stake = r.getBet() / 2;
        return up != null && up.getRank() == Card.Rank.ACE && stake >= 1 && r.getBalance() >= stake;
    }

    /** Ne règle que l'assurance ; la mise principale passe ensuite par le contrôle des naturels. */
    public void resolveInsurance(RoundState r, boolean taken) {
        requirePhase(r, RoundPhase.INSURANCE_OFFER);
        if (taken) {
            long stake = r.getBet() / 2;
            r.debit(stake);
            r.takeInsurance(stake);
            Outcome o = r.getDealer().isBlackjack() ? Outcome.INSURANCE_WON : Outcome.INSURANCE_LOST;
            HandResult res = record(r, HandResult.INSURANCE, o, stake);
            Map<String, Object> p = new LinkedHashMap<>(payloads.result(res));
            p.put("taken", true);
            p.put("balance", r.getBalance());
            emit("INSURANCE_RESULT", p);
        } else {
            emit("INSURANCE_RESULT", Map.of("taken", false, "balance", r.getBalance()));
        }
        r.moveTo(RoundPhase.IMMEDIATE_SETTLEMENT);
    }

    // ---------------------------------------------------------------- IMMEDIATE_SETTLEMENT

    public void checkNaturals(RoundState r) {
        requirePhase(r, RoundPhase.IMMEDIATE_SETTLEMENT);
        Optional<Outcome> natural = PayoutRules.natural(r.getHands().get(0), r.getDealer());
        if (natural.isPresent()) {
            settleHand(r, 0, natural.get());
            finish(r);
            return;
        }
        if (splitAvailable(r)) {
            r.moveTo(RoundPhase.SPLIT_OFFER);
        } else {
            startPlayerTurn(r);
        }
    }

    // ---------------------------------------------------------------- SPLIT_OFFER

    public boolean splitAvailable(RoundState r) {
        return r.getHands().size() == 1
                && HandRules.isPair(r.getHands().get(0).getCards())
                && r.getBalance() >= r.getBet();
    }

    public void resolveSplit(RoundState r, boolean accept) {
        requirePhase(r, RoundPhase.SPLIT_OFFER);
        if (accept) {
            if (!splitAvailable(r)) throw new IllegalStateException("Split impossible");
            r.debit(r.getBet());
            DealingRules.split(r);
            emit("SPLIT", Map.of(
                    "hands", payloads.hands(r),
                    "balance", r.getBalance()
            ));
        }
        startPlayerTurn(r);
    }

    // ---------------------------------------------------------------- PLAYER_TURN

    public Set<PlayerAction> availableActions(RoundState r) {
        if (r.getPhase() != RoundPhase.PLAYER_TURN) return Set.of();
        PlayerHand h = r.currentHand();
        if (h == null || h.isDone()) return Set.of();
        EnumSet<PlayerAction> actions = EnumSet.of(PlayerAction.HIT, PlayerAction.STAND);
        if (h.size() == 2 && !h.isDoubled() && r.getBalance() >= h.getBet()) actions.add(PlayerAction.DOUBLE);
        return actions;
    }

    public void applyAction(RoundState r, PlayerAction action) {
        requirePhase(r, RoundPhase.PLAYER_TURN);
        if (!availableActions(r).contains(action))
            throw new IllegalStateException("Action non disponible: " + action);

        int idx = r.getCurrentHandIndex();
        PlayerHand h = r.currentHand();
        switch (action) {
            case HIT -> h.add(r.getShoe().draw());
            case STAND -> h.setStanding(true);
            case DOUBLE -> {
                long add = h.getBet();
                r.debit(add);
                h.setBet(h.getBet() + add);
                h.setDoubled(true);
                h.add(r.getShoe().draw());
                // une seule carte, puis stand même en cas de bust
                h.setStanding(true);
            }
        }
        emit("ACTION_RESULT", Map.of(
                "hand", idx,
                "action", action.name(),
                "state", payloads.hand(h),
                "balance", r.getBalance()
        ));
        if (h.isBust()) settleHand(r, idx, Outcome.BUST);
        if (h.isDone()) nextHandOrDealer(r);
    }

    private void startPlayerTurn(RoundState r) {
        r.focus(0);
        r.moveTo(RoundPhase.PLAYER_TURN);
        emit("PLAYER_TURN", Map.of("hand", 0, "state", payloads.hand(r.currentHand())));
    }

    private void nextHandOrDealer(RoundState r) {
        for (int i = r.getCurrentHandIndex() + 1; i < r.getHands().size(); i++) {
            if (!r.getHands().get(i).isDone()) {
                r.focus(i);
                emit("PLAYER_TURN", Map.of("hand", i, "state", payloads.hand(r.currentHand())));
                return;
            }
        }
        boolean anyAlive = r.getHands().stream().anyMatch(h -> !h.isBust());
        r.moveTo(anyAlive ? RoundPhase.DEALER_TURN : RoundPhase.SETTLEMENT);
    }

    // ---------------------------------------------------------------- DEALER_TURN

    public void dealerTurn(RoundState r) {
        requirePhase(r, RoundPhase.DEALER_TURN);
        Hand dealer = r.getDealer();
        emit("DEALER_TURN_START", Map.of("dealer", payloads.hand(dealer)));
        while (dealer.value() < props.getDealerStandValue()) {
            dealer.add(r.getShoe().draw());
            emit("DEALER_TURN_UPDATE", Map.of("dealer", payloads.hand(dealer)));
        }
        emit("DEALER_TURN_END", Map.of("dealer", payloads.hand(dealer)));
        r.moveTo(RoundPhase.SETTLEMENT);
    }

    // ---------------------------------------------------------------- SETTLEMENT

    public void settle(RoundState r) {
        requirePhase(r, RoundPhase.SETTLEMENT);
        for (int i = 0; i < r.getHands().size(); i++) {
            PlayerHand h = r.getHands().get(i);
            if (!h.isSettled()) settleHand(r, i, PayoutRules.compare(h, r.getDealer()));
        }
        finish(r);
    }

    // ---------------------------------------------------------------- flux

    /** Enchaîne les phases automatiques jusqu'au prochain point de décision ou la fin de manche. */
    public void advance(RoundState r) {
        while (true) {
            switch (r.getPhase()) {
                case INITIAL_DEAL -> dealInitial(r);
                case IMMEDIATE_SETTLEMENT -> checkNaturals(r);
                case DEALER_TURN -> dealerTurn(r);
                case SETTLEMENT -> settle(r);
                default -> { return; }
            }
        }
    }

    /** Abandon de la manche : rien n'est réglé, les mises engagées sont rendues. */
    public void cancel(RoundState r) {
        if (r.isComplete()) throw new IllegalStateException("Manche déjà terminée");
        log.debug("Manche annulée en phase {}", r.getPhase());
        RoundPhase from = r.getPhase();
        long refunded = -r.netDelta();
        r.cancel();
        emit("ROUND_CANCELLED", Map.of(
                "phase", from.name(),
                "refunded", refunded,
                "balance", r.getBalance()
        ));
    }

    private void finish(RoundState r) {
        r.moveTo(RoundPhase.COMPLETE);
        List<Map<String, Object>> pay = new ArrayList<>();
        for (HandResult res : r.getResults()) pay.add(payloads.result(res));
        log.debug("Manche terminée: net {} (solde {})", r.netDelta(), r.getBalance());
        emit("PAYOUTS", Map.of(
                "payouts", pay,
                "dealer", payloads.hand(r.getDealer()),
                "hands", payloads.hands(r),
                "net", r.netDelta(),
                "balance", r.getBalance()
        ));
    }

    private void settleHand(RoundState r, int idx, Outcome outcome) {
        PlayerHand h = r.getHands().get(idx);
        HandResult res = record(r, idx, outcome, h.getBet());
        h.setResult(res);
        emit("HAND_RESULT", payloads.result(res));
    }

    private HandResult record(RoundState r, int idx, Outcome outcome, long stake) {
        HandResult res = new HandResult(idx, outcome, stake, PayoutRules.credit(outcome, stake));
        r.record(res);
        return res;
    }

    private void requirePhase(RoundState r, RoundPhase expected) {
        if (r.getPhase() != expected)
            throw new IllegalStateException("Hors phase " + expected + " (phase " + r.getPhase() + ")");
    }

    private void emit(String type, Map<String, Object> payload) {
        sink.emit(RoundEvent.builder().type(type).payload(payload).build());
    }
}
