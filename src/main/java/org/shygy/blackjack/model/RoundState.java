package org.shygy.blackjack.model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * État d'une manche. Créé par manche, muté uniquement par le RoundEngine.
 * <p>
 * Pas de setters : chaque mutation passe par une méthode nommée qui garde le solde cohérent.
 */
@Getter
public class RoundState {
    private final Shoe shoe;
    private final long openingBalance;

    private RoundPhase phase = RoundPhase.BETTING;
    private long balance;
    private long bet = 0;
    private long insuranceStake = 0;

    private final Hand dealer = new Hand();
    private final List<PlayerHand> hands = new ArrayList<>();
    private int currentHandIndex = 0;

    private boolean cancelled = false;
    private final List<HandResult> results = new ArrayList<>();

    public RoundState(Shoe shoe, long balance) {
        this.shoe = shoe;
        this.openingBalance = balance;
        this.balance = balance;
    }

    public List<PlayerHand> getHands() {
        return Collections.unmodifiableList(hands);
    }

    public List<HandResult> getResults() {
        return Collections.unmodifiableList(results);
    }

    public void moveTo(RoundPhase next) {
        this.phase = next;
    }

    public void debit(long amount) {
        if (amount < 0) throw new IllegalArgumentException("Montant négatif");
        if (amount > balance) throw new IllegalStateException("Solde insuffisant");
        balance -= amount;
    }

    /** Enregistre un résultat et crédite le solde de ce qu'il rapporte. */
    public void record(HandResult res) {
        if (res.credit() < 0) throw new IllegalArgumentException("Crédit négatif");
        balance += res.credit();
        results.add(res);
    }

    /** Ouvre la main du joueur pour la mise principale. */
    public PlayerHand openHand(long amount) {
        this.bet = amount;
        hands.clear();
        PlayerHand h = new PlayerHand(amount);
        hands.add(h);
        return h;
    }

    public void addSplitHand(PlayerHand h) {
        if (hands.size() != 1) throw new IllegalStateException("Split impossible");
        hands.add(h);
    }

    public void takeInsurance(long stake) {
        this.insuranceStake = stake;
    }

    public void focus(int handIndex) {
        if (handIndex < 0 || handIndex >= hands.size())
            throw new IllegalArgumentException("Main inconnue: " + handIndex);
        this.currentHandIndex = handIndex;
    }

    /** Abandon : la manche se défait, le solde revient à celui d'ouverture. */
    public void cancel() {
        this.cancelled = true;
        this.balance = openingBalance;
        results.clear();
        this.phase = RoundPhase.COMPLETE;
    }

    public PlayerHand currentHand() {
        return hands.isEmpty() ? null : hands.get(currentHandIndex);
    }

    public Card dealerUpCard() {
        return dealer.getCards().isEmpty() ? null : dealer.getCards().get(0);
    }

    public boolean isComplete() {
        return phase == RoundPhase.COMPLETE;
    }

    /** Variation du solde sur la manche. */
    public long netDelta() {
        return balance - openingBalance;
    }
}
