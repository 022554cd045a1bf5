package org.shygy.blackjack.model;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.security.SecureRandom;
import java.util.*;

/**
 * Sabot partagé par toutes les manches d'une session.
 * <p>
 * Un sabot vide n'est jamais visible de l'extérieur : {@link #draw()} recompose
 * un sabot complet avant de tirer.
 */
@Slf4j
public class Shoe {
    public static final int CARDS_PER_DECK = 52;
    public static final double DEFAULT_RESHUFFLE_THRESHOLD = 0.2;

    private final Deque<Card> cards = new ArrayDeque<>();
    private final Random rnd;

    @Getter private final int decks;
    @Getter private final double reshuffleThreshold;
    /** Taille du sabot au dernier mélange complet. */
    @Getter private int capacity;
    @Getter private int reshuffleCount;

    public Shoe(int decks, double reshuffleThreshold, Random rnd) {
        if (decks < 1) throw new IllegalArgumentException("Au moins un paquet requis");
        if (reshuffleThreshold < 0 || reshuffleThreshold > 1)
            throw new IllegalArgumentException("Seuil de mélange hors de [0, 1]");
        this.decks = decks;
        this.reshuffleThreshold = reshuffleThreshold;
        this.rnd = Objects.requireNonNull(rnd);
        refill();
    }

    public Shoe(int decks) {
        this(decks, DEFAULT_RESHUFFLE_THRESHOLD, new SecureRandom());
    }

    public static Shoe create(int decks) {
        return new Shoe(decks);
    }

    /**
     * Sabot dont les premières cartes sont imposées, dans l'ordre de tirage.
     * Une fois ces cartes épuisées, le sabot se recompose normalement.
     */
    public static Shoe stacked(int decks, List<Card> topFirst, Random rnd) {
        return stacked(decks, DEFAULT_RESHUFFLE_THRESHOLD, topFirst, rnd);
    }

    public static Shoe stacked(int decks, double reshuffleThreshold, List<Card> topFirst, Random rnd) {
        Shoe shoe = new Shoe(decks, reshuffleThreshold, rnd);
        shoe.cards.clear();
        shoe.cards.addAll(topFirst);
        return shoe;
    }

    public Card draw() {
        if (cards.isEmpty()) {
            log.info("Sabot vide, nouveau sabot de {} paquets", decks);
            reshuffle();
        }
        return cards.pollFirst();
    }

    public boolean needsReshuffle() {
        return cards.size() < capacity * reshuffleThreshold;
    }

    /** Mélange complet : sabot neuf de {@code decks × 52} cartes. */
    public void reshuffle() {
        refill();
        reshuffleCount++;
    }

    public int size() {
        return cards.size();
    }

    private void refill() {
        List<Card> tmp = new ArrayList<>(decks * CARDS_PER_DECK);
        for (int d = 0; d < decks; d++) {
            for (Card.Suit s : Card.Suit.values())
                for (Card.Rank r : Card.Rank.values()) tmp.add(new Card(r, s));
        }
        Collections.shuffle(tmp, rnd);
        cards.clear();
        cards.addAll(tmp);
        capacity = cards.size();
    }
}
