package org.shygy.blackjack.model;

/**
 * Résultat réglé d'une mise.
 *
 * @param handIndex index de la main, {@code -1} pour l'assurance
 * @param stake     montant misé (déjà débité)
 * @param credit    montant rendu au solde
 */
public record HandResult(int handIndex, Outcome outcome, long stake, long credit) {
    public static final int INSURANCE = -1;

    public long net() {
        return credit - stake;
    }
}
