package org.shygy.blackjack.dto;

/**
 * Réponse d'un {@code InputProvider} à un point de décision.
 * Les valeurs arrivent déjà validées (numériques, positives, option proposée).
 */
public interface Decision {

    record BetAmount(long amount) implements Decision {}

    record InsuranceChoice(boolean take) implements Decision {}

    record SplitChoice(boolean split) implements Decision {}

    record Action(PlayerAction action) implements Decision {}

    record PlayAgain(boolean again) implements Decision {}

    record Cancel() implements Decision {}

    record ConfirmCancel(boolean confirmed) implements Decision {}
}
