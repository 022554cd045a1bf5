package org.shygy.blackjack.model.rules;

import org.junit.jupiter.api.Test;
import org.shygy.blackjack.model.Card;
import org.shygy.blackjack.model.Hand;
import org.shygy.blackjack.model.Outcome;
import org.shygy.blackjack.model.PlayerHand;

import static org.assertj.core.api.Assertions.*;
import static org.shygy.blackjack.model.Card.Rank.*;
import static org.shygy.blackjack.model.Cards.c;

class PayoutRulesTest {

    private static <H extends Hand> H with(H h, Card.Rank... ranks) {
        for (Card.Rank r : ranks) h.add(c(r));
        return h;
    }

    // --------------------------------------------------------------
    // settle / credit
    // --------------------------------------------------------------
    @Test
    void settle_blackjackPaie3Pour2Tronque() {
        assertThat(PayoutRules.settle(Outcome.BLACKJACK, 10)).isEqualTo(15);
        assertThat(PayoutRules.settle(Outcome.BLACKJACK, 11)).isEqualTo(16);
        assertThat(PayoutRules.settle(Outcome.BLACKJACK, 1)).isEqualTo(1);
    }

    @Test
    void settle_gainPerteEgalite() {
        assertThat(PayoutRules.settle(Outcome.WIN, 10)).isEqualTo(10);
        assertThat(PayoutRules.settle(Outcome.PUSH, 10)).isZero();
        assertThat(PayoutRules.settle(Outcome.LOSE, 10)).isEqualTo(-10);
        assertThat(PayoutRules.settle(Outcome.BUST, 10)).isEqualTo(-10);
    }

    @Test
    void settle_assurance() {
        assertThat(PayoutRules.settle(Outcome.INSURANCE_WON, 10)).isEqualTo(10);
        assertThat(PayoutRules.settle(Outcome.INSURANCE_LOST, 10)).isEqualTo(-10);
        assertThat(PayoutRules.credit(Outcome.INSURANCE_WON, 10)).isEqualTo(20);
    }

    @Test
    void credit_rendLaMisePlusLeGain() {
        assertThat(PayoutRules.credit(Outcome.BLACKJACK, 10)).isEqualTo(25);
        assertThat(PayoutRules.credit(Outcome.WIN, 10)).isEqualTo(20);
        assertThat(PayoutRules.credit(Outcome.PUSH, 10)).isEqualTo(10);
        assertThat(PayoutRules.credit(Outcome.LOSE, 10)).isZero();
        assertThat(PayoutRules.credit(Outcome.WIN, 0)).isZero();
    }

    // --------------------------------------------------------------
    // natural
    // --------------------------------------------------------------
    @Test
    void natural_lesQuatreCas() {
        Hand bj = with(new Hand(), ACE, KING);
        Hand twenty = with(new Hand(), KING, QUEEN);

        assertThat(PayoutRules.natural(bj, with(new Hand(), ACE, QUEEN))).contains(Outcome.PUSH);
        assertThat(PayoutRules.natural(bj, twenty)).contains(Outcome.BLACKJACK);
        assertThat(PayoutRules.natural(twenty, bj)).contains(Outcome.LOSE);
        assertThat(PayoutRules.natural(twenty, with(new Hand(), NINE, NINE))).isEmpty();
    }

    // --------------------------------------------------------------
    // compare
    // --------------------------------------------------------------
    @Test
    void compare_joueurBusteQuelQueSoitLeCroupier() {
        PlayerHand p = with(new PlayerHand(10), KING, QUEEN, FIVE);
        Hand dealerBust = with(new Hand(), KING, SIX, NINE);

        assertThat(PayoutRules.compare(p, dealerBust)).isEqualTo(Outcome.BUST);
    }

    @Test
    void compare_croupierBusteOuTotalInferieur() {
        PlayerHand p = with(new PlayerHand(10), KING, EIGHT);

        assertThat(PayoutRules.compare(p, with(new Hand(), KING, SIX, NINE))).isEqualTo(Outcome.WIN);
        assertThat(PayoutRules.compare(p, with(new Hand(), KING, SEVEN))).isEqualTo(Outcome.WIN);
        assertThat(PayoutRules.compare(p, with(new Hand(), KING, EIGHT))).isEqualTo(Outcome.PUSH);
        assertThat(PayoutRules.compare(p, with(new Hand(), KING, NINE))).isEqualTo(Outcome.LOSE);
    }

    @Test
    void compare_21ApresSplitNestPasUnBlackjack() {
        PlayerHand p = with(new PlayerHand(10), ACE, KING);
        p.setSplit(true);

        assertThat(PayoutRules.compare(p, with(new Hand(), KING, SEVEN))).isEqualTo(Outcome.WIN);
    }
}
