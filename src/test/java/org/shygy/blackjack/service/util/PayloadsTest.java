package org.shygy.blackjack.service.util;

import org.junit.jupiter.api.Test;
import org.shygy.blackjack.model.Hand;
import org.shygy.blackjack.model.PlayerHand;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.shygy.blackjack.model.Card.Rank.*;
import static org.shygy.blackjack.model.Cards.c;

class PayloadsTest {

    final Payloads payloads = new Payloads();

    private static PlayerHand asEtRoi(boolean split) {
        PlayerHand h = new PlayerHand(10);
        h.add(c(ACE));
        h.add(c(KING));
        h.setSplit(split);
        return h;
    }

    @Test
    void hand_blackjackNaturel() {
        Map<String, Object> m = payloads.hand(asEtRoi(false));

        assertThat(m).containsEntry("blackjack", true).containsEntry("total", 21);
    }

    @Test
    void hand_21ApresSplit_pasUnBlackjack() {
        PlayerHand h = asEtRoi(true);

        assertThat(h.isBlackjack()).isFalse();
        assertThat(payloads.hand(h)).containsEntry("blackjack", false)
                .containsEntry("total", 21)
                .containsEntry("split", true);
    }

    @Test
    void hand_croupier_sansChampsDeMise() {
        Hand dealer = new Hand();
        dealer.add(c(ACE));
        dealer.add(c(QUEEN));

        assertThat(payloads.hand(dealer)).containsEntry("blackjack", true).doesNotContainKey("bet");
    }
}
