package org.shygy.blackjack.service;

import org.junit.jupiter.api.Test;
import org.shygy.blackjack.model.RoundState;
import org.shygy.blackjack.model.Shoe;
import org.shygy.blackjack.model.Wallet;

import static org.assertj.core.api.Assertions.*;

class WalletServiceTest {

    WalletService service = new WalletService();

    @Test
    void crediterDebiter() {
        Wallet w = service.ouvrir(100);

        service.crediter(w, 15);
        service.debiter(w, 40);

        assertThat(w.getSolde()).isEqualTo(75);
    }

    @Test
    void debiter_soldeInsuffisant() {
        Wallet w = service.ouvrir(10);

        assertThatThrownBy(() -> service.debiter(w, 11))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Solde insuffisant");
        assertThat(w.getSolde()).isEqualTo(10);
    }

    @Test
    void recharger_uniquementSiEpuise() {
        Wallet w = service.ouvrir(0);

        assertThat(service.recharger(w, 50)).isTrue();
        assertThat(w.getSolde()).isEqualTo(50);
        assertThat(service.recharger(w, 50)).isFalse();
        assertThat(w.getSolde()).isEqualTo(50);
    }

    @Test
    void appliquerManche_reporteLeNet() {
        Wallet w = service.ouvrir(100);
        RoundState r = new RoundState(Shoe.create(1), 100);
        r.debit(15);

        service.appliquerManche(w, r);

        assertThat(w.getSolde()).isEqualTo(85);
    }

    @Test
    void appliquerManche_mancheAbandonnee_soldeInchange() {
        Wallet w = service.ouvrir(100);
        RoundState r = new RoundState(Shoe.create(1), 100);
        r.openHand(10);
        r.debit(10);
        r.cancel();

        service.appliquerManche(w, r);

        assertThat(w.getSolde()).isEqualTo(100);
    }

    @Test
    void appliquerManche_surUnAutreSolde_refuse() {
        Wallet w = service.ouvrir(100);
        RoundState r = new RoundState(Shoe.create(1), 60);

        assertThatThrownBy(() -> service.appliquerManche(w, r)).isInstanceOf(IllegalStateException.class);
    }
}
