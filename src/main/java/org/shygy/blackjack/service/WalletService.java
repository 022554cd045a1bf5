package org.shygy.blackjack.service;

import lombok.extern.slf4j.Slf4j;
import org.shygy.blackjack.model.RoundState;
import org.shygy.blackjack.model.Wallet;
import org.springframework.stereotype.Service;

/** Solde de Rocks de la session. En mémoire uniquement. */
@Slf4j
@Service
public class WalletService {

    public Wallet ouvrir(long soldeInitial) {
        if (soldeInitial < 0) throw new IllegalArgumentException("Solde initial négatif");
        return Wallet.builder().solde(soldeInitial).build();
    }

    public Wallet crediter(Wallet w, long montant) {
        if (montant < 0) throw new IllegalArgumentException("Montant négatif");
        w.setSolde(w.getSolde() + montant);
        return w;
    }

    public Wallet debiter(Wallet w, long montant) {
        if (montant < 0) throw new IllegalArgumentException("Montant négatif");
        if (montant > w.getSolde()) throw new IllegalArgumentException("Solde insuffisant");
        w.setSolde(w.getSolde() - montant);
        return w;
    }

    /** Reporte le résultat d'une manche jouée à partir du solde courant. */
    public Wallet appliquerManche(Wallet w, RoundState r) {
        if (r.getOpeningBalance() != w.getSolde())
            throw new IllegalStateException("Manche ouverte sur un autre solde");
        long delta = r.netDelta();
        return delta >= 0 ? crediter(w, delta) : debiter(w, -delta);
    }

    /** Remet le solde à {@code montant} quand il est épuisé. */
    public boolean recharger(Wallet w, long montant) {
        if (w.getSolde() > 0) return false;
        log.info("Solde épuisé, recharge de {} Rocks", montant);
        w.setSolde(montant);
        return true;
    }
}
